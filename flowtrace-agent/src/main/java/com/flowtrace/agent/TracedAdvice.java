package com.flowtrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

import java.lang.reflect.Method;

/**
 * ByteBuddy advice for {@code @Traced} methods. Writes through the process-wide
 * {@link FlowTrace#wrapper()}, so the shared sink is created on first use.
 *
 * The entry timestamp travels from enter to exit advice as the enter return value.
 */
public class TracedAdvice {

    @Advice.OnMethodEnter
    public static long onEnter(
            @Advice.Origin("#t") String scope,
            @Advice.Origin("#m") String name,
            @Advice.Origin Method method,
            @Advice.AllArguments(readOnly = true) Object[] args) {
        return FlowTrace.wrapper().enter(scope, name, AdviceBoundary.bindArguments(method, args));
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(
            @Advice.Origin("#t") String scope,
            @Advice.Origin("#m") String name,
            @Advice.Origin Method method,
            @Advice.Enter long entryMicros,
            @Advice.Return(typing = Assigner.Typing.DYNAMIC, readOnly = true) Object result,
            @Advice.Thrown(readOnly = true) Throwable thrown) {
        if (thrown != null) {
            FlowTrace.wrapper().fail(scope, name, entryMicros, thrown);
        } else {
            FlowTrace.wrapper().exit(scope, name, entryMicros, result, method.getReturnType() == void.class);
        }
    }
}
