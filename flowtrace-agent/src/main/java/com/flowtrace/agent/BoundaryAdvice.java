package com.flowtrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

import java.lang.reflect.Method;

/**
 * ByteBuddy advice woven into every method of a class accepted by {@link ScopeFilter}.
 *
 * Only forwards to {@link AdviceBoundary}. The exit advice runs on normal return and on throw;
 * it reads the throwable without suppressing it, so the original exception keeps propagating.
 */
public class BoundaryAdvice {

    @Advice.OnMethodEnter
    public static void onEnter(
            @Advice.Origin("#t") String scope,
            @Advice.Origin("#m") String name,
            @Advice.Origin Method method,
            @Advice.AllArguments(readOnly = true) Object[] args) {
        AdviceBoundary.enter(scope, name, method, args);
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(
            @Advice.Origin("#t") String scope,
            @Advice.Origin("#m") String name,
            @Advice.Origin Method method,
            @Advice.Return(typing = Assigner.Typing.DYNAMIC, readOnly = true) Object result,
            @Advice.Thrown(readOnly = true) Throwable thrown) {
        AdviceBoundary.exit(scope, name, method, result, thrown);
    }
}
