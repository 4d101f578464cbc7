package com.flowtrace.agent;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link InstrumentationBoundary} fed by ByteBuddy advice ({@link BoundaryAdvice}).
 *
 * The registered listener lives in a static field because advice is inlined into arbitrary
 * application classes and can only reach it through public static methods. Dispatch is suppressed
 * while the current thread is already inside the listener, so calls the tracer makes itself
 * (a traced {@code toString()} reached while serializing an argument) are not reported.
 * Nothing thrown by the listener reaches the instrumented method.
 */
public final class AdviceBoundary implements InstrumentationBoundary {

    public static final AdviceBoundary INSTANCE = new AdviceBoundary();

    private static volatile BoundaryListener listener;

    private static final ThreadLocal<boolean[]> dispatching =
        ThreadLocal.withInitial(() -> new boolean[1]);

    private AdviceBoundary() {}

    @Override
    public void register(BoundaryListener l) {
        synchronized (AdviceBoundary.class) {
            listener = l;
        }
    }

    @Override
    public void deregister(BoundaryListener l) {
        synchronized (AdviceBoundary.class) {
            if (listener == l) {
                listener = null;
            }
        }
    }

    public static boolean isRegistered(BoundaryListener l) {
        return listener == l;
    }

    // -----------------------------------------------------------------------
    // Called from inlined advice; must stay public static
    // -----------------------------------------------------------------------

    public static void enter(String scope, String name, Method method, Object[] args) {
        BoundaryListener l = listener;
        if (l == null) return;
        boolean[] busy = dispatching.get();
        if (busy[0]) return;
        busy[0] = true;
        try {
            l.onCall(scope, name, bindArguments(method, args));
        } catch (Throwable t) {
            report("enter", scope, name, t);
        } finally {
            busy[0] = false;
        }
    }

    public static void exit(String scope, String name, Method method, Object result, Throwable thrown) {
        BoundaryListener l = listener;
        if (l == null) return;
        boolean[] busy = dispatching.get();
        if (busy[0]) return;
        busy[0] = true;
        try {
            if (thrown != null) {
                l.onThrow(scope, name, thrown);
            } else {
                l.onReturn(scope, name, result, method != null && method.getReturnType() == void.class);
            }
        } catch (Throwable t) {
            report("exit", scope, name, t);
        } finally {
            busy[0] = false;
        }
    }

    /**
     * Pairs argument values with the declared parameter names.
     * Real names need the {@code -parameters} javac flag; otherwise they read "arg0", "arg1", etc.
     */
    public static Map<String, Object> bindArguments(Method method, Object[] args) {
        Map<String, Object> bound = new LinkedHashMap<>();
        if (args == null) return bound;
        String[] names = method != null ? parameterNames(method) : new String[0];
        for (int i = 0; i < args.length; i++) {
            bound.put(i < names.length ? names[i] : "arg" + i, args[i]);
        }
        return bound;
    }

    public static String[] parameterNames(Method method) {
        Parameter[] params = method.getParameters();
        String[] names = new String[params.length];
        for (int i = 0; i < params.length; i++) {
            names[i] = params[i].isNamePresent() ? params[i].getName() : "arg" + i;
        }
        return names;
    }

    private static void report(String phase, String scope, String name, Throwable t) {
        System.err.println("[flowtrace] ERROR in " + phase + " advice for " + scope + "#" + name + ": " + t);
    }
}
