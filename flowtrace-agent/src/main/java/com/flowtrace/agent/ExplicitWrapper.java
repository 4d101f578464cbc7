package com.flowtrace.agent;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Targeted tracing of individual objects and callables.
 *
 * Every invocation writes ENTER, then EXIT with the serialized result or EXCEPTION with the
 * throwable's class and message, and hands the result or the very same throwable back to the
 * caller. No {@link ScopeFilter} is consulted: wrapping something is the decision to trace it.
 *
 * Three entry points share the same event logic:
 * <ul>
 *   <li>{@link #proxy(Class, Object)}: a dynamic proxy tracing every interface method</li>
 *   <li>{@link #wrap(String, String, Callable)}: a single {@link Callable}</li>
 *   <li>{@link #enter}/{@link #exit}/{@link #fail}: used by {@link TracedAdvice} for {@code @Traced} methods</li>
 * </ul>
 */
public final class ExplicitWrapper {

    @FunctionalInterface
    public interface TracedBody<T, X extends Throwable> {
        T call() throws X;
    }

    private final Supplier<EventSink> sink;
    private final IntSupplier maxSerializedLength;
    private final TraceClock clock;

    private final ConcurrentHashMap<Method, String[]> parameterNames = new ConcurrentHashMap<>();

    public ExplicitWrapper(EventSink sink, int maxSerializedLength) {
        this(() -> sink, () -> maxSerializedLength, TraceClock.SYSTEM);
    }

    /** The suppliers are consulted on every invocation, so a shared sink can be created lazily. */
    ExplicitWrapper(Supplier<EventSink> sink, IntSupplier maxSerializedLength, TraceClock clock) {
        this.sink = sink;
        this.maxSerializedLength = maxSerializedLength;
        this.clock = clock;
    }

    // -----------------------------------------------------------------------
    // Event primitives
    // -----------------------------------------------------------------------

    /** Logs ENTER and returns the entry timestamp to pass to {@link #exit} or {@link #fail}. */
    public long enter(String scope, String name, Map<String, ?> args) {
        long now = clock.nowMicros();
        try {
            int max = maxSerializedLength.getAsInt();
            Map<String, String> serialized = new LinkedHashMap<>();
            if (args != null) {
                args.forEach((k, v) -> serialized.put(k, ValueSerializer.serialize(v, max)));
            }
            sink.get().log(TraceEvent.enter(now, scope, name, serialized));
        } catch (RuntimeException e) {
            report("ENTER", scope, name, e);
        }
        return now;
    }

    /** Logs EXIT. {@code voidMethod} omits the result field. */
    public void exit(String scope, String name, long entryMicros, Object result, boolean voidMethod) {
        long now = clock.nowMicros();
        try {
            String serialized = voidMethod ? null : ValueSerializer.serialize(result, maxSerializedLength.getAsInt());
            sink.get().log(TraceEvent.exit(now, scope, name, serialized, Math.max(0L, now - entryMicros)));
        } catch (RuntimeException e) {
            report("EXIT", scope, name, e);
        }
    }

    /** Logs EXCEPTION. The caller remains responsible for rethrowing {@code thrown}. */
    public void fail(String scope, String name, long entryMicros, Throwable thrown) {
        long now = clock.nowMicros();
        try {
            sink.get().log(TraceEvent.exception(now, scope, name, thrown, Math.max(0L, now - entryMicros)));
        } catch (RuntimeException e) {
            report("EXCEPTION", scope, name, e);
        }
    }

    /**
     * Runs {@code body} between ENTER and EXIT/EXCEPTION. The result is returned unchanged;
     * anything thrown is rethrown unchanged after the EXCEPTION event.
     */
    public <T, X extends Throwable> T invoke(String scope, String name, Map<String, ?> args,
                                             TracedBody<T, X> body) throws X {
        long entry = enter(scope, name, args);
        T result;
        try {
            result = body.call();
        } catch (Throwable t) {
            fail(scope, name, entry, t);
            throw t;
        }
        exit(scope, name, entry, result, false);
        return result;
    }

    // -----------------------------------------------------------------------
    // Wrappers
    // -----------------------------------------------------------------------

    public <V> TracedCallable<V> wrap(String scope, String name, Callable<V> callable) {
        return new TracedCallable<>(this, scope, name, callable);
    }

    /**
     * Returns a proxy implementing {@code iface} and the other public interfaces of the target's
     * class hierarchy, tracing each interface method call on {@code target}. The scope is the
     * target's class name; {@code equals}, {@code hashCode} and {@code toString} go straight to
     * the target.
     */
    @SuppressWarnings("unchecked")
    public <T> T proxy(Class<T> iface, T target) {
        Objects.requireNonNull(target, "target");
        if (!iface.isInterface()) {
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        }
        if (target instanceof Proxy && Proxy.getInvocationHandler(target) instanceof TracingHandler) {
            return target;
        }
        return (T) Proxy.newProxyInstance(iface.getClassLoader(), interfacesOf(iface, target.getClass()),
            new TracingHandler(target));
    }

    /**
     * {@code iface} first, then every public interface the target's class hierarchy implements
     * that is visible from {@code iface}'s class loader.
     */
    static Class<?>[] interfacesOf(Class<?> iface, Class<?> targetClass) {
        Set<Class<?>> all = new LinkedHashSet<>();
        all.add(iface);
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> c = targetClass; c != null; c = c.getSuperclass()) {
            pending.addAll(Arrays.asList(c.getInterfaces()));
        }
        while (!pending.isEmpty()) {
            Class<?> next = pending.poll();
            if (Modifier.isPublic(next.getModifiers()) && isVisible(next, iface.getClassLoader())) {
                all.add(next);
            }
            pending.addAll(Arrays.asList(next.getInterfaces()));
        }
        return all.toArray(new Class<?>[0]);
    }

    private static boolean isVisible(Class<?> type, ClassLoader loader) {
        try {
            return Class.forName(type.getName(), false, loader) == type;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    /** Returns the object behind a proxy from {@link #proxy}, or {@code candidate} itself. */
    public static Object unwrap(Object candidate) {
        if (candidate instanceof Proxy
                && Proxy.getInvocationHandler(candidate) instanceof TracingHandler handler) {
            return handler.target;
        }
        return candidate;
    }

    private final class TracingHandler implements InvocationHandler {

        private final Object target;
        private final String scope;

        TracingHandler(Object target) {
            this.target = target;
            this.scope = target.getClass().getName();
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                switch (method.getName()) {
                    case "equals":   return args[0] == proxy || target.equals(unwrap(args[0]));
                    case "hashCode": return target.hashCode();
                    default:         return call(method, args);
                }
            }

            String name = method.getName();
            long entry = enter(scope, name, bind(method, args));
            Object result;
            try {
                result = call(method, args);
            } catch (Throwable t) {
                fail(scope, name, entry, t);
                throw t;
            }
            exit(scope, name, entry, result, method.getReturnType() == void.class);
            return result;
        }

        private Object call(Method method, Object[] args) throws Throwable {
            if (!method.canAccess(target)) {
                // non-public interfaces or implementations
                method.trySetAccessible();
            }
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }

        private Map<String, Object> bind(Method method, Object[] args) {
            String[] names = parameterNames.computeIfAbsent(method, m -> namesOf(target.getClass(), m));
            Map<String, Object> bound = new LinkedHashMap<>();
            if (args == null) return bound;
            for (int i = 0; i < args.length; i++) {
                bound.put(i < names.length ? names[i] : "arg" + i, args[i]);
            }
            return bound;
        }
    }

    /** Prefers the implementing method's parameter names over the interface's. */
    private static String[] namesOf(Class<?> targetClass, Method interfaceMethod) {
        try {
            Method impl = targetClass.getMethod(interfaceMethod.getName(), interfaceMethod.getParameterTypes());
            return AdviceBoundary.parameterNames(impl);
        } catch (NoSuchMethodException | SecurityException e) {
            return AdviceBoundary.parameterNames(interfaceMethod);
        }
    }

    private static void report(String kind, String scope, String name, RuntimeException e) {
        System.err.println("[flowtrace] ERROR logging " + kind + " for " + scope + "#" + name + ": " + e);
    }
}
