package com.flowtrace.agent;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * A {@link Callable} traced by an {@link ExplicitWrapper}. Keeps the scope, name and delegate
 * it was created with so other tooling can still tell what it wraps.
 */
public final class TracedCallable<V> implements Callable<V> {

    private final ExplicitWrapper wrapper;
    private final String scope;
    private final String name;
    private final Callable<V> delegate;

    TracedCallable(ExplicitWrapper wrapper, String scope, String name, Callable<V> delegate) {
        this.wrapper = wrapper;
        this.scope = scope;
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public V call() throws Exception {
        return wrapper.invoke(scope, name, Map.of(), delegate::call);
    }

    public String scope() {
        return scope;
    }

    public String name() {
        return name;
    }

    public Callable<V> delegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "traced(" + scope + "#" + name + ")";
    }
}
