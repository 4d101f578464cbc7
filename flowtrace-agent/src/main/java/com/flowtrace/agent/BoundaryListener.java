package com.flowtrace.agent;

import java.util.Map;

/**
 * Receives call boundaries from an {@link InstrumentationBoundary}.
 *
 * Called synchronously on the thread that crosses the boundary. Implementations must not throw;
 * boundaries still guard against it.
 */
public interface BoundaryListener {

    /**
     * @param args declared parameter names mapped to the values bound at entry, in declaration order
     */
    void onCall(String scope, String name, Map<String, Object> args);

    /**
     * @param voidMethod true when the method declares no return value; {@code result} is then null
     */
    void onReturn(String scope, String name, Object result, boolean voidMethod);

    /** {@code thrown} keeps propagating after this returns; listeners only observe it. */
    void onThrow(String scope, String name, Throwable thrown);
}
