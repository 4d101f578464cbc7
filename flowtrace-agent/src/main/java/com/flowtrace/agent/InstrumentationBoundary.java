package com.flowtrace.agent;

/**
 * Runtime-specific source of call boundaries (bytecode advice, a profiling hook, middleware...).
 * Holds at most one listener at a time.
 */
public interface InstrumentationBoundary {

    /** Makes {@code listener} the sole receiver of boundaries on every thread, replacing any previous one. */
    void register(BoundaryListener listener);

    /** Removes {@code listener} if it is the registered one; otherwise does nothing. */
    void deregister(BoundaryListener listener);
}
