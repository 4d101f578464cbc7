package com.flowtrace.agent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Automatic tracing: observes every boundary reported by an {@link InstrumentationBoundary},
 * keeps only scopes accepted by {@link ScopeFilter}, and writes ENTER/EXIT/EXCEPTION events.
 *
 * State machine {@code STOPPED -> ACTIVE -> STOPPED}. {@link #start()} registers the engine as
 * the boundary's sole listener; {@link #stop()} deregisters it and closes the sink. Both are
 * no-ops when already in the target state.
 *
 * Durations come from a per-thread {@link CallStack}. A return or throw with no open frame
 * (the engine was started mid-call) is still logged, with a duration of 0.
 */
public final class InterceptionEngine implements BoundaryListener {

    public enum State { STOPPED, ACTIVE }

    private final FilterConfig filter;
    private final EventSink sink;
    private final InstrumentationBoundary boundary;
    private final int maxSerializedLength;
    private final TraceClock clock;

    private final CallStack stack = new CallStack();
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    public InterceptionEngine(FilterConfig filter, EventSink sink,
                              InstrumentationBoundary boundary, int maxSerializedLength) {
        this(filter, sink, boundary, maxSerializedLength, TraceClock.SYSTEM);
    }

    InterceptionEngine(FilterConfig filter, EventSink sink, InstrumentationBoundary boundary,
                       int maxSerializedLength, TraceClock clock) {
        this.filter = filter;
        this.sink = sink;
        this.boundary = boundary;
        this.maxSerializedLength = maxSerializedLength;
        this.clock = clock;
    }

    public void start() {
        if (state.compareAndSet(State.STOPPED, State.ACTIVE)) {
            boundary.register(this);
        }
    }

    public void stop() {
        if (state.compareAndSet(State.ACTIVE, State.STOPPED)) {
            boundary.deregister(this);
            sink.close();
        }
    }

    public State state() {
        return state.get();
    }

    public FilterConfig filter() {
        return filter;
    }

    // -----------------------------------------------------------------------
    // BoundaryListener
    // -----------------------------------------------------------------------

    @Override
    public void onCall(String scope, String name, Map<String, Object> args) {
        if (!observes(scope)) return;

        long now = clock.nowMicros();
        Map<String, String> serialized = new LinkedHashMap<>();
        if (args != null) {
            for (Map.Entry<String, Object> arg : args.entrySet()) {
                serialized.put(arg.getKey(), ValueSerializer.serialize(arg.getValue(), maxSerializedLength));
            }
        }
        // frame only once the ENTER event exists, so a failure cannot leave an unmatched EXIT
        TraceEvent enter = TraceEvent.enter(now, scope, name, serialized);
        stack.push(new CallStack.CallFrame(now, scope, name));
        sink.log(enter);
    }

    @Override
    public void onReturn(String scope, String name, Object result, boolean voidMethod) {
        if (!observes(scope)) return;

        long now = clock.nowMicros();
        long duration = closeFrame(now);
        String serialized = voidMethod ? null : ValueSerializer.serialize(result, maxSerializedLength);
        sink.log(TraceEvent.exit(now, scope, name, serialized, duration));
    }

    @Override
    public void onThrow(String scope, String name, Throwable thrown) {
        if (!observes(scope)) return;

        long now = clock.nowMicros();
        long duration = closeFrame(now);
        sink.log(TraceEvent.exception(now, scope, name, thrown, duration));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private boolean observes(String scope) {
        if (state.get() != State.ACTIVE) return false;
        try {
            return ScopeFilter.shouldTrace(scope, filter);
        } catch (RuntimeException e) {
            System.err.println("[flowtrace] ERROR filtering " + scope + ": " + e);
            return false;
        }
    }

    /** Pops the innermost frame and returns its duration; 0 when the stack underflows. */
    private long closeFrame(long now) {
        CallStack.CallFrame frame = stack.pop();
        return frame == null ? 0L : Math.max(0L, now - frame.entryMicros());
    }

    int openFrames() {
        return stack.depth();
    }
}
