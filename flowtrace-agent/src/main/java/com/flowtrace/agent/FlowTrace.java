package com.flowtrace.agent;

import java.util.concurrent.Callable;

/**
 * Process-wide default used by {@code @Traced} methods and by code that does not manage its own
 * {@link EventSink}.
 *
 * The first {@link #init(AgentConfig)} wins; later calls return the existing sink. Without an
 * explicit init the sink is created on first use from {@link AgentConfig#fromEnvironment()}.
 */
public final class FlowTrace {

    private static final Object LOCK = new Object();

    /** Stand-in when lazy initialization fails, so traced code keeps running. */
    static final EventSink DISCARD = new EventSink() {
        @Override public void log(TraceEvent event) { }
        @Override public void close() { }
    };

    private static volatile EventSink sink;
    private static volatile AgentConfig config;

    private static final ExplicitWrapper DEFAULT_WRAPPER =
        new ExplicitWrapper(FlowTrace::sink, FlowTrace::maxSerializedLength, TraceClock.SYSTEM);

    private FlowTrace() {}

    /**
     * Opens the shared sink from {@code agentConfig} unless one already exists.
     *
     * @throws JsonlEventSink.SinkOpenException if the log file cannot be opened
     */
    public static EventSink init(AgentConfig agentConfig) {
        synchronized (LOCK) {
            if (sink == null) {
                EventSink opened = EventSink.open(agentConfig.sinkConfig());
                config = agentConfig;
                sink = opened;
            }
            return sink;
        }
    }

    public static EventSink sink() {
        EventSink current = sink;
        if (current != null) return current;
        synchronized (LOCK) {
            if (sink == null) {
                AgentConfig fromEnv = AgentConfig.fromEnvironment();
                try {
                    sink = EventSink.open(fromEnv.sinkConfig());
                } catch (JsonlEventSink.SinkOpenException e) {
                    System.err.println("[flowtrace] ERROR opening trace log, events are discarded: " + e.getMessage());
                    sink = DISCARD;
                }
                config = fromEnv;
            }
            return sink;
        }
    }

    public static int maxSerializedLength() {
        AgentConfig c = config;
        return c != null ? c.maxSerializedLength() : AgentConfig.DEFAULT_MAX_LENGTH;
    }

    public static ExplicitWrapper wrapper() {
        return DEFAULT_WRAPPER;
    }

    /** Traces every {@code iface} method called on {@code target}, using the shared sink. */
    public static <T> T wrap(Class<T> iface, T target) {
        return DEFAULT_WRAPPER.proxy(iface, target);
    }

    public static <V> TracedCallable<V> wrap(String scope, String name, Callable<V> callable) {
        return DEFAULT_WRAPPER.wrap(scope, name, callable);
    }

    public static boolean isInitialized() {
        return sink != null;
    }

    /** Closes the shared sink. The next use initializes a fresh one. */
    public static void shutdown() {
        EventSink closing;
        synchronized (LOCK) {
            closing = sink;
            sink = null;
            config = null;
        }
        if (closing != null) closing.close();
    }
}
