package com.flowtrace.agent;

/**
 * Ordered, thread-safe destination of trace events.
 *
 * {@link #log} never throws. {@link #close} is idempotent.
 */
public interface EventSink extends AutoCloseable {

    void log(TraceEvent event);

    @Override
    void close();

    /**
     * Opens the sink described by {@code config}: synchronous, or backed by a writer thread when
     * {@link SinkConfig#asyncMode()} is set.
     *
     * @throws JsonlEventSink.SinkOpenException if the log file cannot be created or opened
     */
    static EventSink open(SinkConfig config) {
        return config.asyncMode()
            ? new AsyncJsonlEventSink(config)
            : new JsonlEventSink(config);
    }
}
