package com.flowtrace.agent;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronous JSONL sink: one encoded event per line, UTF-8, appended to the configured file.
 *
 * The file write and the optional stdout echo of a line happen under one lock and are flushed
 * immediately, so concurrent callers never interleave partial lines and a crash loses at most
 * the line being written. Write failures are reported on stderr and counted, never thrown.
 */
public class JsonlEventSink implements EventSink {

    public static class SinkOpenException extends RuntimeException {
        public SinkOpenException(String msg, Throwable cause) { super(msg, cause); }
    }

    static final String ENCODING_FAILED_LINE_FORMAT =
        "{\"timestampMicros\":%d,\"kind\":\"ERROR\",\"message\":\"event encoding failed\"}";

    protected final SinkConfig config;
    private final EventEncoder encoder;
    private final PrintStream stdout;
    private final EventSegmenter segmenter;

    /** Guards {@link #writer} and the stdout echo. */
    protected final Object lock = new Object();
    private Writer writer;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong droppedEvents = new AtomicLong();

    public JsonlEventSink(SinkConfig config) {
        this(config, new EventEncoder(), System.out);
    }

    JsonlEventSink(SinkConfig config, EventEncoder encoder, PrintStream stdout) {
        this.config = config;
        this.encoder = encoder;
        this.stdout = stdout;
        this.segmenter = config.segmentationEnabled()
            ? new EventSegmenter(config.segmentDirectory(), config.truncateThreshold(), encoder)
            : null;
        this.writer = config.logFile() != null ? openWriter(config.logFile()) : null;
    }

    static Writer openWriter(Path logFile) {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            throw new SinkOpenException("Could not open trace log " + logFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void log(TraceEvent event) {
        String line = encodeLine(segment(event));
        synchronized (lock) {
            appendToFile(line);
            if (config.echoToStdout()) {
                echo(line);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        synchronized (lock) {
            if (writer != null) {
                try {
                    writer.flush();
                    writer.close();
                } catch (IOException e) {
                    System.err.println("[flowtrace] ERROR closing trace log " + config.logFile() + ": " + e.getMessage());
                }
                writer = null;
            }
            if (config.echoToStdout()) {
                stdout.flush();
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Events that had a file destination but never reached it. */
    public long droppedEvents() {
        return droppedEvents.get();
    }

    // -----------------------------------------------------------------------
    // Shared with the async subclass
    // -----------------------------------------------------------------------

    /**
     * Encodes {@code event}; on failure substitutes an ERROR event that keeps the original timestamp,
     * and as a last resort a fixed literal line. Always returns a line.
     */
    protected String encodeLine(TraceEvent event) {
        try {
            return encoder.encode(event);
        } catch (RuntimeException | StackOverflowError e) {
            TraceEvent error = TraceEvent.error(event.timestampMicros(), event.scope(), event.name(),
                "Failed to encode " + event.kind() + " event: " + e);
            try {
                return encoder.encode(error);
            } catch (RuntimeException | StackOverflowError again) {
                return String.format(ENCODING_FAILED_LINE_FORMAT, event.timestampMicros());
            }
        }
    }

    /**
     * Moves oversized values to a segment file when segmentation is configured; otherwise, or if
     * that fails, returns {@code event} itself.
     */
    protected TraceEvent segment(TraceEvent event) {
        if (segmenter == null) return event;
        try {
            return segmenter.apply(event);
        } catch (RuntimeException e) {
            System.err.println("[flowtrace] ERROR segmenting " + event + ": " + e);
            return event;
        }
    }

    /** Caller must hold {@link #lock}. */
    protected void appendToFile(String line) {
        if (config.logFile() == null) return;
        if (writer == null) {
            droppedEvents.incrementAndGet();
            return;
        }
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            droppedEvents.incrementAndGet();
            System.err.println("[flowtrace] ERROR writing trace log " + config.logFile() + ": " + e.getMessage());
        }
    }

    /** Caller must hold {@link #lock}. */
    protected void echo(String line) {
        stdout.println(line);
        stdout.flush();
    }

    protected void markDropped(long count) {
        droppedEvents.addAndGet(count);
    }
}
