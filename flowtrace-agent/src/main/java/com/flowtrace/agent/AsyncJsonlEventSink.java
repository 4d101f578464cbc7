package com.flowtrace.agent;

import java.io.PrintStream;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JSONL sink whose file writes happen on a single background worker.
 *
 * {@link #log} never blocks on I/O: it echoes to stdout on the caller's thread (when enabled)
 * and enqueues the event on an unbounded FIFO queue. The echo shows the event in full; segment
 * files are written by the worker. The worker encodes, writes and flushes in
 * enqueue order. {@link #close} stops intake, waits until every queued event has been written,
 * then closes the file. There is no timeout.
 */
public class AsyncJsonlEventSink extends JsonlEventSink {

    static final String WORKER_NAME = "flowtrace-sink-writer";

    /** Enqueued by {@link #close()} behind the last accepted event. */
    private static final TraceEvent STOP = TraceEvent.error(0L, null, null, "stop");

    private final BlockingQueue<TraceEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Thread worker;

    public AsyncJsonlEventSink(SinkConfig config) {
        this(config, new EventEncoder(), System.out);
    }

    AsyncJsonlEventSink(SinkConfig config, EventEncoder encoder, PrintStream stdout) {
        super(config, encoder, stdout);
        this.worker = new Thread(this::drain, WORKER_NAME);
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void log(TraceEvent event) {
        if (config.echoToStdout()) {
            String line = encodeLine(event);
            synchronized (lock) {
                echo(line);
            }
        }
        if (!accepting.get()) {
            markDropped(1);
            return;
        }
        queue.add(event);
    }

    @Override
    public void close() {
        if (!accepting.compareAndSet(true, false)) return;
        queue.add(STOP);

        boolean interrupted = false;
        while (worker.isAlive()) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        // Producers that passed the intake check while close() was running
        int late = queue.size();
        if (late > 0) {
            markDropped(late);
            queue.clear();
        }
        super.close();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    int queuedEvents() {
        return queue.size();
    }

    private void drain() {
        try {
            while (true) {
                TraceEvent next = queue.take();
                if (next == STOP) break;
                write(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            TraceEvent rest;
            while ((rest = queue.poll()) != null) {
                if (rest != STOP) write(rest);
            }
        }
    }

    private void write(TraceEvent event) {
        try {
            String line = encodeLine(segment(event));
            synchronized (lock) {
                appendToFile(line);
            }
        } catch (RuntimeException e) {
            markDropped(1);
            System.err.println("[flowtrace] ERROR in " + WORKER_NAME + ": " + e);
        }
    }
}
