package com.flowtrace.agent;

/**
 * Stops the interception engine and closes the shared sink on JVM shutdown, so the async writer
 * drains and every buffered line reaches the log file.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private final InterceptionEngine engine;

    public ShutdownHook(InterceptionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        try {
            engine.stop();
        } catch (Exception e) {
            System.err.println("[flowtrace] ERROR stopping interception engine: " + e.getMessage());
        }
        try {
            FlowTrace.shutdown();
        } catch (Exception e) {
            System.err.println("[flowtrace] ERROR closing trace log: " + e.getMessage());
        }
    }
}
