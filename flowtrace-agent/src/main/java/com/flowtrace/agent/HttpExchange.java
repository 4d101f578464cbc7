package com.flowtrace.agent;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One HTTP request/response pair, for web framework adapters.
 *
 * <pre>{@code
 * HttpExchange exchange = HttpExchange.begin(sink, "GET", "/orders/42", remoteAddr, userAgent);
 * try {
 *     chain.doFilter(request, response);
 * } finally {
 *     exchange.complete(response.getStatus());
 * }
 * }</pre>
 */
public final class HttpExchange {

    private final EventSink sink;
    private final TraceClock clock;
    private final String requestId;
    private final String method;
    private final String path;
    private final long startMicros;
    private final AtomicBoolean completed = new AtomicBoolean();

    private HttpExchange(EventSink sink, TraceClock clock, String requestId,
                         String method, String path, long startMicros) {
        this.sink = sink;
        this.clock = clock;
        this.requestId = requestId;
        this.method = method;
        this.path = path;
        this.startMicros = startMicros;
    }

    /** Logs HTTP_REQUEST under a fresh random request id. */
    public static HttpExchange begin(EventSink sink, String method, String path,
                                     String clientAddress, String userAgent) {
        return begin(sink, TraceClock.SYSTEM, method, path, clientAddress, userAgent);
    }

    static HttpExchange begin(EventSink sink, TraceClock clock, String method, String path,
                              String clientAddress, String userAgent) {
        Objects.requireNonNull(sink, "sink");
        String requestId = UUID.randomUUID().toString();
        long now = clock.nowMicros();
        sink.log(TraceEvent.httpRequest(now, requestId, method, path, clientAddress, userAgent));
        return new HttpExchange(sink, clock, requestId, method, path, now);
    }

    /**
     * Logs HTTP_RESPONSE with the elapsed time since {@link #begin}.
     *
     * @return false if the exchange was already completed; nothing is logged then
     */
    public boolean complete(int statusCode) {
        if (!completed.compareAndSet(false, true)) return false;
        long now = clock.nowMicros();
        sink.log(TraceEvent.httpResponse(now, requestId, method, path, statusCode,
            Math.max(0L, now - startMicros)));
        return true;
    }

    public String requestId() {
        return requestId;
    }

    public boolean isCompleted() {
        return completed.get();
    }
}
