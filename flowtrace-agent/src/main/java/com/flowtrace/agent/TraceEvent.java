package com.flowtrace.agent;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One line of the trace log.
 *
 * Instances are immutable and only created through the static factories below, one per
 * {@link EventKind}. Fields that do not apply to a kind stay null and are omitted by Gson,
 * so every line carries only what its kind defines:
 *
 * <pre>
 * {"timestampMicros":1700000000000000,"kind":"ENTER","threadId":1,"threadName":"main",
 *  "scope":"com.myapp.Calculator","name":"add","args":{"a":"5","b":"3"}}
 * {"timestampMicros":1700000000000042,"kind":"EXIT","threadId":1,"threadName":"main",
 *  "scope":"com.myapp.Calculator","name":"add","result":"8","durationMicros":42,"durationMillis":0}
 * </pre>
 */
public final class TraceEvent {

    static final int STACK_PREVIEW_FRAMES = 3;

    private final long timestampMicros;
    private final EventKind kind;
    private final long threadId;
    private final String threadName;

    private final String scope;
    private final String name;
    private final Map<String, String> args;
    private final String result;
    private final Long durationMicros;
    private final Long durationMillis;

    private final String exceptionKind;
    private final String exceptionMessage;
    private final String stackTrace;

    private final String requestId;
    private final String method;
    private final String path;
    private final String clientAddress;
    private final String userAgent;
    private final Integer statusCode;

    private final String message;

    private final Map<String, TruncatedField> truncatedFields;
    private final String fullLogFile;

    /** Length of a value cut short in the main log; the whole value is in {@link #fullLogFile()}. */
    public record TruncatedField(int originalLength, int threshold) {}

    private TraceEvent(Builder b) {
        this.timestampMicros  = b.timestampMicros;
        this.kind             = b.kind;
        this.threadId         = b.threadId;
        this.threadName       = b.threadName;
        this.scope            = b.scope;
        this.name             = b.name;
        this.args             = b.args;
        this.result           = b.result;
        this.durationMicros   = b.durationMicros;
        this.durationMillis   = b.durationMicros == null ? null : b.durationMicros / 1_000;
        this.exceptionKind    = b.exceptionKind;
        this.exceptionMessage = b.exceptionMessage;
        this.stackTrace       = b.stackTrace;
        this.requestId        = b.requestId;
        this.method           = b.method;
        this.path             = b.path;
        this.clientAddress    = b.clientAddress;
        this.userAgent        = b.userAgent;
        this.statusCode       = b.statusCode;
        this.message          = b.message;
        this.truncatedFields  = b.truncatedFields;
        this.fullLogFile      = b.fullLogFile;
    }

    // -----------------------------------------------------------------------
    // Factories
    // -----------------------------------------------------------------------

    /** ENTER event. {@code args} maps declared parameter names to serialized values, in order. */
    public static TraceEvent enter(long timestampMicros, String scope, String name, Map<String, String> args) {
        Builder b = new Builder(timestampMicros, EventKind.ENTER);
        b.scope = scope;
        b.name = name;
        b.args = args == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        return new TraceEvent(b);
    }

    /** EXIT event. A null {@code result} means the method is void and the field is omitted. */
    public static TraceEvent exit(long timestampMicros, String scope, String name,
                                  String result, long durationMicros) {
        Builder b = new Builder(timestampMicros, EventKind.EXIT);
        b.scope = scope;
        b.name = name;
        b.result = result;
        b.durationMicros = durationMicros;
        return new TraceEvent(b);
    }

    public static TraceEvent exception(long timestampMicros, String scope, String name,
                                       Throwable thrown, long durationMicros) {
        Builder b = new Builder(timestampMicros, EventKind.EXCEPTION);
        b.scope = scope;
        b.name = name;
        b.durationMicros = durationMicros;
        b.exceptionKind = thrown.getClass().getName();
        b.exceptionMessage = messageOf(thrown);
        b.stackTrace = stackPreview(thrown, STACK_PREVIEW_FRAMES);
        return new TraceEvent(b);
    }

    public static TraceEvent httpRequest(long timestampMicros, String requestId, String method,
                                         String path, String clientAddress, String userAgent) {
        Builder b = new Builder(timestampMicros, EventKind.HTTP_REQUEST);
        b.requestId = requestId;
        b.method = method;
        b.path = path;
        b.clientAddress = clientAddress;
        b.userAgent = userAgent;
        return new TraceEvent(b);
    }

    public static TraceEvent httpResponse(long timestampMicros, String requestId, String method,
                                          String path, int statusCode, long durationMicros) {
        Builder b = new Builder(timestampMicros, EventKind.HTTP_RESPONSE);
        b.requestId = requestId;
        b.method = method;
        b.path = path;
        b.statusCode = statusCode;
        b.durationMicros = durationMicros;
        return new TraceEvent(b);
    }

    /**
     * Synthetic event written in place of one that could not be encoded.
     * Keeps the original timestamp and, where known, scope and name.
     */
    public static TraceEvent error(long timestampMicros, String scope, String name, String message) {
        Builder b = new Builder(timestampMicros, EventKind.ERROR);
        b.scope = scope;
        b.name = name;
        b.message = message;
        return new TraceEvent(b);
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public long timestampMicros()       { return timestampMicros; }
    public EventKind kind()             { return kind; }
    public long threadId()              { return threadId; }
    public String threadName()          { return threadName; }
    public String scope()               { return scope; }
    public String name()                { return name; }
    public Map<String, String> args()   { return args; }
    public String result()              { return result; }
    public Long durationMicros()        { return durationMicros; }
    public Long durationMillis()        { return durationMillis; }
    public String exceptionKind()       { return exceptionKind; }
    public String exceptionMessage()    { return exceptionMessage; }
    public String stackTrace()          { return stackTrace; }
    public String requestId()           { return requestId; }
    public String method()              { return method; }
    public String path()                { return path; }
    public String clientAddress()       { return clientAddress; }
    public String userAgent()           { return userAgent; }
    public Integer statusCode()         { return statusCode; }
    public String message()             { return message; }
    public Map<String, TruncatedField> truncatedFields() { return truncatedFields; }
    public String fullLogFile()         { return fullLogFile; }

    /**
     * Copy for the main log after the full event went to a segment file: {@code args} and
     * {@code result} replaced by their shortened forms, same timestamp and thread.
     */
    TraceEvent segmented(Map<String, String> shortArgs, String shortResult,
                         Map<String, TruncatedField> truncated, String segmentFile) {
        Builder b = new Builder(this);
        b.args = shortArgs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(shortArgs));
        b.result = shortResult;
        b.truncatedFields = Collections.unmodifiableMap(new LinkedHashMap<>(truncated));
        b.fullLogFile = segmentFile;
        return new TraceEvent(b);
    }

    @Override
    public String toString() {
        return kind + " " + (scope != null ? scope + "#" + name : String.valueOf(path))
            + " @" + timestampMicros + " [" + threadName + "]";
    }

    static String stackPreview(Throwable thrown, int maxFrames) {
        try {
            return Arrays.stream(thrown.getStackTrace())
                .limit(maxFrames)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining(" > "));
        } catch (RuntimeException e) {
            return "";
        }
    }

    /** The throwable's message; "" when it has none or {@code getMessage()} itself fails. */
    static String messageOf(Throwable thrown) {
        try {
            String msg = thrown.getMessage();
            return msg != null ? msg : "";
        } catch (RuntimeException e) {
            return "";
        }
    }

    private static final class Builder {
        final long timestampMicros;
        final EventKind kind;
        String scope;
        String name;
        Map<String, String> args;
        String result;
        Long durationMicros;
        String exceptionKind;
        String exceptionMessage;
        String stackTrace;
        String requestId;
        String method;
        String path;
        String clientAddress;
        String userAgent;
        Integer statusCode;
        String message;
        Map<String, TruncatedField> truncatedFields;
        String fullLogFile;
        final long threadId;
        final String threadName;

        Builder(long timestampMicros, EventKind kind) {
            Thread current = Thread.currentThread();
            this.timestampMicros = timestampMicros;
            this.kind = kind;
            this.threadId = current.getId();
            this.threadName = current.getName();
        }

        Builder(TraceEvent e) {
            this.timestampMicros = e.timestampMicros;
            this.kind = e.kind;
            this.threadId = e.threadId;
            this.threadName = e.threadName;
            this.scope = e.scope;
            this.name = e.name;
            this.args = e.args;
            this.result = e.result;
            this.durationMicros = e.durationMicros;
            this.exceptionKind = e.exceptionKind;
            this.exceptionMessage = e.exceptionMessage;
            this.stackTrace = e.stackTrace;
            this.requestId = e.requestId;
            this.method = e.method;
            this.path = e.path;
            this.clientAddress = e.clientAddress;
            this.userAgent = e.userAgent;
            this.statusCode = e.statusCode;
            this.message = e.message;
        }
    }
}
