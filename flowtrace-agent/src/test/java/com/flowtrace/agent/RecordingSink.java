package com.flowtrace.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** In-memory sink for tests. */
class RecordingSink implements EventSink {

    private final List<TraceEvent> events = new ArrayList<>();
    private volatile boolean closed;

    @Override
    public synchronized void log(TraceEvent event) {
        events.add(event);
    }

    @Override
    public void close() {
        closed = true;
    }

    synchronized List<TraceEvent> events() {
        return new ArrayList<>(events);
    }

    synchronized List<EventKind> kinds() {
        return events.stream().map(TraceEvent::kind).collect(Collectors.toList());
    }

    synchronized TraceEvent get(int i) {
        return events.get(i);
    }

    boolean isClosed() {
        return closed;
    }
}
