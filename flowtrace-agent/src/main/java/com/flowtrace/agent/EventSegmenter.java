package com.flowtrace.agent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps oversized values out of the main log without losing them.
 *
 * When an arg or the result of an event is longer than the threshold, the complete event is
 * written pretty-printed to its own file under the segment directory, and the main log gets a
 * copy whose long values are cut to the threshold, with {@code truncatedFields} recording the
 * original lengths and {@code fullLogFile} naming the segment file. Arg fields are keyed
 * {@code args.<name>}.
 *
 * If the segment file cannot be written the event is returned unchanged and logged in full.
 */
class EventSegmenter {

    static final String RESULT_FIELD = "result";
    static final String ARG_FIELD_PREFIX = "args.";

    private final Path directory;
    private final int threshold;
    private final EventEncoder encoder;
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean directoryReady;

    EventSegmenter(Path directory, int threshold, EventEncoder encoder) {
        this.directory = directory;
        this.threshold = threshold;
        this.encoder = encoder;
    }

    TraceEvent apply(TraceEvent event) {
        Map<String, TraceEvent.TruncatedField> truncated = new LinkedHashMap<>();

        Map<String, String> shortArgs = null;
        if (event.args() != null) {
            shortArgs = new LinkedHashMap<>();
            for (Map.Entry<String, String> arg : event.args().entrySet()) {
                shortArgs.put(arg.getKey(), shorten(ARG_FIELD_PREFIX + arg.getKey(), arg.getValue(), truncated));
            }
        }
        String shortResult = shorten(RESULT_FIELD, event.result(), truncated);

        if (truncated.isEmpty()) return event;

        Path segment = writeSegment(event);
        if (segment == null) return event;
        return event.segmented(shortArgs, shortResult, truncated, segment.toString());
    }

    private String shorten(String field, String value, Map<String, TraceEvent.TruncatedField> truncated) {
        if (value == null || value.length() <= threshold) return value;
        truncated.put(field, new TraceEvent.TruncatedField(value.length(), threshold));
        return ValueSerializer.truncate(value, threshold);
    }

    private Path writeSegment(TraceEvent event) {
        String fileName = String.format("flowtrace-%d-%s-%d.json",
            event.timestampMicros(), event.kind(), sequence.incrementAndGet());
        Path target = directory.resolve(fileName);
        try {
            if (!directoryReady) {
                Files.createDirectories(directory);
                directoryReady = true;
            }
            Files.writeString(target, encoder.encodePretty(event), StandardCharsets.UTF_8);
            return target;
        } catch (IOException | RuntimeException e) {
            System.err.println("[flowtrace] ERROR writing segment " + target + ": " + e.getMessage());
            return null;
        }
    }
}
