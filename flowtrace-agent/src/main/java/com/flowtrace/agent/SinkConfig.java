package com.flowtrace.agent;

import java.nio.file.Path;

/**
 * Read-only input of {@link EventSink#open(SinkConfig)}.
 *
 * @param logFile             JSONL target, appended to; null disables the file
 * @param echoToStdout        also print every line to standard output
 * @param asyncMode           write the file from a background worker
 * @param maxSerializedLength cap applied by {@link ValueSerializer}; 0 means unbounded
 * @param segmentDirectory    where events with oversized values are written in full; null disables segmentation
 * @param truncateThreshold   longest arg or result value kept in the main log when segmenting
 */
public record SinkConfig(
    Path logFile,
    boolean echoToStdout,
    boolean asyncMode,
    int maxSerializedLength,
    Path segmentDirectory,
    int truncateThreshold
) {

    public static final int DEFAULT_TRUNCATE_THRESHOLD = 1000;

    public SinkConfig(Path logFile, boolean echoToStdout, boolean asyncMode, int maxSerializedLength) {
        this(logFile, echoToStdout, asyncMode, maxSerializedLength, null, DEFAULT_TRUNCATE_THRESHOLD);
    }

    public static SinkConfig toFile(Path logFile) {
        return new SinkConfig(logFile, false, false, 0);
    }

    public SinkConfig async() {
        return new SinkConfig(logFile, echoToStdout, true, maxSerializedLength, segmentDirectory, truncateThreshold);
    }

    public SinkConfig segmentedInto(Path directory, int threshold) {
        return new SinkConfig(logFile, echoToStdout, asyncMode, maxSerializedLength, directory, threshold);
    }

    public boolean segmentationEnabled() {
        return segmentDirectory != null && truncateThreshold > 0;
    }
}
