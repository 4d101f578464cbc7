package com.flowtrace.agent;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Encodes a {@link TraceEvent} as a single line of JSON (no trailing newline).
 * Null fields are omitted.
 */
public class EventEncoder {

    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .create();

    private static final Gson PRETTY_GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .setPrettyPrinting()
        .create();

    public String encode(TraceEvent event) {
        return GSON.toJson(event);
    }

    /** Multi-line form, used for segment files. */
    public String encodePretty(TraceEvent event) {
        return PRETTY_GSON.toJson(event);
    }
}
