package com.flowtrace.agent;

/**
 * Kind of a line in the trace log. Serialized by name.
 */
public enum EventKind {
    ENTER,
    EXIT,
    EXCEPTION,
    HTTP_REQUEST,
    HTTP_RESPONSE,
    ERROR
}
