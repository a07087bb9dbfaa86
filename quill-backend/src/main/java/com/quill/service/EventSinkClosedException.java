package com.quill.service;

/**
 * Thrown by a {@link PipelineEventSink} whose consumer has gone away.
 */
public class EventSinkClosedException extends RuntimeException {

    public EventSinkClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
