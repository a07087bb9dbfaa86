package com.quill.controller;

import com.quill.api.QueryEvent;
import com.quill.model.TabularResult;
import com.quill.service.EventSinkClosedException;
import com.quill.service.PipelineEventSink;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes pipeline events to an {@link SseEmitter} as JSON {@code data:} frames.
 */
class SseEventSink implements PipelineEventSink {

    private final SseEmitter emitter;

    SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void thinking(String message) {
        send(QueryEvent.builder().type("thinking").content(message).build());
    }

    @Override
    public void sql(String sql) {
        send(QueryEvent.builder().type("sql").content(sql).build());
    }

    @Override
    public void result(TabularResult data, int attempts) {
        send(QueryEvent.builder()
                .type("result")
                .content(data.rows())
                .rowCount(data.rowCount())
                .attempts(attempts)
                .build());
    }

    @Override
    public void summaryChunk(String chunk) {
        send(QueryEvent.builder().type("summary").content(chunk).build());
    }

    @Override
    public void summaryDone() {
        send(QueryEvent.builder().type("summary_done").build());
    }

    @Override
    public void error(String message) {
        send(QueryEvent.builder().type("error").content(message).build());
    }

    private void send(QueryEvent event) {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            throw new EventSinkClosedException("Event stream closed: " + e.getMessage(), e);
        }
    }
}
