package com.quill.service;

import com.quill.model.TabularResult;

/**
 * Receiver of streaming pipeline progress. Events arrive in stage order and nothing follows
 * {@link #error(String)}.
 *
 * <p>Implementations signal a gone client by throwing {@link EventSinkClosedException}; the run
 * stops at that emission point.
 */
public interface PipelineEventSink {

    void thinking(String message);

    void sql(String sql);

    void result(TabularResult data, int attempts);

    void summaryChunk(String chunk);

    void summaryDone();

    void error(String message);
}
