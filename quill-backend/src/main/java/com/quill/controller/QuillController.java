package com.quill.controller;

import com.quill.api.DeleteTableResponse;
import com.quill.api.QueryRequest;
import com.quill.api.TableInfo;
import com.quill.api.TablesResponse;
import com.quill.api.UploadResponse;
import com.quill.model.ChatTurn;
import com.quill.model.PipelineRequest;
import com.quill.model.PipelineResult;
import com.quill.model.TableSummary;
import com.quill.service.DatasetService;
import com.quill.service.EventSinkClosedException;
import com.quill.service.PipelineOrchestrator;
import com.quill.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@RestController
public class QuillController {

    private static final Logger log = LoggerFactory.getLogger(QuillController.class);

    static final String BUSY_MESSAGE = "Server is busy, try again later.";

    private final PipelineOrchestrator orchestrator;
    private final DatasetService datasetService;
    private final ExecutorService pipelineExecutor;
    private final long streamTimeoutMs;

    public QuillController(
            PipelineOrchestrator orchestrator,
            DatasetService datasetService,
            @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
            @Value("${quill.pipeline.stream-timeout-ms:300000}") long streamTimeoutMs
    ) {
        this.orchestrator = orchestrator;
        this.datasetService = datasetService;
        this.pipelineExecutor = pipelineExecutor;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    /**
     * Answer a question as a stream of Server-Sent Events.
     *
     * POST /api/query
     */
    @PostMapping("/api/query")
    public SseEmitter query(@Valid @RequestBody QueryRequest request) {
        PipelineRequest pipelineRequest = toPipelineRequest(request);
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        try {
            pipelineExecutor.execute(() -> runStream(pipelineRequest, emitter, mdc));
        } catch (RejectedExecutionException e) {
            log.warn("Pipeline queue full, rejecting query");
            try {
                new SseEventSink(emitter).error(BUSY_MESSAGE);
                emitter.complete();
            } catch (EventSinkClosedException closed) {
                log.debug("Could not report rejection, stream already closed");
            }
        }
        return emitter;
    }

    private void runStream(PipelineRequest pipelineRequest, SseEmitter emitter, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        SseEventSink sink = new SseEventSink(emitter);
        try {
            orchestrator.stream(pipelineRequest, sink);
            emitter.complete();
        } catch (EventSinkClosedException e) {
            log.info("Client disconnected, pipeline stopped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Streaming pipeline failed", e);
            try {
                sink.error("Unexpected error: " + e.getMessage());
                emitter.complete();
            } catch (EventSinkClosedException closed) {
                log.debug("Could not report failure, stream already closed");
            }
        } finally {
            MDC.clear();
        }
    }

    /**
     * Answer a question in one response.
     *
     * POST /api/query/run
     */
    @PostMapping("/api/query/run")
    public PipelineResult run(@Valid @RequestBody QueryRequest request) {
        return orchestrator.run(toPipelineRequest(request));
    }

    /**
     * GET /api/tables
     */
    @GetMapping("/api/tables")
    public TablesResponse tables() {
        TablesResponse response = new TablesResponse();
        for (TableSummary table : datasetService.listTables()) {
            response.getTables().add(TableInfo.builder()
                    .name(table.name())
                    .rowCount(table.rowCount())
                    .columns(table.columns())
                    .build());
        }
        return response;
    }

    /**
     * Load an uploaded CSV file as a table, replacing a table of the same name.
     *
     * POST /api/upload
     */
    @PostMapping("/api/upload")
    public UploadResponse upload(@RequestParam("file") MultipartFile file) throws IOException {
        TableSummary table;
        try (InputStream in = file.getInputStream()) {
            table = datasetService.upload(file.getOriginalFilename(), in);
        }
        log.info("Upload completed: table={}, rows={}, trace_id={}", table.name(), table.rowCount(), MDC.get(TraceIdFilter.MDC_TRACE_ID));
        return UploadResponse.builder()
                .success(true)
                .tableName(table.name())
                .rowCount(table.rowCount())
                .columns(table.columns())
                .build();
    }

    /**
     * DELETE /api/tables/{name}
     */
    @DeleteMapping("/api/tables/{name}")
    public ResponseEntity<DeleteTableResponse> deleteTable(@PathVariable("name") String name) {
        String table = datasetService.drop(name);
        return ResponseEntity.ok(DeleteTableResponse.builder()
                .success(true)
                .message("Table " + table + " deleted.")
                .build());
    }

    /**
     * Plain list of table names.
     *
     * GET /tables
     */
    @GetMapping("/tables")
    public List<String> tableNames() {
        return datasetService.tableNames();
    }

    static PipelineRequest toPipelineRequest(QueryRequest request) {
        List<ChatTurn> history = new ArrayList<>();
        if (request.getChatHistory() != null) {
            for (QueryRequest.Turn turn : request.getChatHistory()) {
                history.add(new ChatTurn(turn.getQuestion(), turn.getSql()));
            }
        }
        return new PipelineRequest(request.getQuestion(), request.getSelectedTables(), history);
    }
}
