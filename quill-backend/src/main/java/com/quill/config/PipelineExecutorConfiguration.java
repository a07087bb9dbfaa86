package com.quill.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool for streaming pipeline runs, so servlet threads return as soon as the event
 * stream is open.
 *
 * <p>Runs beyond the worker count wait in a bounded queue; once it is full, submissions are
 * rejected with {@link java.util.concurrent.RejectedExecutionException}.
 */
@Configuration
public class PipelineExecutorConfiguration {

    static final String THREAD_NAME_PREFIX = "quill-pipeline-";

    @Bean(name = "pipelineExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(
            @Value("${quill.pipeline.worker-threads:4}") int workerThreads,
            @Value("${quill.pipeline.queue-capacity:100}") int queueCapacity
    ) {
        int threads = Math.max(1, workerThreads);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(THREAD_NAME_PREFIX);
        threadFactory.setDaemon(true);
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }
}
