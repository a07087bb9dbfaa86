package com.quill.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineExecutorConfigurationTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void queueIsBoundedAndOverflowIsRejected() throws Exception {
        executor = new PipelineExecutorConfiguration().pipelineExecutor(1, 1);
        CountDownLatch started = new CountDownLatch(1);

        executor.execute(() -> {
            started.countDown();
            awaitRelease();
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(this::awaitRelease);

        assertThatThrownBy(() -> executor.execute(this::awaitRelease))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(((ThreadPoolExecutor) executor).getQueue().remainingCapacity()).isZero();
    }

    @Test
    void workersAreNamedDaemonThreads() throws Exception {
        executor = new PipelineExecutorConfiguration().pipelineExecutor(0, 0);

        Future<Thread> worker = executor.submit(Thread::currentThread);

        Thread thread = worker.get(5, TimeUnit.SECONDS);
        assertThat(thread.getName()).startsWith(PipelineExecutorConfiguration.THREAD_NAME_PREFIX);
        assertThat(thread.isDaemon()).isTrue();
        assertThat(((ThreadPoolExecutor) executor).getMaximumPoolSize()).isEqualTo(1);
    }

    private void awaitRelease() {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
