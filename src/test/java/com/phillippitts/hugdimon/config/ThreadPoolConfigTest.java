package com.phillippitts.hugdimon.config;

import com.phillippitts.hugdimon.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithCorrectConfiguration() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).completionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(32);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("completion-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).completionExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    try {
                        Thread.sleep(10);
                        completedTasks.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(completedTasks.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).completionExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        ThreadContext.put("conversationId", "conv-42");

        try {
            executor.execute(() -> {
                seen.set(ThreadContext.get("conversationId"));
                done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("conv-42");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.threadContextPropagation().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
    }
}
