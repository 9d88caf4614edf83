package com.phillippitts.serverwarden.config;

import com.phillippitts.serverwarden.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
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
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.notifyExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;

        // Check against default property values
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(2);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("notify-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .notifyExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(5);
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
        executor.shutdown();
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .notifyExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seenTick = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        ThreadContext.put("tick", "42");
        executor.execute(() -> {
            seenTick.set(ThreadContext.get("tick"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seenTick.get()).isEqualTo("42");
        assertThat(threadName.get()).startsWith("notify-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("requestId", "abc");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("abc"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "w1");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("w1");
    }
}
