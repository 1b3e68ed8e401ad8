package com.phillippitts.clipcast.config;

import com.phillippitts.clipcast.config.properties.ThreadPoolProperties;
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

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void encodeExecutorUsesDefaults() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.encodeExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(2);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("encode-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void eventExecutorRunsOnNamedThreads() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.eventExecutor();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> threadName = new AtomicReference<>();

            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("event-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void sessionIdFollowsTaskIntoPool() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.encodeExecutor();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> seen = new AtomicReference<>();
            ThreadContext.put("sessionId", "session_42");

            executor.execute(() -> {
                seen.set(ThreadContext.get("sessionId"));
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("session_42");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("sessionId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("sessionId")).isEqualTo("outer"));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");

        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }

    @Test
    void saturatedPoolRunsOnCaller() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        ThreadPoolProperties.PoolProperties tiny = new ThreadPoolProperties.PoolProperties();
        props.setEncode(tiny);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).encodeExecutor();
        try {
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger callerRuns = new AtomicInteger();
            Thread caller = Thread.currentThread();
            Executor e = executor;

            e.execute(() -> awaitQuietly(release));
            e.execute(() -> awaitQuietly(release));
            e.execute(() -> {
                if (Thread.currentThread() == caller) {
                    callerRuns.incrementAndGet();
                }
            });
            release.countDown();

            assertThat(callerRuns.get()).isEqualTo(1);
        } finally {
            executor.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
