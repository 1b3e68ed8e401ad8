package com.phillippitts.clipcast.config;

import com.phillippitts.clipcast.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for encoding and event offload.
 *
 * <p>Both pools use {@link ThreadPoolExecutor.CallerRunsPolicy}: when pool and queue are full the
 * submitting thread runs the task, which slows triggers down instead of dropping a recording.
 * Both copy the Log4j2 ThreadContext of the submitter so {@code sessionId} follows the work.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs frame-to-media encodes. Waits up to five minutes on shutdown so a GIF that is almost
     * done is not thrown away.
     */
    @Bean(name = "encodeExecutor")
    public Executor encodeExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getEncode());
        executor.setAwaitTerminationSeconds(300);
        executor.initialize();
        return executor;
    }

    /**
     * Offloads hotkey handling from the native hook thread.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getEvent());
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }
}
