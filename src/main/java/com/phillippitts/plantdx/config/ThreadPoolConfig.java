package com.phillippitts.plantdx.config;

import com.phillippitts.plantdx.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by diagnosis orchestration.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for request-level work: one task per provider in ensemble mode and the
     * sequential primary/fallback chain in primary mode.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are
     * full, {@code submit} throws {@link org.springframework.core.task.TaskRejectedException};
     * provider work never runs on the request thread, where the request deadline could not
     * interrupt it.
     *
     * @return configured dispatch executor
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        return buildExecutor(threadPoolProperties.getDispatch());
    }

    /**
     * Executor for individual provider call attempts. Each attempt is bounded by the
     * provider's timeout and cancelled with interruption when it expires.
     *
     * @return configured provider-call executor
     */
    @Bean(name = "providerCallExecutor")
    public ThreadPoolTaskExecutor providerCallExecutor() {
        return buildExecutor(threadPoolProperties.getProviderCall());
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so
     * the {@code diagnosisId} stays on every log line of a request.
     */
    static TaskDecorator threadContextDecorator() {
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
}
