package com.phillippitts.voicegate.config;

import com.phillippitts.voicegate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for adapter calls and for metric sample writes.
 *
 * <p>Both pools copy the submitting thread's Log4j2 ThreadContext to the worker so request and tenant
 * ids appear in adapter logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs adapter calls and health probes so per-attempt deadlines can interrupt them.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. An adapter call never runs on the
     * request thread, where no deadline could stop it; a rejected call skips that provider without
     * charging its breaker.
     */
    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return build(threadPoolProperties.getProvider(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Single-purpose pool for metric sample appends, kept off the request path.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the recorder logs and drops the
     * sample rather than blocking a request.
     */
    @Bean(name = "metricsExecutor")
    public ThreadPoolTaskExecutor metricsExecutor() {
        return build(threadPoolProperties.getMetrics(), new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                         RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
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
