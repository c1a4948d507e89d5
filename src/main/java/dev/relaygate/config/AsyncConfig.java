package dev.relaygate.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Async execution configuration.
 *
 * <p>Provider calls are I/O-bound, so the gateway executor is sized well above
 * the core count; the per-provider ceiling is enforced separately by the
 * dispatcher's worker pools, not here.
 *
 * <p>Every pool is wrapped with MDC propagation so the {@code request_id} set by
 * {@link RequestIdFilter} survives the hop onto worker threads.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    /**
     * Executor for direct (non-queued) provider calls and batch fan-out.
     */
    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor(GatewayProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int total = properties.queue().concurrency().values().stream().mapToInt(Integer::intValue).sum();
        executor.setCorePoolSize(Math.max(4, properties.batchConcurrency()));
        executor.setMaxPoolSize(Math.max(16, total));
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("gateway-");
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Propagates MDC context (request_id) from the calling thread to the
     * worker thread and restores a clean MDC afterwards.
     */
    public static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
