package dev.craftnudge.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools of the pipeline.
 *
 * <p>Workers are a fixed pool sized by {@code craftnudge.pipeline.worker-pool-size}:
 * that number is the upper bound on events processed concurrently. Analysis
 * calls run on a separate fixed pool so a worker can abandon a call that
 * outlives its timeout.
 *
 * <p>Both pools propagate the MDC (eventId, correlationId) from the submitting
 * thread, otherwise worker logs lose their event context.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "workerExecutorService")
    public ExecutorService workerExecutorService(PipelineProperties properties) {
        ExecutorService base = Executors.newFixedThreadPool(properties.workerPoolSize(),
                new CustomizableThreadFactory("pipeline-worker-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    @Bean(name = "analysisExecutorService")
    public ExecutorService analysisExecutorService(AiProperties properties) {
        ExecutorService base = Executors.newFixedThreadPool(properties.analysisThreads(),
                new CustomizableThreadFactory("analysis-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Single-threaded timer for orchestrator cycles; cycles never overlap.
     */
    @Bean(name = "pipelineScheduler")
    public ThreadPoolTaskScheduler pipelineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("pipeline-cycle-");
        scheduler.setTaskDecorator(new MdcPropagatingTaskDecorator());
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the MDC of the calling thread onto the task thread.
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

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    public static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final TaskDecorator decorator;

        public DelegatingExecutorService(ExecutorService delegate, TaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
