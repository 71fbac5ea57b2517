package com.eyelevel.paperprocessor.config;

import org.springframework.boot.task.ThreadPoolTaskExecutorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded worker pool on which paper pipeline runs execute. Blocking work
 * (rate-limit waits, archive parsing, pdflatex invocations) happens on these threads, never on
 * request-handling threads.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the pipeline worker pool. Core size, max size and queue capacity are applied by
     * Spring Boot from the {@code spring.task.execution.pool.*} properties.
     *
     * @param builder Spring Boot's pre-configured executor builder.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("pipelineTaskExecutor")
    public AsyncTaskExecutor pipelineTaskExecutor(ThreadPoolTaskExecutorBuilder builder) {
        ThreadPoolTaskExecutor executor = builder.threadNamePrefix("paper-pipeline-").build();
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
