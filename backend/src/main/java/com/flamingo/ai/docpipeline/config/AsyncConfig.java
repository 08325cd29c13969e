package com.flamingo.ai.docpipeline.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for background processing and bounded model calls. */
@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig {

  /** Runs processing attempts triggered by uploads. */
  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor(PipelineConfig pipelineConfig) {
    PipelineConfig.Processing processing = pipelineConfig.getProcessing();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(processing.getWorkerThreads());
    executor.setMaxPoolSize(processing.getWorkerThreads());
    executor.setQueueCapacity(processing.getQueueCapacity());
    executor.setThreadNamePrefix("doc-proc-");
    // In-flight attempts are interrupted on shutdown and end FAILED as cancelled
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    log.info(
        "Document processing pool: {} threads, queue {}",
        processing.getWorkerThreads(),
        processing.getQueueCapacity());
    return executor;
  }

  /** Runs remote model calls so the caller can bound them with a timeout. */
  @Bean(name = "summarizationExecutor", destroyMethod = "shutdownNow")
  public ExecutorService summarizationExecutor(PipelineConfig pipelineConfig) {
    int concurrency = pipelineConfig.getSummarization().getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("summarize-");
    executor.initialize();
    return executor.getThreadPoolExecutor();
  }
}
