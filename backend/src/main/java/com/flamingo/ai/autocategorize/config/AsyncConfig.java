package com.flamingo.ai.autocategorize.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used by the matching engine. */
@Configuration
public class AsyncConfig {

  /**
   * Worker pool for corpus scans. Saturation falls back to the calling thread so a scan never
   * fails on rejection.
   */
  @Bean(name = "corpusScanExecutor")
  public Executor corpusScanExecutor(CategorizationConfig config) {
    CategorizationConfig.Scan scan = config.getScan();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(scan.getCorePoolSize());
    executor.setMaxPoolSize(scan.getMaxPoolSize());
    executor.setQueueCapacity(scan.getQueueCapacity());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("corpus-scan-");
    executor.initialize();
    return executor;
  }
}
