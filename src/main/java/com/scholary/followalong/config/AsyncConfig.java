package com.scholary.followalong.config;

import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the job worker thread.
 *
 * <p>Exactly one job runs at a time, so the pool has a single thread. Queueing happens in the
 * orchestrator, not in the executor.
 */
@Configuration
@EnableConfigurationProperties(JobProperties.class)
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public Executor jobExecutor(JobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix(properties.threadNamePrefix());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
