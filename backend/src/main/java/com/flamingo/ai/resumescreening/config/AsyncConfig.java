package com.flamingo.ai.resumescreening.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for batch ranking and for time-limited oracle calls. */
@Configuration
public class AsyncConfig {

  /**
   * Fixed pool for per-resume evaluation. Once the queue is full the submitting thread evaluates
   * the resume itself, so a corpus larger than pool plus queue is throttled rather than rejected.
   */
  @Bean(name = "rankingExecutor")
  public Executor rankingExecutor(ScreeningConfig screeningConfig) {
    int parallelism = Math.max(1, screeningConfig.getRanking().getParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(screeningConfig.getRanking().getQueueCapacity());
    executor.setThreadNamePrefix("rank-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** One thread per concurrent ranking worker, plus headroom for single analyses. */
  @Bean(name = "oracleExecutor")
  public Executor oracleExecutor(ScreeningConfig screeningConfig) {
    int poolSize = Math.max(1, screeningConfig.getRanking().getParallelism()) + 2;
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("oracle-");
    executor.initialize();
    return executor;
  }
}
