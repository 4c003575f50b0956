package dev.larder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for work that runs outside the request thread.
 *
 * <ul>
 *   <li>{@code imageFetchExecutor}: thumbnail lookups after discovery; each run uses at most five
 *       of its threads</li>
 *   <li>{@code streamExecutor}: consumes discovery and parsing runs while their progress is
 *       streamed to the client</li>
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "imageFetchExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor imageFetchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(10);
    executor.setMaxPoolSize(10);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("image-fetch-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor streamExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("progress-stream-");
    executor.initialize();
    return executor;
  }
}
