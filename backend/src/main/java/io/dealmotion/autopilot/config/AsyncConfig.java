package io.dealmotion.autopilot.config;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor shared by concurrent detector evaluation and the execution handoff. Callers
 * inject it directly by qualifier rather than going through {@code @Async} proxies.
 */
@Configuration
public class AsyncConfig {

  public static final String AUTOPILOT_EXECUTOR = "autopilotTaskExecutor";

  private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

  @Bean(name = AUTOPILOT_EXECUTOR)
  public Executor autopilotTaskExecutor(AutopilotProperties properties) {
    var settings = properties.executor();
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.corePoolSize());
    executor.setMaxPoolSize(settings.maxPoolSize());
    executor.setQueueCapacity(settings.queueCapacity());
    executor.setThreadNamePrefix("autopilot-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();

    log.info(
        "Autopilot executor configured: core={}, max={}, queue={}",
        settings.corePoolSize(),
        settings.maxPoolSize(),
        settings.queueCapacity());
    return executor;
  }
}
