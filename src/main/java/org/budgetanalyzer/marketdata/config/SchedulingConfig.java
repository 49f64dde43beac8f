package org.budgetanalyzer.marketdata.config;

import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Dedicated scheduler for the market data import job and its retries.
 *
 * <p>Pool size, thread name prefix and shutdown behavior come from {@code spring.task.scheduling}
 * in application.yml. A pool size of 1 keeps every run on a single thread, so a retry can never
 * overlap the run it replaces.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {

  private final TaskSchedulingProperties taskSchedulingProperties;

  public SchedulingConfig(TaskSchedulingProperties taskSchedulingProperties) {
    this.taskSchedulingProperties = taskSchedulingProperties;
  }

  /**
   * Task scheduler for {@code @Scheduled} methods and programmatic retries.
   *
   * @return The configured task scheduler
   */
  @Bean
  @NonNull
  public TaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(taskSchedulingProperties.getPool().getSize());

    var shutdown = taskSchedulingProperties.getShutdown();
    scheduler.setWaitForTasksToCompleteOnShutdown(shutdown.isAwaitTermination());
    if (shutdown.getAwaitTerminationPeriod() != null) {
      scheduler.setAwaitTerminationSeconds((int) shutdown.getAwaitTerminationPeriod().getSeconds());
    }

    scheduler.setThreadNamePrefix(taskSchedulingProperties.getThreadNamePrefix());
    scheduler.initialize();

    return scheduler;
  }

  @Override
  public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.setTaskScheduler(taskScheduler());
  }
}
