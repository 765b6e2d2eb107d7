package io.forgecascade.governance.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Runs scheduled governance work (the voting deadline sweep) on its own scheduler thread, apart
 * from the servlet request threads. On shutdown the scheduler stops accepting new runs and waits
 * for an in-flight sweep to finish.
 */
@Configuration
public class SchedulingConfig implements SchedulingConfigurer {

  private static final int SHUTDOWN_AWAIT_SECONDS = 30;

  @Bean
  public ThreadPoolTaskScheduler governanceTaskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("governance-sweep-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar registrar) {
    registrar.setTaskScheduler(governanceTaskScheduler());
  }
}
