package io.staffdesk.backoffice.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executor for the asynchronous gateway calls made by interactive timesheet sessions. */
@Configuration
public class TimesheetAsyncConfig {

  @Bean
  ThreadPoolTaskExecutor timesheetExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("timesheet-");
    executor.initialize();
    return executor;
  }

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }
}
