package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.config.TimesheetProperties;
import io.staffdesk.backoffice.position.PositionRateProfileService;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/** Creates {@link TimesheetSession}s wired to the shared reconciler and executor. */
@Component
public class TimesheetSessionFactory {

  private final TimesheetReconciler reconciler;
  private final PositionRateProfileService rateProfileService;
  private final TaskExecutor executor;
  private final Clock clock;
  private final TimesheetProperties properties;

  public TimesheetSessionFactory(
      TimesheetReconciler reconciler,
      PositionRateProfileService rateProfileService,
      @Qualifier("timesheetExecutor") TaskExecutor executor,
      Clock clock,
      TimesheetProperties properties) {
    this.reconciler = reconciler;
    this.rateProfileService = rateProfileService;
    this.executor = executor;
    this.clock = clock;
    this.properties = properties;
  }

  public TimesheetSession newSession() {
    return new TimesheetSession(
        reconciler, rateProfileService, executor, clock, properties.statusMessageTtl());
  }
}
