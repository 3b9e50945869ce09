package io.staffdesk.backoffice.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link TimesheetNotifier}: records the request in the log. A mail-backed notifier
 * replaces it by being declared {@code @Primary}.
 */
@Component
public class LoggingTimesheetNotifier implements TimesheetNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingTimesheetNotifier.class);

  @Override
  public void timesheetSubmitted(TimesheetSubmittedEvent event) {
    log.info(
        "Timesheet email requested: timesheet={}, jobseeker={}, week={}, invoice={}",
        event.timesheetId(),
        event.jobseekerUserId(),
        event.weekStartDate(),
        event.invoiceNumber());
  }
}
