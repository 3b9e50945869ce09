package io.staffdesk.backoffice.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class TimesheetEmailEventListener {

  private static final Logger log = LoggerFactory.getLogger(TimesheetEmailEventListener.class);

  private final TimesheetNotifier notifier;

  public TimesheetEmailEventListener(TimesheetNotifier notifier) {
    this.notifier = notifier;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTimesheetSubmitted(TimesheetSubmittedEvent event) {
    try {
      notifier.timesheetSubmitted(event);
    } catch (Exception e) {
      log.error("Failed to send timesheet email for timesheet={}", event.timesheetId(), e);
    }
  }
}
