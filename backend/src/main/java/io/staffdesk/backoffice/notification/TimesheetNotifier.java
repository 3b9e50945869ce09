package io.staffdesk.backoffice.notification;

/** Delivers the timesheet email to the jobseeker. Rendering and transport live elsewhere. */
public interface TimesheetNotifier {

  void timesheetSubmitted(TimesheetSubmittedEvent event);
}
