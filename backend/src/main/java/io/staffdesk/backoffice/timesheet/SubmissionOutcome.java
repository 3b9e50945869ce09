package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;

/** Result of submitting one timesheet of a batch; exactly one of record or error is set. */
public record SubmissionOutcome(TimesheetKey key, TimesheetRecord record, String error) {

  public static SubmissionOutcome succeeded(TimesheetKey key, TimesheetRecord record) {
    return new SubmissionOutcome(key, record, null);
  }

  public static SubmissionOutcome failed(TimesheetKey key, String error) {
    return new SubmissionOutcome(key, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
