package io.staffdesk.backoffice.timesheet;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The jobseeker, position and week currently picked for timesheet entry. Any field may be null
 * while the user is still choosing.
 */
public record TimesheetSelection(
    UUID jobseekerProfileId, UUID jobseekerUserId, UUID positionId, LocalDate weekStartDate) {

  public boolean isComplete() {
    return jobseekerProfileId != null
        && jobseekerUserId != null
        && positionId != null
        && weekStartDate != null;
  }

  public TimesheetKey key() {
    return new TimesheetKey(jobseekerProfileId, positionId, weekStartDate);
  }

  public WeekPeriod week() {
    return WeekPeriod.containing(weekStartDate);
  }
}
