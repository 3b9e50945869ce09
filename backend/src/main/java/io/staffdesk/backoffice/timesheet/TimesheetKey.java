package io.staffdesk.backoffice.timesheet;

import java.time.LocalDate;
import java.util.UUID;

/** Reconciliation key: at most one timesheet exists per jobseeker, position and week. */
public record TimesheetKey(UUID jobseekerProfileId, UUID positionId, LocalDate weekStartDate) {}
