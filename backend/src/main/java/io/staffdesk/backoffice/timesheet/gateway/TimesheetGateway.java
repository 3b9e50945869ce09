package io.staffdesk.backoffice.timesheet.gateway;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Transactional record store the timesheet engine persists through. Implementations may block on
 * I/O; callers that must stay responsive invoke them off-thread.
 */
public interface TimesheetGateway {

  /** All timesheets of a jobseeker whose week lies within {@code [weekStart, weekEnd]}. */
  List<TimesheetRecord> lookupByJobseekerAndWeek(
      UUID jobseekerUserId, LocalDate weekStart, LocalDate weekEnd);

  /** Reserves and returns the next invoice number. */
  String generateInvoiceNumber();

  /**
   * Creates a timesheet. A blank or placeholder invoice number on the payload is replaced with a
   * freshly generated one.
   */
  TimesheetRecord create(TimesheetRecord payload);

  /** Replaces every field of an existing timesheet with the payload; not a patch. */
  TimesheetRecord update(UUID id, TimesheetRecord payload);
}
