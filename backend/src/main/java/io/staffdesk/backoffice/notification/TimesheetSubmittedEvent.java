package io.staffdesk.backoffice.notification;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a timesheet is saved with the "email jobseeker" flag set. Handled after the
 * transaction commits.
 *
 * @param created true for a new timesheet, false for an update
 */
public record TimesheetSubmittedEvent(
    UUID timesheetId,
    UUID jobseekerProfileId,
    UUID jobseekerUserId,
    UUID positionId,
    LocalDate weekStartDate,
    LocalDate weekEndDate,
    String invoiceNumber,
    BigDecimal totalJobseekerPay,
    boolean created) {}
