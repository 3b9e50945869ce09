package io.staffdesk.backoffice.timesheet.persistence;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Filters for the timesheet list. All fields are nullable -- null means "no filter on this field".
 *
 * @param weekStartDate exact week start
 * @param weekEndDate exact week end
 * @param from earliest week start (inclusive)
 * @param to latest week end (inclusive)
 */
public record TimesheetSearchCriteria(
    UUID jobseekerProfileId,
    UUID positionId,
    LocalDate weekStartDate,
    LocalDate weekEndDate,
    Boolean emailSent,
    LocalDate from,
    LocalDate to) {}
