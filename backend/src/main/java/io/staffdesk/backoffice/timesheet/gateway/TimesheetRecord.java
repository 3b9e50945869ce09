package io.staffdesk.backoffice.timesheet.gateway;

import io.staffdesk.backoffice.timesheet.TimesheetKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read and write shape of a persisted weekly timesheet. Totals, pay and bill are derived by the
 * engine and authoritative at write time; the four rates are a snapshot of the position at
 * submission.
 *
 * @param id present only after creation
 * @param dailyHours one entry per date of the week, in date order
 * @param emailSent whether the submitter asked for the jobseeker to be notified
 * @param version incremented on every update; null on payloads that have not been persisted
 */
public record TimesheetRecord(
    UUID id,
    UUID jobseekerProfileId,
    UUID jobseekerUserId,
    UUID positionId,
    LocalDate weekStartDate,
    LocalDate weekEndDate,
    List<DailyHours> dailyHours,
    BigDecimal totalRegularHours,
    BigDecimal totalOvertimeHours,
    BigDecimal regularPayRate,
    BigDecimal overtimePayRate,
    BigDecimal regularBillRate,
    BigDecimal overtimeBillRate,
    BigDecimal totalJobseekerPay,
    BigDecimal totalClientBill,
    BigDecimal bonusAmount,
    BigDecimal deductionAmount,
    boolean overtimeEnabled,
    BigDecimal markup,
    boolean emailSent,
    String invoiceNumber,
    String notes,
    Integer version) {

  public TimesheetRecord {
    dailyHours = dailyHours != null ? List.copyOf(dailyHours) : List.of();
  }

  public TimesheetKey key() {
    return new TimesheetKey(jobseekerProfileId, positionId, weekStartDate);
  }
}
