package io.staffdesk.backoffice.timesheet.persistence;

import io.staffdesk.backoffice.timesheet.gateway.DailyHours;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts between the {@link Timesheet} entity and {@link TimesheetRecord}. The only place that
 * knows the stored column layout; missing numeric values are read as zero.
 */
@Component
public class TimesheetRecordMapper {

  private static final Logger log = LoggerFactory.getLogger(TimesheetRecordMapper.class);

  public TimesheetRecord toRecord(Timesheet timesheet) {
    return new TimesheetRecord(
        timesheet.getId(),
        timesheet.getJobseekerProfileId(),
        timesheet.getJobseekerUserId(),
        timesheet.getPositionId(),
        timesheet.getWeekStartDate(),
        timesheet.getWeekEndDate(),
        toDailyHours(timesheet),
        orZero(timesheet.getTotalRegularHours()),
        orZero(timesheet.getTotalOvertimeHours()),
        orZero(timesheet.getRegularPayRate()),
        orZero(timesheet.getOvertimePayRate()),
        orZero(timesheet.getRegularBillRate()),
        orZero(timesheet.getOvertimeBillRate()),
        orZero(timesheet.getTotalJobseekerPay()),
        orZero(timesheet.getTotalClientBill()),
        orZero(timesheet.getBonusAmount()),
        orZero(timesheet.getDeductionAmount()),
        timesheet.isOvertimeEnabled(),
        timesheet.getMarkup(),
        timesheet.isEmailSent(),
        timesheet.getInvoiceNumber(),
        timesheet.getNotes(),
        timesheet.getVersion());
  }

  /** Copies every writable field of the record onto the entity. Id and invoice number are kept. */
  public void apply(TimesheetRecord record, Timesheet timesheet) {
    timesheet.assignTo(
        record.jobseekerProfileId(),
        record.jobseekerUserId(),
        record.positionId(),
        record.weekStartDate(),
        record.weekEndDate());
    timesheet.replaceHours(
        toStored(record.dailyHours()),
        orZero(record.totalRegularHours()),
        orZero(record.totalOvertimeHours()));
    timesheet.replaceRates(
        orZero(record.regularPayRate()),
        orZero(record.overtimePayRate()),
        orZero(record.regularBillRate()),
        orZero(record.overtimeBillRate()),
        record.overtimeEnabled(),
        record.markup());
    timesheet.replaceAmounts(
        orZero(record.totalJobseekerPay()),
        orZero(record.totalClientBill()),
        orZero(record.bonusAmount()),
        orZero(record.deductionAmount()));
    timesheet.replaceDetails(record.emailSent(), record.notes());
  }

  List<StoredDailyHours> toStored(List<DailyHours> dailyHours) {
    var stored = new ArrayList<StoredDailyHours>(dailyHours.size());
    for (DailyHours day : dailyHours) {
      stored.add(new StoredDailyHours(day.date().toString(), orZero(day.hours())));
    }
    return stored;
  }

  private List<DailyHours> toDailyHours(Timesheet timesheet) {
    if (timesheet.getDailyHours() == null) {
      return List.of();
    }
    var days = new ArrayList<DailyHours>(timesheet.getDailyHours().size());
    for (StoredDailyHours stored : timesheet.getDailyHours()) {
      try {
        days.add(new DailyHours(LocalDate.parse(stored.getDate()), orZero(stored.getHours())));
      } catch (DateTimeParseException | NullPointerException e) {
        log.warn(
            "Skipping daily hours with invalid date '{}' on timesheet {}",
            stored.getDate(),
            timesheet.getId());
      }
    }
    return days;
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }
}
