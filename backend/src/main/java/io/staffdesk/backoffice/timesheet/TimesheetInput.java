package io.staffdesk.backoffice.timesheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Values entered for one timesheet: what was selected and what was typed in.
 *
 * @param hoursByDate hours per date; dates left out keep their current value
 */
public record TimesheetInput(
    TimesheetSelection selection,
    Map<LocalDate, BigDecimal> hoursByDate,
    BigDecimal bonusAmount,
    BigDecimal deductionAmount,
    boolean emailSent,
    String notes) {

  public TimesheetInput {
    hoursByDate = hoursByDate != null ? Map.copyOf(hoursByDate) : Map.of();
  }

  /** Applies the entered values to a working timesheet, recomputing its totals. */
  void applyTo(WeeklyTimesheet timesheet) {
    timesheet.updateHours(hoursByDate);
    timesheet.setBonusAmount(bonusAmount);
    timesheet.setDeductionAmount(deductionAmount);
    timesheet.setEmailSent(emailSent);
    timesheet.setNotes(notes);
  }
}
