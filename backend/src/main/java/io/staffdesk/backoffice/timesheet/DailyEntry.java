package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.exception.InvalidStateException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Hours entered for one day of a timesheet week, held at two decimal places. {@code overtimeHours}
 * is this day's share of the weekly overtime, assigned by {@link OvertimeAllocator}.
 */
public record DailyEntry(LocalDate date, BigDecimal hours, BigDecimal overtimeHours) {

  static final int HOURS_SCALE = 2;

  public DailyEntry {
    Objects.requireNonNull(date, "date");
    hours = hours != null ? hours : BigDecimal.ZERO;
    overtimeHours = overtimeHours != null ? overtimeHours : BigDecimal.ZERO;
    if (hours.signum() < 0) {
      throw new InvalidStateException(
          "Invalid hours", "Hours for " + date + " must not be negative");
    }
    hours = hours.setScale(HOURS_SCALE, RoundingMode.HALF_UP);
  }

  public static DailyEntry empty(LocalDate date) {
    return new DailyEntry(date, BigDecimal.ZERO, BigDecimal.ZERO);
  }

  /** A copy with new hours; its overtime share is reset until the week is re-allocated. */
  public DailyEntry withHours(BigDecimal newHours) {
    return new DailyEntry(date, newHours, BigDecimal.ZERO);
  }

  public DailyEntry withOvertimeHours(BigDecimal newOvertimeHours) {
    return new DailyEntry(date, hours, newOvertimeHours);
  }
}
