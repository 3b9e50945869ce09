package io.staffdesk.backoffice.timesheet;

import java.math.BigDecimal;
import java.util.List;

/**
 * Weekly regular/overtime split plus the per-day entries carrying their overtime share. The weekly
 * totals are authoritative; the per-day shares are a breakdown for display.
 */
public record OvertimeAllocation(
    BigDecimal regularHours, BigDecimal overtimeHours, List<DailyEntry> entries) {

  public OvertimeAllocation {
    entries = List.copyOf(entries);
  }

  public BigDecimal totalHours() {
    return regularHours.add(overtimeHours);
  }
}
