package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.config.TimesheetProperties;
import io.staffdesk.backoffice.position.PositionRateProfile;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits a week's hours into regular and overtime at the position's weekly threshold, then spreads
 * the overtime over the days in proportion to the hours worked on each.
 *
 * <p>The proportional spread is a display convenience, not a daily-overtime rule. Jurisdictions
 * that count overtime per day need a different allocation.
 */
@Component
public class OvertimeAllocator {

  /** Scale of the per-day overtime shares; keeps their sum within 1e-9 of the weekly total. */
  static final int SHARE_SCALE = 10;

  private final BigDecimal defaultThreshold;

  public OvertimeAllocator(TimesheetProperties properties) {
    this.defaultThreshold = properties.defaultOvertimeThreshold();
  }

  public OvertimeAllocation allocate(List<DailyEntry> entries, PositionRateProfile profile) {
    BigDecimal weeklyTotal =
        entries.stream().map(DailyEntry::hours).reduce(BigDecimal.ZERO, BigDecimal::add);

    if (!profile.overtimeEnabled()) {
      return new OvertimeAllocation(weeklyTotal, BigDecimal.ZERO, withoutOvertime(entries));
    }

    BigDecimal threshold = thresholdFor(profile);
    BigDecimal regular = weeklyTotal.min(threshold);
    BigDecimal overtime = weeklyTotal.subtract(threshold).max(BigDecimal.ZERO);

    if (overtime.signum() == 0 || weeklyTotal.signum() == 0) {
      return new OvertimeAllocation(regular, overtime, withoutOvertime(entries));
    }

    var allocated = new ArrayList<DailyEntry>(entries.size());
    for (DailyEntry entry : entries) {
      if (entry.hours().signum() == 0) {
        allocated.add(entry.withOvertimeHours(BigDecimal.ZERO));
      } else {
        BigDecimal share =
            overtime.multiply(entry.hours()).divide(weeklyTotal, SHARE_SCALE, RoundingMode.HALF_UP);
        allocated.add(entry.withOvertimeHours(share));
      }
    }
    return new OvertimeAllocation(regular, overtime, allocated);
  }

  /** A position's own threshold when set and positive, else the configured default. */
  BigDecimal thresholdFor(PositionRateProfile profile) {
    BigDecimal own = profile.overtimeThresholdHours();
    return own != null && own.signum() > 0 ? own : defaultThreshold;
  }

  private static List<DailyEntry> withoutOvertime(List<DailyEntry> entries) {
    return entries.stream().map(e -> e.withOvertimeHours(BigDecimal.ZERO)).toList();
  }
}
