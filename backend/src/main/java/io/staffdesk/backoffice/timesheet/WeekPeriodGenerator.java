package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.config.TimesheetProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Produces the week options a timesheet can be entered for, most recent first. */
@Component
public class WeekPeriodGenerator {

  /** Ten years of weeks. */
  public static final int MAX_WEEKS = 520;

  private final Clock clock;
  private final TimesheetProperties properties;

  public WeekPeriodGenerator(Clock clock, TimesheetProperties properties) {
    this.clock = clock;
    this.properties = properties;
  }

  /** The configured window of weeks ending with the current one. */
  public List<WeekPeriod> recentWeeks() {
    return weeks(LocalDate.now(clock), Math.min(properties.weekWindow(), MAX_WEEKS));
  }

  public List<WeekPeriod> weeks(int count) {
    return weeks(LocalDate.now(clock), count);
  }

  /**
   * Returns {@code count} consecutive weeks in descending order, the first being the week that
   * contains {@code today}.
   */
  public List<WeekPeriod> weeks(LocalDate today, int count) {
    if (count <= 0 || count > MAX_WEEKS) {
      throw new IllegalArgumentException(
          "Week count must be between 1 and " + MAX_WEEKS + ": " + count);
    }
    var weeks = new ArrayList<WeekPeriod>(count);
    for (int i = 0; i < count; i++) {
      weeks.add(WeekPeriod.containing(today.minusWeeks(i)));
    }
    return weeks;
  }
}
