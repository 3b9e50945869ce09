package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.exception.InvalidStateException;
import io.staffdesk.backoffice.timesheet.gateway.DailyHours;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Builds the seven per-day entries of a timesheet week. */
@Component
public class DailyHoursAggregator {

  /**
   * One entry per date of {@code week}, in date order. Hours come from {@code stored} when it has a
   * value for that date, else zero; stored dates outside the week are ignored. Overtime starts at
   * zero.
   */
  public List<DailyEntry> seed(WeekPeriod week, List<DailyHours> stored) {
    var hoursByDate = new HashMap<LocalDate, BigDecimal>();
    if (stored != null) {
      for (DailyHours day : stored) {
        if (day != null && day.date() != null && week.contains(day.date())) {
          hoursByDate.put(day.date(), day.hours());
        }
      }
    }
    var entries = new ArrayList<DailyEntry>(WeekPeriod.DAYS_IN_WEEK);
    for (LocalDate date : week.dates()) {
      entries.add(new DailyEntry(date, hoursByDate.get(date), BigDecimal.ZERO));
    }
    return entries;
  }

  /**
   * Replaces the hours of the entry for {@code date}, leaving every other entry untouched.
   *
   * @throws InvalidStateException when {@code date} is not part of the week
   */
  public List<DailyEntry> replaceHours(List<DailyEntry> entries, LocalDate date, BigDecimal hours) {
    var updated = new ArrayList<DailyEntry>(entries.size());
    boolean found = false;
    for (DailyEntry entry : entries) {
      if (entry.date().equals(date)) {
        updated.add(entry.withHours(hours));
        found = true;
      } else {
        updated.add(entry);
      }
    }
    if (!found) {
      throw new InvalidStateException(
          "Date outside week", "No timesheet entry for " + date + " in this week");
    }
    return updated;
  }

  /** Applies a whole set of submitted hours, keyed by date, onto the week's entries. */
  public List<DailyEntry> replaceAll(List<DailyEntry> entries, Map<LocalDate, BigDecimal> hours) {
    var updated = entries;
    for (var day : hours.entrySet()) {
      updated = replaceHours(updated, day.getKey(), day.getValue());
    }
    return updated;
  }
}
