package io.staffdesk.backoffice.timesheet;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** A Sunday-to-Saturday calendar week. */
public record WeekPeriod(LocalDate weekStart, LocalDate weekEnd) {

  public static final int DAYS_IN_WEEK = 7;

  private static final DateTimeFormatter LABEL_FORMAT =
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

  public WeekPeriod {
    if (weekStart.getDayOfWeek() != DayOfWeek.SUNDAY) {
      throw new IllegalArgumentException("Week must start on a Sunday: " + weekStart);
    }
    if (!weekEnd.equals(weekStart.plusDays(DAYS_IN_WEEK - 1))) {
      throw new IllegalArgumentException(
          "Week must span seven days: " + weekStart + ".." + weekEnd);
    }
  }

  /** The week that contains {@code date}. */
  public static WeekPeriod containing(LocalDate date) {
    LocalDate start = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
    return new WeekPeriod(start, start.plusDays(DAYS_IN_WEEK - 1));
  }

  public List<LocalDate> dates() {
    var dates = new ArrayList<LocalDate>(DAYS_IN_WEEK);
    for (int i = 0; i < DAYS_IN_WEEK; i++) {
      dates.add(weekStart.plusDays(i));
    }
    return dates;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(weekStart) && !date.isAfter(weekEnd);
  }

  public String label() {
    return LABEL_FORMAT.format(weekStart) + " - " + LABEL_FORMAT.format(weekEnd);
  }
}
