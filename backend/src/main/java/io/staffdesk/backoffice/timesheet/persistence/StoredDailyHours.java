package io.staffdesk.backoffice.timesheet.persistence;

import java.math.BigDecimal;

/** One element of the {@code daily_hours} JSONB array. The date is kept as an ISO string. */
public class StoredDailyHours {

  private String date;
  private BigDecimal hours;

  public StoredDailyHours() {}

  public StoredDailyHours(String date, BigDecimal hours) {
    this.date = date;
    this.hours = hours;
  }

  public String getDate() {
    return date;
  }

  public void setDate(String date) {
    this.date = date;
  }

  public BigDecimal getHours() {
    return hours;
  }

  public void setHours(BigDecimal hours) {
    this.hours = hours;
  }
}
