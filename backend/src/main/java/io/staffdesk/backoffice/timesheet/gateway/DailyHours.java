package io.staffdesk.backoffice.timesheet.gateway;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Hours worked on one calendar date, as stored on a persisted timesheet. */
public record DailyHours(LocalDate date, BigDecimal hours) {}
