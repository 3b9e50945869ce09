package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.audit.AuditEvent;
import io.staffdesk.backoffice.audit.AuditService;
import io.staffdesk.backoffice.exception.InvalidStateException;
import io.staffdesk.backoffice.position.PositionRateProfileService;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetGateway;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import io.staffdesk.backoffice.timesheet.persistence.TimesheetRecordService;
import io.staffdesk.backoffice.timesheet.persistence.TimesheetSearchCriteria;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Request-scoped entry points of the timesheet engine. Totals are always recomputed here from the
 * position's rates; totals sent by a client are never stored.
 *
 * <p>Not transactional itself: every gateway write commits on its own, so in a batch the
 * timesheets saved before a failure stay saved.
 */
@Service
public class TimesheetService {

  private static final Logger log = LoggerFactory.getLogger(TimesheetService.class);

  private final WeekPeriodGenerator weekPeriodGenerator;
  private final TimesheetReconciler reconciler;
  private final PositionRateProfileService rateProfileService;
  private final TimesheetGateway gateway;
  private final TimesheetRecordService recordService;
  private final AuditService auditService;

  public TimesheetService(
      WeekPeriodGenerator weekPeriodGenerator,
      TimesheetReconciler reconciler,
      PositionRateProfileService rateProfileService,
      TimesheetGateway gateway,
      TimesheetRecordService recordService,
      AuditService auditService) {
    this.weekPeriodGenerator = weekPeriodGenerator;
    this.reconciler = reconciler;
    this.rateProfileService = rateProfileService;
    this.gateway = gateway;
    this.recordService = recordService;
    this.auditService = auditService;
  }

  public List<WeekPeriod> weekOptions(Integer count) {
    if (count != null && (count <= 0 || count > WeekPeriodGenerator.MAX_WEEKS)) {
      throw new InvalidStateException(
          "Invalid week count",
          "count must be between 1 and " + WeekPeriodGenerator.MAX_WEEKS);
    }
    return count == null ? weekPeriodGenerator.recentWeeks() : weekPeriodGenerator.weeks(count);
  }

  public String generateInvoiceNumber() {
    return reconciler.generateInvoiceNumberOrPlaceholder();
  }

  public List<TimesheetRecord> lookup(
      UUID jobseekerUserId, LocalDate weekStart, LocalDate weekEnd) {
    if (weekEnd.isBefore(weekStart)) {
      throw new InvalidStateException(
          "Invalid week range", "weekEnd " + weekEnd + " is before weekStart " + weekStart);
    }
    return gateway.lookupByJobseekerAndWeek(jobseekerUserId, weekStart, weekEnd);
  }

  /** Computes the overtime split and pay figures for the input without storing anything. */
  public WeeklyTimesheet preview(TimesheetInput input) {
    var selection = requireValidSelection(input);
    var profile = rateProfileService.getProfile(selection.positionId());
    var timesheet = reconciler.draft(selection, profile);
    input.applyTo(timesheet);
    return timesheet;
  }

  /** Saves the input as the timesheet of its jobseeker, position and week, creating or updating. */
  public TimesheetRecord submit(TimesheetInput input) {
    var timesheet = prepare(input);
    warnIfNonPositivePay(timesheet);
    return reconciler.submit(timesheet);
  }

  /**
   * Submits several timesheets. Every input is validated and computed before the first write; a
   * write failure is reported for its timesheet and the rest are still submitted.
   */
  public BatchSubmissionResult submitBatch(List<TimesheetInput> inputs) {
    if (inputs.isEmpty()) {
      throw new InvalidStateException("Empty batch", "At least one timesheet is required");
    }
    var keys = inputs.stream().map(i -> i.selection().key()).distinct().count();
    if (keys != inputs.size()) {
      throw new InvalidStateException(
          "Duplicate timesheets in batch",
          "Each jobseeker, position and week may appear only once per batch");
    }
    var prepared = new ArrayList<WeeklyTimesheet>(inputs.size());
    for (TimesheetInput input : inputs) {
      var timesheet = prepare(input);
      warnIfNonPositivePay(timesheet);
      prepared.add(timesheet);
    }
    return reconciler.submitAll(prepared);
  }

  /**
   * Replaces the stored timesheet {@code id} with the input. The stored invoice number is kept.
   *
   * @throws InvalidStateException when the input names a different jobseeker, position or week
   *     than the stored timesheet
   */
  public TimesheetRecord update(UUID id, TimesheetInput input) {
    var selection = requireValidSelection(input);
    var existing = recordService.getTimesheet(id);
    if (!existing.key().equals(selection.key())) {
      throw new InvalidStateException(
          "Timesheet cannot be moved",
          "Timesheet "
              + id
              + " belongs to position "
              + existing.positionId()
              + " and week "
              + existing.weekStartDate()
              + "; submit a new timesheet for a different week");
    }
    var profile = rateProfileService.getProfile(selection.positionId());
    var timesheet = reconciler.seed(selection, profile, Optional.of(existing));
    input.applyTo(timesheet);
    warnIfNonPositivePay(timesheet);
    return reconciler.submit(timesheet);
  }

  public TimesheetRecord getTimesheet(UUID id) {
    return recordService.getTimesheet(id);
  }

  public Page<TimesheetRecord> search(TimesheetSearchCriteria criteria, Pageable pageable) {
    return recordService.search(criteria, pageable);
  }

  public void deleteTimesheet(UUID id) {
    recordService.deleteTimesheet(id);
  }

  public List<AuditEvent> activity(UUID id) {
    recordService.getTimesheet(id);
    return auditService.findByEntity("timesheet", id);
  }

  private WeeklyTimesheet prepare(TimesheetInput input) {
    var selection = requireValidSelection(input);
    var profile = rateProfileService.getProfile(selection.positionId());
    var timesheet = reconciler.prepare(selection, profile);
    input.applyTo(timesheet);
    return timesheet;
  }

  private static TimesheetSelection requireValidSelection(TimesheetInput input) {
    var selection = input.selection();
    if (selection == null || !selection.isComplete()) {
      throw new InvalidStateException(
          "Incomplete selection", "Jobseeker, position and week start are all required");
    }
    if (selection.weekStartDate().getDayOfWeek() != DayOfWeek.SUNDAY) {
      throw new InvalidStateException(
          "Invalid week start", "Week start " + selection.weekStartDate() + " is not a Sunday");
    }
    return selection;
  }

  private static void warnIfNonPositivePay(WeeklyTimesheet timesheet) {
    if (timesheet.hasNonPositivePay()) {
      log.warn(
          "Timesheet for {} has non-positive jobseeker pay {}",
          timesheet.key(),
          timesheet.getJobseekerPay());
    }
  }
}
