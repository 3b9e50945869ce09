package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.config.TimesheetProperties;
import io.staffdesk.backoffice.exception.ResourceConflictException;
import io.staffdesk.backoffice.position.PositionRateProfile;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetGateway;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles a working {@link WeeklyTimesheet} with what is already stored: finds the stored
 * record for the same jobseeker, position and week, seeds from it or starts a new one, and
 * submits through the create or update path accordingly.
 */
@Component
public class TimesheetReconciler {

  private static final Logger log = LoggerFactory.getLogger(TimesheetReconciler.class);

  private final TimesheetGateway gateway;
  private final DailyHoursAggregator aggregator;
  private final OvertimeAllocator allocator;
  private final PayBillCalculator calculator;
  private final String invoicePlaceholder;

  public TimesheetReconciler(
      TimesheetGateway gateway,
      DailyHoursAggregator aggregator,
      OvertimeAllocator allocator,
      PayBillCalculator calculator,
      TimesheetProperties properties) {
    this.gateway = gateway;
    this.aggregator = aggregator;
    this.allocator = allocator;
    this.calculator = calculator;
    this.invoicePlaceholder = properties.invoicePlaceholder();
  }

  /**
   * Picks the fetched record stored under {@code key}.
   *
   * @throws ResourceConflictException when more than one record shares the key
   */
  public Optional<TimesheetRecord> match(List<TimesheetRecord> fetched, TimesheetKey key) {
    var matches = fetched.stream().filter(r -> key.equals(r.key())).toList();
    if (matches.size() > 1) {
      throw new ResourceConflictException(
          "Duplicate timesheet",
          "Found "
              + matches.size()
              + " timesheets for position "
              + key.positionId()
              + " and week "
              + key.weekStartDate());
    }
    return matches.stream().findFirst();
  }

  /** Fetches the jobseeker's timesheets for the selected week and matches the selection's key. */
  public Optional<TimesheetRecord> findExisting(TimesheetSelection selection) {
    var week = selection.week();
    var fetched =
        gateway.lookupByJobseekerAndWeek(
            selection.jobseekerUserId(), week.weekStart(), week.weekEnd());
    return match(fetched, selection.key());
  }

  /**
   * Builds the working timesheet. With a stored record its hours, bonus, deduction, notes, email
   * flag, invoice number and id are carried over; otherwise the week starts at zero hours with a
   * freshly reserved invoice number.
   */
  public WeeklyTimesheet seed(
      TimesheetSelection selection,
      PositionRateProfile profile,
      Optional<TimesheetRecord> existing) {
    if (existing.isEmpty()) {
      var timesheet = blank(selection, profile);
      timesheet.setInvoiceNumber(generateInvoiceNumberOrPlaceholder());
      return timesheet;
    }
    var record = existing.get();
    var timesheet =
        new WeeklyTimesheet(
            selection,
            profile,
            aggregator.seed(selection.week(), record.dailyHours()),
            aggregator,
            allocator,
            calculator);
    timesheet.setBonusAmount(record.bonusAmount());
    timesheet.setDeductionAmount(record.deductionAmount());
    timesheet.setEmailSent(record.emailSent());
    timesheet.setNotes(record.notes());
    timesheet.markPersisted(record);
    log.debug(
        "Seeded timesheet {} for position {} week {}",
        record.id(),
        selection.positionId(),
        selection.weekStartDate());
    return timesheet;
  }

  /** Looks up and seeds in one step. */
  public WeeklyTimesheet open(TimesheetSelection selection, PositionRateProfile profile) {
    return seed(selection, profile, findExisting(selection));
  }

  /**
   * Seeds from the stored record when there is one, else starts a draft. The draft's placeholder
   * invoice number is replaced by the gateway inside the create transaction.
   */
  public WeeklyTimesheet prepare(TimesheetSelection selection, PositionRateProfile profile) {
    var existing = findExisting(selection);
    return existing.isPresent()
        ? seed(selection, profile, existing)
        : draft(selection, profile);
  }

  /**
   * A zero-hour timesheet carrying the invoice placeholder. Used for previews, which must not
   * reserve invoice numbers.
   */
  public WeeklyTimesheet draft(TimesheetSelection selection, PositionRateProfile profile) {
    var timesheet = blank(selection, profile);
    timesheet.setInvoiceNumber(invoicePlaceholder);
    return timesheet;
  }

  private WeeklyTimesheet blank(TimesheetSelection selection, PositionRateProfile profile) {
    return new WeeklyTimesheet(
        selection,
        profile,
        aggregator.seed(selection.week(), List.of()),
        aggregator,
        allocator,
        calculator);
  }

  /** Next invoice number from the gateway, or the placeholder when the gateway fails. */
  public String generateInvoiceNumberOrPlaceholder() {
    try {
      return gateway.generateInvoiceNumber();
    } catch (RuntimeException e) {
      log.warn("Invoice number generation failed, using placeholder: {}", e.getMessage());
      return invoicePlaceholder;
    }
  }

  /**
   * Persists the timesheet: update when it was seeded from a stored record, create otherwise. On
   * success the timesheet is pointed at the stored record; on failure it is left untouched.
   *
   * @throws TimesheetSubmissionException when the gateway rejects the write
   */
  public TimesheetRecord submit(WeeklyTimesheet timesheet) {
    var payload = timesheet.toPayload();
    TimesheetRecord saved;
    try {
      if (timesheet.isExisting()) {
        saved = gateway.update(timesheet.getExistingTimesheetId(), payload);
      } else {
        saved = gateway.create(payload);
      }
    } catch (RuntimeException e) {
      log.warn("Timesheet submission failed for {}: {}", timesheet.key(), e.getMessage());
      throw new TimesheetSubmissionException(timesheet.key(), e);
    }
    timesheet.markPersisted(saved);
    log.info(
        "Submitted timesheet {} (invoice {}) for position {} week {}",
        saved.id(),
        saved.invoiceNumber(),
        saved.positionId(),
        saved.weekStartDate());
    return saved;
  }

  /**
   * Re-reads the stored state after a submission so that further edits go through the update
   * path. Falls back to the record returned by the write when the lookup fails or misses.
   */
  public WeeklyTimesheet refresh(
      TimesheetSelection selection, PositionRateProfile profile, TimesheetRecord saved) {
    Optional<TimesheetRecord> stored;
    try {
      stored = findExisting(selection);
    } catch (RuntimeException e) {
      log.warn("Refresh after submission failed for {}: {}", selection.key(), e.getMessage());
      stored = Optional.empty();
    }
    return seed(selection, profile, Optional.of(stored.orElse(saved)));
  }

  /**
   * Submits each timesheet in order. A failure does not stop the remaining submissions and does
   * not undo earlier ones.
   */
  public BatchSubmissionResult submitAll(List<WeeklyTimesheet> timesheets) {
    var outcomes = new ArrayList<SubmissionOutcome>(timesheets.size());
    for (WeeklyTimesheet timesheet : timesheets) {
      try {
        outcomes.add(SubmissionOutcome.succeeded(timesheet.key(), submit(timesheet)));
      } catch (TimesheetSubmissionException e) {
        outcomes.add(SubmissionOutcome.failed(e.getKey(), e.getReason()));
      }
    }
    var result = new BatchSubmissionResult(outcomes);
    if (result.failed() > 0) {
      log.warn(
          "Batch submission finished with {} of {} failed",
          result.failed(),
          result.outcomes().size());
    }
    return result;
  }
}
