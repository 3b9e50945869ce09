package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.exception.InvalidStateException;
import io.staffdesk.backoffice.position.PositionRateProfile;
import io.staffdesk.backoffice.position.PositionRateProfileService;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One user's interactive timesheet entry. Selecting a jobseeker, position and week loads the
 * matching timesheet in the background; edits recompute synchronously; submission runs in the
 * background and re-reads the stored state when it succeeds.
 *
 * <p>A background load is applied only if no newer selection was made since it started. A
 * background submission is applied only while the timesheet it submitted is still the current one.
 * A second submission of the same timesheet while one is running is rejected.
 */
public class TimesheetSession {

  private static final Logger log = LoggerFactory.getLogger(TimesheetSession.class);

  private final TimesheetReconciler reconciler;
  private final PositionRateProfileService rateProfileService;
  private final Executor executor;
  private final Clock clock;
  private final Duration statusMessageTtl;

  private TimesheetSelection selection = new TimesheetSelection(null, null, null, null);
  private WeeklyTimesheet timesheet;
  private TimesheetState state = TimesheetState.UNINITIALIZED;
  private boolean lookupFailed;
  private StatusMessage statusMessage;
  private long loadGeneration;

  TimesheetSession(
      TimesheetReconciler reconciler,
      PositionRateProfileService rateProfileService,
      Executor executor,
      Clock clock,
      Duration statusMessageTtl) {
    this.reconciler = reconciler;
    this.rateProfileService = rateProfileService;
    this.executor = executor;
    this.clock = clock;
    this.statusMessageTtl = statusMessageTtl;
  }

  /**
   * Changes the selection and discards the current timesheet. When the selection is complete the
   * matching timesheet is loaded in the background; the returned future completes once it has been
   * applied or discarded.
   */
  public CompletableFuture<Void> select(TimesheetSelection newSelection) {
    Objects.requireNonNull(newSelection, "selection");
    final long generation;
    synchronized (this) {
      generation = ++loadGeneration;
      selection = newSelection;
      timesheet = null;
      state = TimesheetState.UNINITIALIZED;
      lookupFailed = false;
    }
    if (!newSelection.isComplete()) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.supplyAsync(() -> load(newSelection), executor)
        .handle(
            (loaded, ex) -> {
              applyLoaded(generation, newSelection, loaded, ex);
              return null;
            });
  }

  /** Loads the current selection again, e.g. after a failed lookup. */
  public CompletableFuture<Void> reload() {
    TimesheetSelection current;
    synchronized (this) {
      current = selection;
    }
    return select(current);
  }

  private Loaded load(TimesheetSelection forSelection) {
    PositionRateProfile profile = rateProfileService.getProfile(forSelection.positionId());
    Optional<TimesheetRecord> existing;
    boolean failed = false;
    try {
      existing = reconciler.findExisting(forSelection);
    } catch (RuntimeException e) {
      log.warn("Timesheet lookup failed for {}: {}", forSelection.key(), e.getMessage());
      existing = Optional.empty();
      failed = true;
    }
    return new Loaded(reconciler.seed(forSelection, profile, existing), failed);
  }

  private synchronized void applyLoaded(
      long generation, TimesheetSelection forSelection, Loaded loaded, Throwable failure) {
    if (generation != loadGeneration) {
      log.debug("Discarding timesheet load for superseded selection {}", forSelection.key());
      return;
    }
    if (failure != null) {
      Throwable cause = unwrap(failure);
      log.warn("Could not open timesheet for {}: {}", forSelection.key(), cause.getMessage());
      statusMessage = error("Could not load timesheet: " + cause.getMessage());
      return;
    }
    timesheet = loaded.timesheet();
    lookupFailed = loaded.lookupFailed();
    state =
        loaded.timesheet().isExisting()
            ? TimesheetState.SEEDED_EXISTING
            : TimesheetState.SEEDED_NEW;
    if (lookupFailed) {
      statusMessage = error("Could not load existing timesheet; starting a new one");
    }
  }

  public synchronized void updateHours(LocalDate date, BigDecimal hours) {
    requireEditable().updateHours(date, hours);
    state = TimesheetState.EDITED;
  }

  public synchronized void setBonusAmount(BigDecimal amount) {
    requireEditable().setBonusAmount(amount);
    state = TimesheetState.EDITED;
  }

  public synchronized void setDeductionAmount(BigDecimal amount) {
    requireEditable().setDeductionAmount(amount);
    state = TimesheetState.EDITED;
  }

  public synchronized void setEmailSent(boolean emailSent) {
    requireEditable().setEmailSent(emailSent);
    state = TimesheetState.EDITED;
  }

  public synchronized void setNotes(String notes) {
    requireEditable().setNotes(notes);
    state = TimesheetState.EDITED;
  }

  private WeeklyTimesheet requireEditable() {
    if (timesheet == null) {
      throw new InvalidStateException(
          "No timesheet selected", "Select a jobseeker, position and week first");
    }
    if (state == TimesheetState.SUBMITTING) {
      throw new InvalidStateException(
          "Submission in progress", "The timesheet cannot be edited while it is being submitted");
    }
    return timesheet;
  }

  /**
   * Submits the current timesheet in the background. The future completes with the stored record,
   * or exceptionally with a {@link TimesheetSubmissionException}; in that case the entered values
   * are kept.
   *
   * @throws InvalidStateException when nothing is selected or a submission is already running
   */
  public CompletableFuture<TimesheetRecord> submit() {
    final WeeklyTimesheet toSubmit;
    final TimesheetSelection forSelection;
    synchronized (this) {
      if (timesheet == null) {
        throw new InvalidStateException(
            "No timesheet selected", "Select a jobseeker, position and week first");
      }
      if (!timesheet.beginSubmit()) {
        throw new InvalidStateException(
            "Submission in progress", "This timesheet is already being submitted");
      }
      toSubmit = timesheet;
      forSelection = selection;
      state = TimesheetState.SUBMITTING;
    }
    boolean wasExisting = toSubmit.isExisting();
    return CompletableFuture.supplyAsync(
            () -> {
              TimesheetRecord saved = reconciler.submit(toSubmit);
              var refreshed = reconciler.refresh(forSelection, toSubmit.getRateProfile(), saved);
              return new Submitted(saved, refreshed);
            },
            executor)
        .whenComplete((submitted, ex) -> applySubmitted(toSubmit, wasExisting, submitted, ex))
        .thenApply(Submitted::saved);
  }

  private synchronized void applySubmitted(
      WeeklyTimesheet submittedTimesheet,
      boolean wasExisting,
      Submitted submitted,
      Throwable failure) {
    submittedTimesheet.endSubmit();
    if (submittedTimesheet != timesheet) {
      log.debug("Timesheet {} was replaced during its submission", submittedTimesheet.key());
      return;
    }
    if (failure != null) {
      state = TimesheetState.EDITED;
      statusMessage = error("Failed to save timesheet: " + reasonOf(unwrap(failure)));
      return;
    }
    timesheet = submitted.refreshed();
    state = TimesheetState.SEEDED_EXISTING;
    lookupFailed = false;
    statusMessage = success(wasExisting ? "Timesheet updated" : "Timesheet created");
  }

  private StatusMessage success(String text) {
    return StatusMessage.success(text, clock.instant(), statusMessageTtl);
  }

  private StatusMessage error(String text) {
    return StatusMessage.error(text, clock.instant(), statusMessageTtl);
  }

  private static Throwable unwrap(Throwable failure) {
    if (failure instanceof CompletionException && failure.getCause() != null) {
      return failure.getCause();
    }
    return failure;
  }

  private static String reasonOf(Throwable failure) {
    if (failure instanceof TimesheetSubmissionException submission) {
      return submission.getReason();
    }
    return failure.getMessage();
  }

  public synchronized TimesheetSelection getSelection() {
    return selection;
  }

  public synchronized Optional<WeeklyTimesheet> getTimesheet() {
    return Optional.ofNullable(timesheet);
  }

  public synchronized TimesheetState getState() {
    return state;
  }

  /** True when the last load could not reach the store and a new timesheet was seeded instead. */
  public synchronized boolean isLookupFailed() {
    return lookupFailed;
  }

  /** True while the current timesheet is being submitted. */
  public synchronized boolean isSubmitting() {
    return timesheet != null && timesheet.isSubmitting();
  }

  /** The latest status message, unless it has expired. */
  public synchronized Optional<StatusMessage> getStatusMessage() {
    if (statusMessage == null || statusMessage.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(statusMessage);
  }

  private record Loaded(WeeklyTimesheet timesheet, boolean lookupFailed) {}

  private record Submitted(TimesheetRecord saved, WeeklyTimesheet refreshed) {}
}
