package io.staffdesk.backoffice.timesheet;

import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.AGGREGATOR;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.ALLOCATOR;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.CALCULATOR;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.JOBSEEKER_USER_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.OTHER_POSITION_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.WEEK_START;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.overtimeProfile;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.selection;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.stored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.staffdesk.backoffice.config.TimesheetProperties;
import io.staffdesk.backoffice.exception.ResourceConflictException;
import io.staffdesk.backoffice.timesheet.gateway.DailyHours;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetGateway;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class TimesheetReconcilerTest {

  private static final UUID TIMESHEET_ID = UUID.randomUUID();

  @Mock private TimesheetGateway gateway;

  private TimesheetReconciler reconciler;

  @BeforeEach
  void setUp() {
    reconciler =
        new TimesheetReconciler(
            gateway, AGGREGATOR, ALLOCATOR, CALCULATOR, TimesheetProperties.defaults());
  }

  @Test
  void newTimesheet_getsFreshInvoiceNumberAndIsCreated() {
    when(gateway.lookupByJobseekerAndWeek(
            JOBSEEKER_USER_ID, WEEK_START, WEEK_START.plusDays(6)))
        .thenReturn(List.of());
    when(gateway.generateInvoiceNumber()).thenReturn("000042");
    when(gateway.create(any()))
        .thenAnswer(inv -> stored(inv.getArgument(0), TIMESHEET_ID, "000042", 1));

    var timesheet = reconciler.open(selection(), overtimeProfile());

    assertThat(timesheet.getInvoiceNumber()).isEqualTo("000042");
    assertThat(timesheet.getExistingTimesheetId()).isNull();
    assertThat(timesheet.isExisting()).isFalse();

    reconciler.submit(timesheet);

    verify(gateway).create(any());
    verify(gateway, never()).update(any(), any());
    assertThat(timesheet.getExistingTimesheetId()).isEqualTo(TIMESHEET_ID);
  }

  @Test
  void existingTimesheet_isSeededAndUpdated() {
    var existing = storedRecord(new BigDecimal("75"));
    when(gateway.lookupByJobseekerAndWeek(
            JOBSEEKER_USER_ID, WEEK_START, WEEK_START.plusDays(6)))
        .thenReturn(List.of(existing));
    when(gateway.update(eq(TIMESHEET_ID), any()))
        .thenAnswer(inv -> stored(inv.getArgument(1), TIMESHEET_ID, "000007", 2));

    var timesheet = reconciler.open(selection(), overtimeProfile());

    assertThat(timesheet.getExistingTimesheetId()).isEqualTo(TIMESHEET_ID);
    assertThat(timesheet.getBonusAmount()).isEqualByComparingTo("75");
    assertThat(timesheet.getEntries().get(1).hours()).isEqualByComparingTo("9");
    assertThat(timesheet.getInvoiceNumber()).isEqualTo("000007");
    assertThat(timesheet.getNotes()).isEqualTo("seeded");

    reconciler.submit(timesheet);

    verify(gateway).update(eq(TIMESHEET_ID), any());
    verify(gateway, never()).create(any());
    verify(gateway, never()).generateInvoiceNumber();
  }

  @Test
  void invoiceGeneratorFailure_fallsBackToPlaceholder() {
    when(gateway.lookupByJobseekerAndWeek(any(), any(), any())).thenReturn(List.of());
    when(gateway.generateInvoiceNumber()).thenThrow(new IllegalStateException("counter down"));

    var timesheet = reconciler.open(selection(), overtimeProfile());

    assertThat(timesheet.getInvoiceNumber()).isEqualTo("TBD");
    timesheet.updateHours(WEEK_START, new BigDecimal("8"));
    assertThat(timesheet.getJobseekerPay()).isEqualByComparingTo("160");
  }

  @Test
  void resubmittingUnchangedTimesheet_keepsTotalsAndInvoiceNumber() {
    var existing = storedRecord(BigDecimal.ZERO);
    var timesheet = reconciler.seed(selection(), overtimeProfile(), Optional.of(existing));
    var captor = ArgumentCaptor.forClass(TimesheetRecord.class);
    when(gateway.update(eq(TIMESHEET_ID), captor.capture()))
        .thenAnswer(inv -> stored(inv.getArgument(1), TIMESHEET_ID, "000007", 2));

    var saved = reconciler.submit(timesheet);

    var payload = captor.getValue();
    assertThat(payload.totalRegularHours()).isEqualByComparingTo(existing.totalRegularHours());
    assertThat(payload.totalOvertimeHours()).isEqualByComparingTo(existing.totalOvertimeHours());
    assertThat(payload.totalJobseekerPay()).isEqualByComparingTo(existing.totalJobseekerPay());
    assertThat(payload.totalClientBill()).isEqualByComparingTo(existing.totalClientBill());
    assertThat(payload.invoiceNumber()).isEqualTo("000007");
    assertThat(saved.invoiceNumber()).isEqualTo("000007");
  }

  @Test
  void match_picksRecordWithSameKeyOnly() {
    var mine = storedRecord(BigDecimal.ZERO);
    var otherPosition = withPosition(mine, UUID.randomUUID(), OTHER_POSITION_ID);

    var matched = reconciler.match(List.of(otherPosition, mine), selection().key());

    assertThat(matched).contains(mine);
  }

  @Test
  void match_rejectsMoreThanOneRecordForSameKey() {
    var first = storedRecord(BigDecimal.ZERO);
    var second = withPosition(first, UUID.randomUUID(), first.positionId());

    assertThatThrownBy(() -> reconciler.match(List.of(first, second), selection().key()))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void match_returnsEmptyWhenNothingFetched() {
    assertThat(reconciler.match(List.of(), selection().key())).isEmpty();
  }

  @Test
  void submitFailure_carriesKeyAndStatusAndLeavesTimesheetUnsaved() {
    var timesheet = reconciler.draft(selection(), overtimeProfile());
    when(gateway.create(any()))
        .thenThrow(new DataIntegrityViolationException("duplicate key value"));

    assertThatThrownBy(() -> reconciler.submit(timesheet))
        .isInstanceOfSatisfying(
            TimesheetSubmissionException.class,
            e -> {
              assertThat(e.getKey()).isEqualTo(selection().key());
              assertThat(e.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
              assertThat(e.getReason()).contains("duplicate key");
            });
    assertThat(timesheet.isExisting()).isFalse();
    assertThat(timesheet.getInvoiceNumber()).isEqualTo("TBD");
  }

  @Test
  void submitAll_reportsFailuresAndKeepsGoing() {
    var first = reconciler.draft(selection(), overtimeProfile());
    var second = reconciler.draft(selection(OTHER_POSITION_ID), overtimeProfile());
    var third = reconciler.draft(selection(UUID.randomUUID()), overtimeProfile());
    when(gateway.create(any()))
        .thenAnswer(inv -> stored(inv.getArgument(0), UUID.randomUUID(), "000001", 1))
        .thenThrow(new IllegalStateException("connection reset"))
        .thenAnswer(inv -> stored(inv.getArgument(0), UUID.randomUUID(), "000002", 1));

    var result = reconciler.submitAll(List.of(first, second, third));

    verify(gateway, times(3)).create(any());
    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.outcomes())
        .extracting(SubmissionOutcome::isSuccess)
        .containsExactly(true, false, true);
    assertThat(result.firstFailure())
        .hasValueSatisfying(
            outcome -> {
              assertThat(outcome.key()).isEqualTo(second.key());
              assertThat(outcome.error()).isEqualTo("connection reset");
            });
  }

  @Test
  void refresh_usesWriteResultWhenLookupFails() {
    var saved = storedRecord(BigDecimal.TEN);
    when(gateway.lookupByJobseekerAndWeek(any(), any(), any()))
        .thenThrow(new IllegalStateException("timeout"));

    var refreshed = reconciler.refresh(selection(), overtimeProfile(), saved);

    assertThat(refreshed.getExistingTimesheetId()).isEqualTo(TIMESHEET_ID);
    assertThat(refreshed.getBonusAmount()).isEqualByComparingTo("10");
  }

  /** A record as the engine itself would have written it for 8/9/8/8/8 hours. */
  private TimesheetRecord storedRecord(BigDecimal bonus) {
    var timesheet = reconciler.draft(selection(), overtimeProfile());
    timesheet.updateHours(WEEK_START, new BigDecimal("8"));
    timesheet.updateHours(WEEK_START.plusDays(1), new BigDecimal("9"));
    timesheet.updateHours(WEEK_START.plusDays(2), new BigDecimal("8"));
    timesheet.updateHours(WEEK_START.plusDays(3), new BigDecimal("8"));
    timesheet.updateHours(WEEK_START.plusDays(4), new BigDecimal("8"));
    timesheet.setBonusAmount(bonus);
    timesheet.setNotes("seeded");
    return stored(timesheet.toPayload(), TIMESHEET_ID, "000007", 1);
  }

  private static TimesheetRecord withPosition(TimesheetRecord r, UUID id, UUID positionId) {
    return new TimesheetRecord(
        id,
        r.jobseekerProfileId(),
        r.jobseekerUserId(),
        positionId,
        r.weekStartDate(),
        r.weekEndDate(),
        List.of(new DailyHours(LocalDate.of(2024, 6, 3), BigDecimal.ONE)),
        r.totalRegularHours(),
        r.totalOvertimeHours(),
        r.regularPayRate(),
        r.overtimePayRate(),
        r.regularBillRate(),
        r.overtimeBillRate(),
        r.totalJobseekerPay(),
        r.totalClientBill(),
        r.bonusAmount(),
        r.deductionAmount(),
        r.overtimeEnabled(),
        r.markup(),
        r.emailSent(),
        "000099",
        r.notes(),
        1);
  }
}
