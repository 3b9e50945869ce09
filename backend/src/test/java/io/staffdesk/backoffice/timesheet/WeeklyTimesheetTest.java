package io.staffdesk.backoffice.timesheet;

import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.JOBSEEKER_PROFILE_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.POSITION_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.flatProfile;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.overtimeProfile;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.timesheet;
import static org.assertj.core.api.Assertions.assertThat;

import io.staffdesk.backoffice.timesheet.gateway.DailyHours;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WeeklyTimesheetTest {

  @Test
  void editingOneDayRecomputesTheWholeWeek() {
    var timesheet = timesheet(overtimeProfile(), 8, 8, 8, 8, 8);
    assertThat(timesheet.getTotalOvertimeHours()).isEqualByComparingTo("0");

    timesheet.updateHours(LocalDate.of(2024, 6, 6), new BigDecimal("10"));

    assertThat(timesheet.getTotalRegularHours()).isEqualByComparingTo("40");
    assertThat(timesheet.getTotalOvertimeHours()).isEqualByComparingTo("2");
    assertThat(timesheet.getJobseekerPay()).isEqualByComparingTo("860");
    assertThat(timesheet.getClientBill()).isEqualByComparingTo("1290");
  }

  @Test
  void bonusAndDeductionChangePayButNotBill() {
    var timesheet = timesheet(flatProfile(), 8, 8);
    var billBefore = timesheet.getClientBill();

    timesheet.setBonusAmount(new BigDecimal("25"));
    timesheet.setDeductionAmount(new BigDecimal("5"));

    assertThat(timesheet.getJobseekerPay()).isEqualByComparingTo("340");
    assertThat(timesheet.getClientBill()).isEqualByComparingTo(billBefore);
  }

  @Test
  void negativeBonusIsClampedToZero() {
    var timesheet = timesheet(flatProfile(), 8);

    timesheet.setBonusAmount(new BigDecimal("-30"));

    assertThat(timesheet.getBonusAmount()).isEqualByComparingTo("0");
    assertThat(timesheet.getJobseekerPay()).isEqualByComparingTo("160");
  }

  @Test
  void flagsNonPositivePay() {
    var timesheet = timesheet(flatProfile());

    assertThat(timesheet.hasNonPositivePay()).isTrue();

    timesheet.updateHours(Map.of(LocalDate.of(2024, 6, 3), new BigDecimal("1")));

    assertThat(timesheet.hasNonPositivePay()).isFalse();
  }

  @Test
  void payloadCarriesKeyWeekHoursTotalsAndRates() {
    var timesheet = timesheet(overtimeProfile(), 8, 8, 8, 8, 8, 8, 0);
    timesheet.setInvoiceNumber("000123");
    timesheet.setEmailSent(true);
    timesheet.setNotes("night shift");

    var payload = timesheet.toPayload();

    assertThat(payload.id()).isNull();
    assertThat(payload.jobseekerProfileId()).isEqualTo(JOBSEEKER_PROFILE_ID);
    assertThat(payload.positionId()).isEqualTo(POSITION_ID);
    assertThat(payload.weekStartDate()).isEqualTo(LocalDate.of(2024, 6, 2));
    assertThat(payload.weekEndDate()).isEqualTo(LocalDate.of(2024, 6, 8));
    assertThat(payload.dailyHours()).hasSize(7).extracting(DailyHours::date).isSorted();
    assertThat(payload.totalRegularHours()).isEqualByComparingTo("40.00");
    assertThat(payload.totalOvertimeHours()).isEqualByComparingTo("8.00");
    assertThat(payload.regularPayRate()).isEqualByComparingTo("20");
    assertThat(payload.overtimeBillRate()).isEqualByComparingTo("45");
    assertThat(payload.totalJobseekerPay()).isEqualByComparingTo("1040");
    assertThat(payload.totalClientBill()).isEqualByComparingTo("1560");
    assertThat(payload.overtimeEnabled()).isTrue();
    assertThat(payload.markup()).isEqualByComparingTo("50");
    assertThat(payload.emailSent()).isTrue();
    assertThat(payload.invoiceNumber()).isEqualTo("000123");
    assertThat(payload.notes()).isEqualTo("night shift");
  }

  @Test
  void hoursAlwaysEqualRegularPlusOvertimeAfterEdits() {
    var timesheet = timesheet(overtimeProfile(), 8, 8, 8, 8, 8);
    var dates = timesheet.getWeek().dates();

    timesheet.updateHours(dates.get(5), new BigDecimal("11.25"));
    timesheet.updateHours(dates.get(0), new BigDecimal("2"));
    timesheet.updateHours(dates.get(6), new BigDecimal("4.5"));

    var entered =
        timesheet.getEntries().stream()
            .map(DailyEntry::hours)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    assertThat(timesheet.getTotalRegularHours().add(timesheet.getTotalOvertimeHours()))
        .isEqualByComparingTo(entered);
  }

  @Test
  void fractionalHours_areHeldAtTwoDecimalsSoStoredFiguresAgree() {
    var payload = timesheet(flatProfile(), 8.333, 8.333, 8.333).toPayload();

    var storedHours = sumOf(payload);
    assertThat(payload.dailyHours().get(0).hours()).isEqualByComparingTo("8.33");
    assertThat(storedHours).isEqualByComparingTo("24.99");
    assertThat(payload.totalRegularHours().add(payload.totalOvertimeHours()))
        .isEqualByComparingTo(storedHours);
    assertThat(payload.totalJobseekerPay())
        .isEqualByComparingTo(payload.totalRegularHours().multiply(payload.regularPayRate()));
  }

  @Test
  void fractionalHoursAcrossThreshold_splitWithoutRoundingDrift() {
    var payload = timesheet(overtimeProfile(), 10.555, 10.555, 10.555, 10.555).toPayload();

    assertThat(sumOf(payload)).isEqualByComparingTo("42.24");
    assertThat(payload.totalRegularHours()).isEqualByComparingTo("40");
    assertThat(payload.totalOvertimeHours()).isEqualByComparingTo("2.24");
    assertThat(payload.totalJobseekerPay()).isEqualByComparingTo("867.20");
    assertThat(payload.totalClientBill()).isEqualByComparingTo("1300.80");
  }

  private static BigDecimal sumOf(TimesheetRecord payload) {
    return payload.dailyHours().stream()
        .map(DailyHours::hours)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
