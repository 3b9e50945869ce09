package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.position.PositionRateProfile;
import io.staffdesk.backoffice.timesheet.gateway.DailyHours;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Working copy of one jobseeker's timesheet for one position and week. Every change to hours,
 * bonus or deduction recomputes the overtime split and the pay figures before returning, so the
 * derived totals are always consistent with the entries.
 *
 * <p>Not thread-safe; {@link TimesheetSession} guards access.
 */
public class WeeklyTimesheet {

  private final TimesheetSelection selection;
  private final WeekPeriod week;
  private final PositionRateProfile rateProfile;
  private final DailyHoursAggregator aggregator;
  private final OvertimeAllocator allocator;
  private final PayBillCalculator calculator;
  private final AtomicBoolean submitting = new AtomicBoolean(false);

  private List<DailyEntry> entries;
  private BigDecimal bonusAmount = BigDecimal.ZERO;
  private BigDecimal deductionAmount = BigDecimal.ZERO;
  private boolean emailSent;
  private String notes;
  private String invoiceNumber;
  private UUID existingTimesheetId;
  private Integer version;
  private TimesheetRecord persisted;

  private OvertimeAllocation allocation;
  private PayBreakdown pay;

  WeeklyTimesheet(
      TimesheetSelection selection,
      PositionRateProfile rateProfile,
      List<DailyEntry> entries,
      DailyHoursAggregator aggregator,
      OvertimeAllocator allocator,
      PayBillCalculator calculator) {
    this.selection = selection;
    this.week = selection.week();
    this.rateProfile = rateProfile;
    this.entries = List.copyOf(entries);
    this.aggregator = aggregator;
    this.allocator = allocator;
    this.calculator = calculator;
    recompute();
  }

  /** Replaces the hours of a single day; other days keep their values. */
  public void updateHours(LocalDate date, BigDecimal hours) {
    entries = aggregator.replaceHours(entries, date, hours);
    recompute();
  }

  public void updateHours(Map<LocalDate, BigDecimal> hoursByDate) {
    entries = aggregator.replaceAll(entries, hoursByDate);
    recompute();
  }

  public void setBonusAmount(BigDecimal bonusAmount) {
    this.bonusAmount = PayBillCalculator.clampNonNegative(bonusAmount);
    recompute();
  }

  public void setDeductionAmount(BigDecimal deductionAmount) {
    this.deductionAmount = PayBillCalculator.clampNonNegative(deductionAmount);
    recompute();
  }

  public void setEmailSent(boolean emailSent) {
    this.emailSent = emailSent;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  void setInvoiceNumber(String invoiceNumber) {
    this.invoiceNumber = invoiceNumber;
  }

  /** Points this timesheet at a stored record so the next submission updates it. */
  void markPersisted(TimesheetRecord record) {
    this.persisted = record;
    this.existingTimesheetId = record.id();
    this.version = record.version();
    if (record.invoiceNumber() != null && !record.invoiceNumber().isBlank()) {
      this.invoiceNumber = record.invoiceNumber();
    }
  }

  private void recompute() {
    allocation = allocator.allocate(entries, rateProfile);
    entries = allocation.entries();
    pay =
        calculator.calculate(
            allocation.regularHours(),
            allocation.overtimeHours(),
            rateProfile,
            bonusAmount,
            deductionAmount);
  }

  /** The full-replace payload sent to the gateway on submission. */
  public TimesheetRecord toPayload() {
    var dailyHours = entries.stream().map(e -> new DailyHours(e.date(), e.hours())).toList();
    return new TimesheetRecord(
        existingTimesheetId,
        selection.jobseekerProfileId(),
        selection.jobseekerUserId(),
        selection.positionId(),
        week.weekStart(),
        week.weekEnd(),
        dailyHours,
        hours(allocation.regularHours()),
        hours(allocation.overtimeHours()),
        pay.regularPayRate(),
        pay.overtimePayRate(),
        pay.regularBillRate(),
        pay.overtimeBillRate(),
        pay.jobseekerPay(),
        pay.clientBill(),
        pay.bonusAmount(),
        pay.deductionAmount(),
        rateProfile.overtimeEnabled(),
        rateProfile.markup(),
        emailSent,
        invoiceNumber,
        notes,
        version);
  }

  private static BigDecimal hours(BigDecimal value) {
    return value.setScale(DailyEntry.HOURS_SCALE, RoundingMode.HALF_UP);
  }

  /** Marks this timesheet as being submitted; false when a submission is already running. */
  boolean beginSubmit() {
    return submitting.compareAndSet(false, true);
  }

  void endSubmit() {
    submitting.set(false);
  }

  public boolean isSubmitting() {
    return submitting.get();
  }

  public boolean isExisting() {
    return existingTimesheetId != null;
  }

  public boolean hasNonPositivePay() {
    return pay.hasNonPositivePay();
  }

  public TimesheetKey key() {
    return selection.key();
  }

  public TimesheetSelection getSelection() {
    return selection;
  }

  public WeekPeriod getWeek() {
    return week;
  }

  public PositionRateProfile getRateProfile() {
    return rateProfile;
  }

  public List<DailyEntry> getEntries() {
    return entries;
  }

  public BigDecimal getTotalRegularHours() {
    return allocation.regularHours();
  }

  public BigDecimal getTotalOvertimeHours() {
    return allocation.overtimeHours();
  }

  public PayBreakdown getPay() {
    return pay;
  }

  public BigDecimal getJobseekerPay() {
    return pay.jobseekerPay();
  }

  public BigDecimal getClientBill() {
    return pay.clientBill();
  }

  public BigDecimal getBonusAmount() {
    return bonusAmount;
  }

  public BigDecimal getDeductionAmount() {
    return deductionAmount;
  }

  public boolean isEmailSent() {
    return emailSent;
  }

  public String getNotes() {
    return notes;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public UUID getExistingTimesheetId() {
    return existingTimesheetId;
  }

  public Integer getVersion() {
    return version;
  }

  /** The stored record this timesheet was seeded from, or null for a new one. */
  public TimesheetRecord getPersisted() {
    return persisted;
  }
}
