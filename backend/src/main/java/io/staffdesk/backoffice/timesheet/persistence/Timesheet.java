package io.staffdesk.backoffice.timesheet.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Stored weekly timesheet. Unique per jobseeker profile, position and week start. The invoice
 * number is assigned at creation and never changed afterwards.
 */
@Entity
@Table(name = "timesheets")
public class Timesheet {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "jobseeker_profile_id", nullable = false)
  private UUID jobseekerProfileId;

  @Column(name = "jobseeker_user_id", nullable = false)
  private UUID jobseekerUserId;

  @Column(name = "position_id", nullable = false)
  private UUID positionId;

  @Column(name = "week_start_date", nullable = false)
  private LocalDate weekStartDate;

  @Column(name = "week_end_date", nullable = false)
  private LocalDate weekEndDate;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "daily_hours", nullable = false, columnDefinition = "jsonb")
  private List<StoredDailyHours> dailyHours = new ArrayList<>();

  @Column(name = "total_regular_hours", nullable = false, precision = 7, scale = 2)
  private BigDecimal totalRegularHours;

  @Column(name = "total_overtime_hours", nullable = false, precision = 7, scale = 2)
  private BigDecimal totalOvertimeHours;

  @Column(name = "regular_pay_rate", nullable = false, precision = 12, scale = 4)
  private BigDecimal regularPayRate;

  @Column(name = "overtime_pay_rate", nullable = false, precision = 12, scale = 4)
  private BigDecimal overtimePayRate;

  @Column(name = "regular_bill_rate", nullable = false, precision = 12, scale = 4)
  private BigDecimal regularBillRate;

  @Column(name = "overtime_bill_rate", nullable = false, precision = 12, scale = 4)
  private BigDecimal overtimeBillRate;

  @Column(name = "total_jobseeker_pay", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalJobseekerPay;

  @Column(name = "total_client_bill", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalClientBill;

  @Column(name = "bonus_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal bonusAmount;

  @Column(name = "deduction_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal deductionAmount;

  @Column(name = "overtime_enabled", nullable = false)
  private boolean overtimeEnabled;

  @Column(name = "markup", precision = 12, scale = 4)
  private BigDecimal markup;

  @Column(name = "email_sent", nullable = false)
  private boolean emailSent;

  @Column(name = "invoice_number", length = 20, updatable = false)
  private String invoiceNumber;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "version", nullable = false)
  private int version;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "version_history", nullable = false, columnDefinition = "jsonb")
  private List<TimesheetVersionEntry> versionHistory = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Timesheet() {}

  public Timesheet(String invoiceNumber, Instant now) {
    this.invoiceNumber = invoiceNumber;
    this.version = 1;
    this.versionHistory.add(
        new TimesheetVersionEntry(1, TimesheetVersionEntry.CREATED, now.toString()));
    this.createdAt = now;
    this.updatedAt = now;
  }

  public void assignTo(
      UUID jobseekerProfileId,
      UUID jobseekerUserId,
      UUID positionId,
      LocalDate weekStartDate,
      LocalDate weekEndDate) {
    this.jobseekerProfileId = jobseekerProfileId;
    this.jobseekerUserId = jobseekerUserId;
    this.positionId = positionId;
    this.weekStartDate = weekStartDate;
    this.weekEndDate = weekEndDate;
  }

  public void replaceHours(
      List<StoredDailyHours> dailyHours,
      BigDecimal totalRegularHours,
      BigDecimal totalOvertimeHours) {
    this.dailyHours = new ArrayList<>(dailyHours);
    this.totalRegularHours = totalRegularHours;
    this.totalOvertimeHours = totalOvertimeHours;
  }

  public void replaceRates(
      BigDecimal regularPayRate,
      BigDecimal overtimePayRate,
      BigDecimal regularBillRate,
      BigDecimal overtimeBillRate,
      boolean overtimeEnabled,
      BigDecimal markup) {
    this.regularPayRate = regularPayRate;
    this.overtimePayRate = overtimePayRate;
    this.regularBillRate = regularBillRate;
    this.overtimeBillRate = overtimeBillRate;
    this.overtimeEnabled = overtimeEnabled;
    this.markup = markup;
  }

  public void replaceAmounts(
      BigDecimal totalJobseekerPay,
      BigDecimal totalClientBill,
      BigDecimal bonusAmount,
      BigDecimal deductionAmount) {
    this.totalJobseekerPay = totalJobseekerPay;
    this.totalClientBill = totalClientBill;
    this.bonusAmount = bonusAmount;
    this.deductionAmount = deductionAmount;
  }

  public void replaceDetails(boolean emailSent, String notes) {
    this.emailSent = emailSent;
    this.notes = notes;
  }

  /** Bumps the version and appends an "updated" entry to the history. */
  public void recordUpdate(Instant now) {
    this.version++;
    var history = new ArrayList<>(versionHistory);
    history.add(new TimesheetVersionEntry(version, TimesheetVersionEntry.UPDATED, now.toString()));
    this.versionHistory = history;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getJobseekerProfileId() {
    return jobseekerProfileId;
  }

  public UUID getJobseekerUserId() {
    return jobseekerUserId;
  }

  public UUID getPositionId() {
    return positionId;
  }

  public LocalDate getWeekStartDate() {
    return weekStartDate;
  }

  public LocalDate getWeekEndDate() {
    return weekEndDate;
  }

  public List<StoredDailyHours> getDailyHours() {
    return dailyHours;
  }

  public BigDecimal getTotalRegularHours() {
    return totalRegularHours;
  }

  public BigDecimal getTotalOvertimeHours() {
    return totalOvertimeHours;
  }

  public BigDecimal getRegularPayRate() {
    return regularPayRate;
  }

  public BigDecimal getOvertimePayRate() {
    return overtimePayRate;
  }

  public BigDecimal getRegularBillRate() {
    return regularBillRate;
  }

  public BigDecimal getOvertimeBillRate() {
    return overtimeBillRate;
  }

  public BigDecimal getTotalJobseekerPay() {
    return totalJobseekerPay;
  }

  public BigDecimal getTotalClientBill() {
    return totalClientBill;
  }

  public BigDecimal getBonusAmount() {
    return bonusAmount;
  }

  public BigDecimal getDeductionAmount() {
    return deductionAmount;
  }

  public boolean isOvertimeEnabled() {
    return overtimeEnabled;
  }

  public BigDecimal getMarkup() {
    return markup;
  }

  public boolean isEmailSent() {
    return emailSent;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getNotes() {
    return notes;
  }

  public int getVersion() {
    return version;
  }

  public List<TimesheetVersionEntry> getVersionHistory() {
    return versionHistory;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
