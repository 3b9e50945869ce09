package io.staffdesk.backoffice.position;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the rate columns of the {@code positions} table. Position management stores
 * rates as free text; {@link PositionRateProfileService} parses them once.
 */
@Entity
@Immutable
@Table(name = "positions")
public class PositionRates {

  @Id private UUID id;

  @Column(name = "title")
  private String title;

  @Column(name = "regular_pay_rate")
  private String regularPayRate;

  @Column(name = "bill_rate")
  private String billRate;

  @Column(name = "markup")
  private String markup;

  @Column(name = "overtime_enabled")
  private Boolean overtimeEnabled;

  @Column(name = "overtime_hours")
  private String overtimeHours;

  @Column(name = "overtime_pay_rate")
  private String overtimePayRate;

  @Column(name = "overtime_bill_rate")
  private String overtimeBillRate;

  protected PositionRates() {}

  public PositionRates(
      UUID id,
      String title,
      String regularPayRate,
      String billRate,
      String markup,
      Boolean overtimeEnabled,
      String overtimeHours,
      String overtimePayRate,
      String overtimeBillRate) {
    this.id = id;
    this.title = title;
    this.regularPayRate = regularPayRate;
    this.billRate = billRate;
    this.markup = markup;
    this.overtimeEnabled = overtimeEnabled;
    this.overtimeHours = overtimeHours;
    this.overtimePayRate = overtimePayRate;
    this.overtimeBillRate = overtimeBillRate;
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getRegularPayRate() {
    return regularPayRate;
  }

  public String getBillRate() {
    return billRate;
  }

  public String getMarkup() {
    return markup;
  }

  public Boolean getOvertimeEnabled() {
    return overtimeEnabled;
  }

  public String getOvertimeHours() {
    return overtimeHours;
  }

  public String getOvertimePayRate() {
    return overtimePayRate;
  }

  public String getOvertimeBillRate() {
    return overtimeBillRate;
  }
}
