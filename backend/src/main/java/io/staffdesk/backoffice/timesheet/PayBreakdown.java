package io.staffdesk.backoffice.timesheet;

import java.math.BigDecimal;

/**
 * Money figures of one timesheet week. The four rates are the effective rates after overtime
 * fallback.
 *
 * @param jobseekerPay base pay plus bonus minus deduction; may be zero or negative
 * @param clientBill hours at bill rates; bonus and deduction never reach the client
 */
public record PayBreakdown(
    BigDecimal regularPayRate,
    BigDecimal overtimePayRate,
    BigDecimal regularBillRate,
    BigDecimal overtimeBillRate,
    BigDecimal basePay,
    BigDecimal bonusAmount,
    BigDecimal deductionAmount,
    BigDecimal jobseekerPay,
    BigDecimal clientBill) {

  public boolean hasNonPositivePay() {
    return jobseekerPay.signum() <= 0;
  }
}
