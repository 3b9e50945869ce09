package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.position.PositionRateProfile;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/** Turns a week's regular/overtime hours into jobseeker pay and client bill. */
@Component
public class PayBillCalculator {

  static final int MONEY_SCALE = 2;

  public PayBreakdown calculate(
      BigDecimal regularHours,
      BigDecimal overtimeHours,
      PositionRateProfile profile,
      BigDecimal bonusAmount,
      BigDecimal deductionAmount) {
    BigDecimal regularPayRate = profile.regularPayRate();
    BigDecimal regularBillRate = profile.regularBillRate();
    BigDecimal overtimePayRate =
        overtimeRate(profile.overtimeEnabled(), profile.overtimePayRate(), regularPayRate);
    BigDecimal overtimeBillRate =
        overtimeRate(profile.overtimeEnabled(), profile.overtimeBillRate(), regularBillRate);

    BigDecimal bonus = clampNonNegative(bonusAmount);
    BigDecimal deduction = clampNonNegative(deductionAmount);

    BigDecimal basePay =
        regularHours.multiply(regularPayRate).add(overtimeHours.multiply(overtimePayRate));
    BigDecimal jobseekerPay = basePay.add(bonus).subtract(deduction);
    BigDecimal clientBill =
        regularHours.multiply(regularBillRate).add(overtimeHours.multiply(overtimeBillRate));

    return new PayBreakdown(
        regularPayRate,
        overtimePayRate,
        regularBillRate,
        overtimeBillRate,
        money(basePay),
        money(bonus),
        money(deduction),
        money(jobseekerPay),
        money(clientBill));
  }

  /** Bonus and deduction amounts are never negative; null counts as zero. */
  public static BigDecimal clampNonNegative(BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      return BigDecimal.ZERO;
    }
    return amount;
  }

  private static BigDecimal overtimeRate(
      boolean overtimeEnabled, BigDecimal overtimeRate, BigDecimal regularRate) {
    if (overtimeEnabled && overtimeRate != null && overtimeRate.signum() != 0) {
      return overtimeRate;
    }
    return regularRate;
  }

  private static BigDecimal money(BigDecimal amount) {
    return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
  }
}
