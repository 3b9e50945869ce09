package io.staffdesk.backoffice.position;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Pay and bill rates of a position, as needed by the timesheet engine. Owned by position
 * management; read-only here.
 *
 * @param overtimeThresholdHours weekly hours after which overtime applies; null when the position
 *     relies on the default threshold
 * @param overtimePayRate null or zero when the position does not set one
 * @param overtimeBillRate null or zero when the position does not set one
 * @param markup margin figure carried through to the timesheet, never computed here
 */
public record PositionRateProfile(
    UUID positionId,
    BigDecimal regularPayRate,
    BigDecimal regularBillRate,
    boolean overtimeEnabled,
    BigDecimal overtimeThresholdHours,
    BigDecimal overtimePayRate,
    BigDecimal overtimeBillRate,
    BigDecimal markup) {

  public PositionRateProfile {
    regularPayRate = regularPayRate != null ? regularPayRate : BigDecimal.ZERO;
    regularBillRate = regularBillRate != null ? regularBillRate : BigDecimal.ZERO;
  }
}
