package io.staffdesk.backoffice.position;

import io.staffdesk.backoffice.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PositionRateProfileService {

  private static final Logger log = LoggerFactory.getLogger(PositionRateProfileService.class);

  private final PositionRatesRepository positionRatesRepository;

  public PositionRateProfileService(PositionRatesRepository positionRatesRepository) {
    this.positionRatesRepository = positionRatesRepository;
  }

  /**
   * Loads the rate profile of a position.
   *
   * @throws ResourceNotFoundException when the position does not exist
   */
  @Transactional(readOnly = true)
  public PositionRateProfile getProfile(UUID positionId) {
    var rates =
        positionRatesRepository
            .findById(positionId)
            .orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    return toProfile(rates);
  }

  static PositionRateProfile toProfile(PositionRates rates) {
    return new PositionRateProfile(
        rates.getId(),
        parseRate(rates.getId(), "regular_pay_rate", rates.getRegularPayRate()),
        parseRate(rates.getId(), "bill_rate", rates.getBillRate()),
        Boolean.TRUE.equals(rates.getOvertimeEnabled()),
        parseRate(rates.getId(), "overtime_hours", rates.getOvertimeHours()),
        parseRate(rates.getId(), "overtime_pay_rate", rates.getOvertimePayRate()),
        parseRate(rates.getId(), "overtime_bill_rate", rates.getOvertimeBillRate()),
        parseRate(rates.getId(), "markup", rates.getMarkup()));
  }

  /** Parses a free-text numeric column; blank or unparseable values are treated as unset. */
  private static BigDecimal parseRate(UUID positionId, String column, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String cleaned = raw.trim().replace("$", "").replace(",", "").replace("%", "");
    try {
      return new BigDecimal(cleaned);
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparseable {} '{}' on position {}", column, raw, positionId);
      return null;
    }
  }
}
