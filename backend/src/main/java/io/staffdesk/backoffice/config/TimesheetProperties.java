package io.staffdesk.backoffice.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the weekly timesheet engine. Unset values fall back to the defaults below.
 *
 * @param weekWindow number of weeks offered by the week picker, newest first
 * @param defaultOvertimeThreshold weekly hours after which overtime starts when a position
 *     enables overtime without its own threshold
 * @param invoicePlaceholder invoice number shown when the generator is unavailable
 * @param statusMessageTtl how long a success/error status message stays visible
 */
@ConfigurationProperties(prefix = "timesheet")
public record TimesheetProperties(
    Integer weekWindow,
    BigDecimal defaultOvertimeThreshold,
    String invoicePlaceholder,
    Duration statusMessageTtl) {

  public static final int DEFAULT_WEEK_WINDOW = 52;
  public static final BigDecimal DEFAULT_OVERTIME_THRESHOLD = BigDecimal.valueOf(40);
  public static final String DEFAULT_INVOICE_PLACEHOLDER = "TBD";
  public static final Duration DEFAULT_STATUS_MESSAGE_TTL = Duration.ofSeconds(5);

  public TimesheetProperties {
    if (weekWindow == null || weekWindow <= 0) {
      weekWindow = DEFAULT_WEEK_WINDOW;
    }
    if (defaultOvertimeThreshold == null || defaultOvertimeThreshold.signum() <= 0) {
      defaultOvertimeThreshold = DEFAULT_OVERTIME_THRESHOLD;
    }
    if (invoicePlaceholder == null || invoicePlaceholder.isBlank()) {
      invoicePlaceholder = DEFAULT_INVOICE_PLACEHOLDER;
    }
    if (statusMessageTtl == null || statusMessageTtl.isNegative() || statusMessageTtl.isZero()) {
      statusMessageTtl = DEFAULT_STATUS_MESSAGE_TTL;
    }
  }

  public static TimesheetProperties defaults() {
    return new TimesheetProperties(null, null, null, null);
  }
}
