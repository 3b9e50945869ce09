package io.staffdesk.backoffice.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimesheetEmailEventListenerTest {

  @Mock private TimesheetNotifier notifier;
  @InjectMocks private TimesheetEmailEventListener listener;

  @Test
  void forwardsEventToNotifier() {
    var event = event();

    listener.onTimesheetSubmitted(event);

    verify(notifier).timesheetSubmitted(event);
  }

  @Test
  void notifierFailureDoesNotPropagate() {
    var event = event();
    doThrow(new IllegalStateException("smtp down")).when(notifier).timesheetSubmitted(event);

    assertThatCode(() -> listener.onTimesheetSubmitted(event)).doesNotThrowAnyException();
  }

  private static TimesheetSubmittedEvent event() {
    return new TimesheetSubmittedEvent(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        LocalDate.of(2024, 6, 2),
        LocalDate.of(2024, 6, 8),
        "000007",
        new BigDecimal("860.00"),
        true);
  }
}
