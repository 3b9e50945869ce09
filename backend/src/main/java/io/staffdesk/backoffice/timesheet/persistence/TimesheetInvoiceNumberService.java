package io.staffdesk.backoffice.timesheet.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out sequential six-digit invoice numbers from a single counter row.
 *
 * <p>The counter row is created on first use. Numbers reserved for timesheets that are never
 * submitted are not reused, so the sequence may have gaps.
 */
@Service
public class TimesheetInvoiceNumberService {

  static final String COUNTER_NAME = "timesheet";

  @PersistenceContext private EntityManager entityManager;

  /**
   * Reserves the next number. Concurrent callers serialize on the counter row inside the UPSERT.
   *
   * @return zero-padded number, e.g. "000001"
   */
  @Transactional
  public String nextNumber() {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO timesheet_invoice_counters (name, next_number)"
                    + " VALUES (:name, 2)"
                    + " ON CONFLICT (name)"
                    + " DO UPDATE SET next_number = timesheet_invoice_counters.next_number + 1"
                    + " RETURNING next_number - 1")
            .setParameter("name", COUNTER_NAME)
            .getSingleResult();

    return format(((Number) result).longValue());
  }

  static String format(long number) {
    return String.format("%06d", number);
  }
}
