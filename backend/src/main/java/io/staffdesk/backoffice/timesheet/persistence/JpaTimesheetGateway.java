package io.staffdesk.backoffice.timesheet.persistence;

import io.staffdesk.backoffice.audit.AuditEventBuilder;
import io.staffdesk.backoffice.audit.AuditService;
import io.staffdesk.backoffice.config.TimesheetProperties;
import io.staffdesk.backoffice.exception.ResourceConflictException;
import io.staffdesk.backoffice.exception.ResourceNotFoundException;
import io.staffdesk.backoffice.notification.TimesheetSubmittedEvent;
import io.staffdesk.backoffice.timesheet.TimesheetKey;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetGateway;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link TimesheetGateway} over the {@code timesheets} table. Each call is its own transaction. */
@Service
public class JpaTimesheetGateway implements TimesheetGateway {

  private static final Logger log = LoggerFactory.getLogger(JpaTimesheetGateway.class);

  private final TimesheetRepository timesheetRepository;
  private final TimesheetRecordMapper mapper;
  private final TimesheetInvoiceNumberService invoiceNumberService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final String invoicePlaceholder;

  public JpaTimesheetGateway(
      TimesheetRepository timesheetRepository,
      TimesheetRecordMapper mapper,
      TimesheetInvoiceNumberService invoiceNumberService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      TimesheetProperties properties) {
    this.timesheetRepository = timesheetRepository;
    this.mapper = mapper;
    this.invoiceNumberService = invoiceNumberService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.invoicePlaceholder = properties.invoicePlaceholder();
  }

  @Override
  @Transactional(readOnly = true)
  public List<TimesheetRecord> lookupByJobseekerAndWeek(
      UUID jobseekerUserId, LocalDate weekStart, LocalDate weekEnd) {
    return timesheetRepository.findByJobseekerAndWeek(jobseekerUserId, weekStart, weekEnd).stream()
        .map(mapper::toRecord)
        .toList();
  }

  @Override
  public String generateInvoiceNumber() {
    return invoiceNumberService.nextNumber();
  }

  @Override
  @Transactional
  public TimesheetRecord create(TimesheetRecord payload) {
    requireNoOtherTimesheet(payload.key(), null);

    String invoiceNumber = payload.invoiceNumber();
    if (isUnassigned(invoiceNumber)) {
      invoiceNumber = invoiceNumberService.nextNumber();
    } else if (timesheetRepository.existsByInvoiceNumber(invoiceNumber)) {
      throw new ResourceConflictException(
          "Duplicate invoice number", "Invoice number " + invoiceNumber + " is already in use");
    }

    var timesheet = new Timesheet(invoiceNumber, clock.instant());
    mapper.apply(payload, timesheet);
    timesheet = timesheetRepository.save(timesheet);

    log.info(
        "Created timesheet {} (invoice {}) for position {} week {}",
        timesheet.getId(),
        timesheet.getInvoiceNumber(),
        timesheet.getPositionId(),
        timesheet.getWeekStartDate());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.created")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(TimesheetAuditDetails.of(timesheet))
            .build());
    publishIfEmailRequested(timesheet, true);
    return mapper.toRecord(timesheet);
  }

  @Override
  @Transactional
  public TimesheetRecord update(UUID id, TimesheetRecord payload) {
    var timesheet =
        timesheetRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Timesheet", id));
    requireNoOtherTimesheet(payload.key(), id);

    mapper.apply(payload, timesheet);
    timesheet.recordUpdate(clock.instant());
    timesheet = timesheetRepository.save(timesheet);

    log.info("Updated timesheet {} to version {}", timesheet.getId(), timesheet.getVersion());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.updated")
            .entityType("timesheet")
            .entityId(timesheet.getId())
            .details(TimesheetAuditDetails.of(timesheet))
            .build());
    publishIfEmailRequested(timesheet, false);
    return mapper.toRecord(timesheet);
  }

  private void requireNoOtherTimesheet(TimesheetKey key, UUID exceptId) {
    timesheetRepository
        .findByJobseekerProfileIdAndPositionIdAndWeekStartDate(
            key.jobseekerProfileId(), key.positionId(), key.weekStartDate())
        .filter(existing -> exceptId == null || !exceptId.equals(existing.getId()))
        .ifPresent(
            existing -> {
              throw new ResourceConflictException(
                  "Timesheet already exists",
                  "Timesheet "
                      + existing.getId()
                      + " already covers position "
                      + key.positionId()
                      + " for the week of "
                      + key.weekStartDate());
            });
  }

  private boolean isUnassigned(String invoiceNumber) {
    return invoiceNumber == null
        || invoiceNumber.isBlank()
        || invoiceNumber.equalsIgnoreCase(invoicePlaceholder);
  }

  private void publishIfEmailRequested(Timesheet timesheet, boolean created) {
    if (!timesheet.isEmailSent()) {
      return;
    }
    eventPublisher.publishEvent(
        new TimesheetSubmittedEvent(
            timesheet.getId(),
            timesheet.getJobseekerProfileId(),
            timesheet.getJobseekerUserId(),
            timesheet.getPositionId(),
            timesheet.getWeekStartDate(),
            timesheet.getWeekEndDate(),
            timesheet.getInvoiceNumber(),
            timesheet.getTotalJobseekerPay(),
            created));
  }
}
