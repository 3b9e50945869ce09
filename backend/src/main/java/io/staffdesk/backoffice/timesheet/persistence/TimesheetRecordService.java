package io.staffdesk.backoffice.timesheet.persistence;

import io.staffdesk.backoffice.audit.AuditEventBuilder;
import io.staffdesk.backoffice.audit.AuditService;
import io.staffdesk.backoffice.exception.ResourceNotFoundException;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Back-office reads and deletion of stored timesheets, outside the entry workflow. */
@Service
public class TimesheetRecordService {

  private static final Logger log = LoggerFactory.getLogger(TimesheetRecordService.class);

  private final TimesheetRepository timesheetRepository;
  private final TimesheetRecordMapper mapper;
  private final AuditService auditService;

  public TimesheetRecordService(
      TimesheetRepository timesheetRepository,
      TimesheetRecordMapper mapper,
      AuditService auditService) {
    this.timesheetRepository = timesheetRepository;
    this.mapper = mapper;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public TimesheetRecord getTimesheet(UUID id) {
    return timesheetRepository
        .findById(id)
        .map(mapper::toRecord)
        .orElseThrow(() -> new ResourceNotFoundException("Timesheet", id));
  }

  @Transactional(readOnly = true)
  public Page<TimesheetRecord> search(TimesheetSearchCriteria criteria, Pageable pageable) {
    return timesheetRepository
        .findByFilter(
            criteria.jobseekerProfileId(),
            criteria.positionId(),
            criteria.weekStartDate(),
            criteria.weekEndDate(),
            criteria.emailSent(),
            criteria.from(),
            criteria.to(),
            pageable)
        .map(mapper::toRecord);
  }

  @Transactional
  public void deleteTimesheet(UUID id) {
    var timesheet =
        timesheetRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Timesheet", id));
    var details = TimesheetAuditDetails.of(timesheet);
    timesheetRepository.delete(timesheet);

    log.info("Deleted timesheet {} (invoice {})", id, timesheet.getInvoiceNumber());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("timesheet.deleted")
            .entityType("timesheet")
            .entityId(id)
            .details(details)
            .build());
  }
}
