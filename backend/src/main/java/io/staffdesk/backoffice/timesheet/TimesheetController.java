package io.staffdesk.backoffice.timesheet;

import io.staffdesk.backoffice.audit.AuditEvent;
import io.staffdesk.backoffice.timesheet.gateway.TimesheetRecord;
import io.staffdesk.backoffice.timesheet.persistence.TimesheetSearchCriteria;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimesheetController {

  private static final int MAX_PAGE_SIZE = 100;

  private final TimesheetService timesheetService;

  public TimesheetController(TimesheetService timesheetService) {
    this.timesheetService = timesheetService;
  }

  @GetMapping("/api/timesheets/weeks")
  public ResponseEntity<List<WeekOptionResponse>> listWeeks(
      @RequestParam(required = false) Integer count) {
    var weeks = timesheetService.weekOptions(count).stream().map(WeekOptionResponse::from).toList();
    return ResponseEntity.ok(weeks);
  }

  @GetMapping("/api/timesheets/generate-invoice-number")
  public ResponseEntity<InvoiceNumberResponse> generateInvoiceNumber() {
    return ResponseEntity.ok(new InvoiceNumberResponse(timesheetService.generateInvoiceNumber()));
  }

  @GetMapping("/api/timesheets/jobseeker/{jobseekerUserId}")
  public ResponseEntity<List<TimesheetRecord>> lookupByJobseeker(
      @PathVariable UUID jobseekerUserId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekEnd) {
    return ResponseEntity.ok(timesheetService.lookup(jobseekerUserId, weekStart, weekEnd));
  }

  @GetMapping("/api/timesheets")
  public ResponseEntity<Page<TimesheetRecord>> listTimesheets(
      @RequestParam(required = false) UUID jobseekerProfileId,
      @RequestParam(required = false) UUID positionId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate weekStart,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate weekEnd,
      @RequestParam(required = false) Boolean emailSent,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate dateRangeStart,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate dateRangeEnd,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {

    var criteria =
        new TimesheetSearchCriteria(
            jobseekerProfileId,
            positionId,
            weekStart,
            weekEnd,
            emailSent,
            dateRangeStart,
            dateRangeEnd);
    var pageable =
        PageRequest.of(
            Math.max(page, 0),
            Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "weekStartDate"));
    return ResponseEntity.ok(timesheetService.search(criteria, pageable));
  }

  @GetMapping("/api/timesheets/{id}")
  public ResponseEntity<TimesheetRecord> getTimesheet(@PathVariable UUID id) {
    return ResponseEntity.ok(timesheetService.getTimesheet(id));
  }

  @GetMapping("/api/timesheets/{id}/activity")
  public ResponseEntity<List<ActivityResponse>> getActivity(@PathVariable UUID id) {
    var events = timesheetService.activity(id).stream().map(ActivityResponse::from).toList();
    return ResponseEntity.ok(events);
  }

  @PostMapping("/api/timesheets/preview")
  public ResponseEntity<TimesheetPreviewResponse> preview(
      @Valid @RequestBody TimesheetRequest request) {
    var timesheet = timesheetService.preview(request.toInput());
    return ResponseEntity.ok(TimesheetPreviewResponse.from(timesheet));
  }

  @PostMapping("/api/timesheets")
  public ResponseEntity<TimesheetRecord> submitTimesheet(
      @Valid @RequestBody TimesheetRequest request) {
    var saved = timesheetService.submit(request.toInput());
    if (saved.version() != null && saved.version() == 1) {
      return ResponseEntity.created(URI.create("/api/timesheets/" + saved.id())).body(saved);
    }
    return ResponseEntity.ok(saved);
  }

  @PostMapping("/api/timesheets/batch")
  public ResponseEntity<BatchSubmissionResponse> submitBatch(
      @Valid @RequestBody BatchTimesheetRequest request) {
    var inputs = request.timesheets().stream().map(TimesheetRequest::toInput).toList();
    return ResponseEntity.ok(BatchSubmissionResponse.from(timesheetService.submitBatch(inputs)));
  }

  @PutMapping("/api/timesheets/{id}")
  public ResponseEntity<TimesheetRecord> updateTimesheet(
      @PathVariable UUID id, @Valid @RequestBody TimesheetRequest request) {
    return ResponseEntity.ok(timesheetService.update(id, request.toInput()));
  }

  @DeleteMapping("/api/timesheets/{id}")
  public ResponseEntity<Void> deleteTimesheet(@PathVariable UUID id) {
    timesheetService.deleteTimesheet(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record DailyHoursRequest(
      @NotNull(message = "date is required") LocalDate date,
      @NotNull(message = "hours is required")
          @DecimalMin(value = "0", message = "hours must not be negative")
          BigDecimal hours) {}

  public record TimesheetRequest(
      @NotNull(message = "jobseekerProfileId is required") UUID jobseekerProfileId,
      @NotNull(message = "jobseekerUserId is required") UUID jobseekerUserId,
      @NotNull(message = "positionId is required") UUID positionId,
      @NotNull(message = "weekStartDate is required") LocalDate weekStartDate,
      @Size(max = WeekPeriod.DAYS_IN_WEEK, message = "at most seven days per week")
          List<@Valid DailyHoursRequest> dailyHours,
      @DecimalMin(value = "0", message = "bonusAmount must not be negative") BigDecimal bonusAmount,
      @DecimalMin(value = "0", message = "deductionAmount must not be negative")
          BigDecimal deductionAmount,
      boolean emailSent,
      @Size(max = 2000, message = "notes must be at most 2000 characters") String notes) {

    TimesheetInput toInput() {
      var hoursByDate = new LinkedHashMap<LocalDate, BigDecimal>();
      if (dailyHours != null) {
        dailyHours.forEach(day -> hoursByDate.put(day.date(), day.hours()));
      }
      return new TimesheetInput(
          new TimesheetSelection(jobseekerProfileId, jobseekerUserId, positionId, weekStartDate),
          hoursByDate,
          bonusAmount,
          deductionAmount,
          emailSent,
          notes);
    }
  }

  public record BatchTimesheetRequest(
      @NotEmpty(message = "timesheets must not be empty")
          @Size(max = 100, message = "at most 100 timesheets per batch")
          List<@Valid TimesheetRequest> timesheets) {}

  public record WeekOptionResponse(LocalDate weekStart, LocalDate weekEnd, String label) {

    public static WeekOptionResponse from(WeekPeriod week) {
      return new WeekOptionResponse(week.weekStart(), week.weekEnd(), week.label());
    }
  }

  public record InvoiceNumberResponse(String invoiceNumber) {}

  public record DailyEntryResponse(LocalDate date, BigDecimal hours, BigDecimal overtimeHours) {}

  public record TimesheetPreviewResponse(
      LocalDate weekStartDate,
      LocalDate weekEndDate,
      List<DailyEntryResponse> entries,
      BigDecimal totalRegularHours,
      BigDecimal totalOvertimeHours,
      BigDecimal regularPayRate,
      BigDecimal overtimePayRate,
      BigDecimal regularBillRate,
      BigDecimal overtimeBillRate,
      BigDecimal basePay,
      BigDecimal bonusAmount,
      BigDecimal deductionAmount,
      BigDecimal totalJobseekerPay,
      BigDecimal totalClientBill,
      boolean nonPositivePay) {

    public static TimesheetPreviewResponse from(WeeklyTimesheet timesheet) {
      var pay = timesheet.getPay();
      var entries =
          timesheet.getEntries().stream()
              .map(e -> new DailyEntryResponse(e.date(), e.hours(), e.overtimeHours()))
              .toList();
      return new TimesheetPreviewResponse(
          timesheet.getWeek().weekStart(),
          timesheet.getWeek().weekEnd(),
          entries,
          timesheet.getTotalRegularHours(),
          timesheet.getTotalOvertimeHours(),
          pay.regularPayRate(),
          pay.overtimePayRate(),
          pay.regularBillRate(),
          pay.overtimeBillRate(),
          pay.basePay(),
          pay.bonusAmount(),
          pay.deductionAmount(),
          pay.jobseekerPay(),
          pay.clientBill(),
          timesheet.hasNonPositivePay());
    }
  }

  public record SubmissionOutcomeResponse(
      UUID jobseekerProfileId,
      UUID positionId,
      LocalDate weekStartDate,
      boolean success,
      TimesheetRecord timesheet,
      String error) {

    public static SubmissionOutcomeResponse from(SubmissionOutcome outcome) {
      return new SubmissionOutcomeResponse(
          outcome.key().jobseekerProfileId(),
          outcome.key().positionId(),
          outcome.key().weekStartDate(),
          outcome.isSuccess(),
          outcome.record(),
          outcome.error());
    }
  }

  public record BatchSubmissionResponse(
      long submitted, long failed, List<SubmissionOutcomeResponse> outcomes) {

    public static BatchSubmissionResponse from(BatchSubmissionResult result) {
      return new BatchSubmissionResponse(
          result.succeeded(),
          result.failed(),
          result.outcomes().stream().map(SubmissionOutcomeResponse::from).toList());
    }
  }

  public record ActivityResponse(
      UUID id, String eventType, String source, Map<String, Object> details, Instant occurredAt) {

    public static ActivityResponse from(AuditEvent event) {
      return new ActivityResponse(
          event.getId(),
          event.getEventType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
