package io.staffdesk.backoffice.timesheet;

import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.JOBSEEKER_PROFILE_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.JOBSEEKER_USER_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.POSITION_ID;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.WEEK_START;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.flatProfile;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.overtimeProfile;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.stored;
import static io.staffdesk.backoffice.timesheet.TimesheetFixtures.timesheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.staffdesk.backoffice.exception.GlobalExceptionHandler;
import io.staffdesk.backoffice.exception.ResourceNotFoundException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TimesheetControllerTest {

  @Mock private TimesheetService timesheetService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new TimesheetController(timesheetService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void listWeeks_returnsLabelledWeeks() throws Exception {
    when(timesheetService.weekOptions(2))
        .thenReturn(
            List.of(
                WeekPeriod.containing(WEEK_START.plusWeeks(1)), WeekPeriod.containing(WEEK_START)));

    mockMvc
        .perform(get("/api/timesheets/weeks").param("count", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].weekStart").value("2024-06-02"))
        .andExpect(jsonPath("$[1].weekEnd").value("2024-06-08"));
  }

  @Test
  void generateInvoiceNumber_returnsNextNumber() throws Exception {
    when(timesheetService.generateInvoiceNumber()).thenReturn("000042");

    mockMvc
        .perform(get("/api/timesheets/generate-invoice-number"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.invoiceNumber").value("000042"));
  }

  @Test
  void submit_newTimesheetReturnsCreated() throws Exception {
    var id = UUID.randomUUID();
    var saved = stored(timesheet(flatProfile(), 8, 8).toPayload(), id, "000001", 1);
    when(timesheetService.submit(any(TimesheetInput.class))).thenReturn(saved);

    mockMvc
        .perform(
            post("/api/timesheets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody("8")))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/timesheets/" + id))
        .andExpect(jsonPath("$.invoiceNumber").value("000001"));

    var input = ArgumentCaptor.forClass(TimesheetInput.class);
    verify(timesheetService).submit(input.capture());
    assertThat(input.getValue().selection().positionId()).isEqualTo(POSITION_ID);
    assertThat(input.getValue().hoursByDate()).containsOnlyKeys(WEEK_START);
    assertThat(input.getValue().emailSent()).isTrue();
  }

  @Test
  void submit_existingTimesheetReturnsOk() throws Exception {
    var payload = timesheet(flatProfile(), 8, 8).toPayload();
    var saved = stored(payload, UUID.randomUUID(), "000001", 3);
    when(timesheetService.submit(any(TimesheetInput.class))).thenReturn(saved);

    mockMvc
        .perform(
            post("/api/timesheets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody("8")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value(3));
  }

  @Test
  void submit_negativeHoursIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/timesheets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody("-1")))
        .andExpect(status().isBadRequest());

    verify(timesheetService, never()).submit(any());
  }

  @Test
  void preview_returnsComputedTotals() throws Exception {
    when(timesheetService.preview(any(TimesheetInput.class)))
        .thenReturn(timesheet(overtimeProfile(), 8, 8, 8, 8, 8, 8));

    mockMvc
        .perform(
            post("/api/timesheets/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody("8")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.weekEndDate").value("2024-06-08"))
        .andExpect(jsonPath("$.entries.length()").value(7))
        .andExpect(jsonPath("$.nonPositivePay").value(false));
  }

  @Test
  void submitBatch_reportsEachOutcome() throws Exception {
    var key = new TimesheetKey(JOBSEEKER_PROFILE_ID, POSITION_ID, WEEK_START);
    var saved = stored(timesheet(flatProfile(), 8).toPayload(), UUID.randomUUID(), "000005", 1);
    when(timesheetService.submitBatch(anyList()))
        .thenReturn(
            new BatchSubmissionResult(
                List.of(
                    SubmissionOutcome.succeeded(key, saved),
                    SubmissionOutcome.failed(key, "Timesheet already exists"))));

    mockMvc
        .perform(
            post("/api/timesheets/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"timesheets\": [" + requestBody("8") + "]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.submitted").value(1))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.outcomes[1].error").value("Timesheet already exists"));
  }

  @Test
  void submitBatch_emptyListIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/timesheets/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"timesheets\": []}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void getTimesheet_unknownIdIsNotFound() throws Exception {
    var id = UUID.randomUUID();
    when(timesheetService.getTimesheet(id))
        .thenThrow(new ResourceNotFoundException("Timesheet", id));

    mockMvc
        .perform(get("/api/timesheets/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Timesheet not found"));
  }

  @Test
  void update_passesIdThrough() throws Exception {
    var id = UUID.randomUUID();
    var saved = stored(timesheet(flatProfile(), 8).toPayload(), id, "000002", 2);
    when(timesheetService.update(any(UUID.class), any(TimesheetInput.class))).thenReturn(saved);

    mockMvc
        .perform(
            put("/api/timesheets/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody("6")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value(2));

    verify(timesheetService).update(any(UUID.class), any(TimesheetInput.class));
  }

  @Test
  void deleteTimesheet_returnsNoContent() throws Exception {
    var id = UUID.randomUUID();

    mockMvc.perform(delete("/api/timesheets/{id}", id)).andExpect(status().isNoContent());

    verify(timesheetService).deleteTimesheet(id);
  }

  @Test
  void lookupByJobseeker_bindsIsoDates() throws Exception {
    when(timesheetService.lookup(JOBSEEKER_USER_ID, WEEK_START, LocalDate.of(2024, 6, 8)))
        .thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/timesheets/jobseeker/{id}", JOBSEEKER_USER_ID)
                .param("weekStart", "2024-06-02")
                .param("weekEnd", "2024-06-08"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  private static String requestBody(String sundayHours) {
    return """
        {
          "jobseekerProfileId": "%s",
          "jobseekerUserId": "%s",
          "positionId": "%s",
          "weekStartDate": "2024-06-02",
          "dailyHours": [{"date": "2024-06-02", "hours": %s}],
          "bonusAmount": 0,
          "deductionAmount": 0,
          "emailSent": true,
          "notes": "night shift"
        }
        """
        .formatted(JOBSEEKER_PROFILE_ID, JOBSEEKER_USER_ID, POSITION_ID, sundayHours);
  }
}
