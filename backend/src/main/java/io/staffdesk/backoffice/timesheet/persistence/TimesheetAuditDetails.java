package io.staffdesk.backoffice.timesheet.persistence;

import java.util.LinkedHashMap;
import java.util.Map;

/** Audit detail map shared by the timesheet create, update and delete events. */
final class TimesheetAuditDetails {

  private TimesheetAuditDetails() {}

  static Map<String, Object> of(Timesheet timesheet) {
    var details = new LinkedHashMap<String, Object>();
    details.put("jobseeker_profile_id", String.valueOf(timesheet.getJobseekerProfileId()));
    details.put("position_id", String.valueOf(timesheet.getPositionId()));
    details.put("week_start_date", String.valueOf(timesheet.getWeekStartDate()));
    details.put("week_end_date", String.valueOf(timesheet.getWeekEndDate()));
    details.put("total_regular_hours", String.valueOf(timesheet.getTotalRegularHours()));
    details.put("total_overtime_hours", String.valueOf(timesheet.getTotalOvertimeHours()));
    details.put("total_jobseeker_pay", String.valueOf(timesheet.getTotalJobseekerPay()));
    details.put("total_client_bill", String.valueOf(timesheet.getTotalClientBill()));
    details.put("invoice_number", timesheet.getInvoiceNumber());
    details.put("version", timesheet.getVersion());
    return details;
  }
}
