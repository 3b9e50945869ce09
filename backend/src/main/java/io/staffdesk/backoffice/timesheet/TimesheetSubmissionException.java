package io.staffdesk.backoffice.timesheet;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.ErrorResponseException;

/**
 * A timesheet could not be persisted. Keeps the status of the underlying error when it carries one
 * and identifies the timesheet that failed.
 */
public class TimesheetSubmissionException extends ErrorResponseException {

  private final TimesheetKey key;

  public TimesheetSubmissionException(TimesheetKey key, RuntimeException cause) {
    this(key, statusOf(cause), cause);
  }

  private TimesheetSubmissionException(
      TimesheetKey key, HttpStatusCode status, RuntimeException cause) {
    super(status, createProblem(key, status, detailOf(cause)), cause);
    this.key = key;
  }

  public TimesheetKey getKey() {
    return key;
  }

  /** Human-readable reason, taken from the underlying error. */
  public String getReason() {
    return getBody().getDetail();
  }

  private static HttpStatusCode statusOf(RuntimeException cause) {
    if (cause instanceof ErrorResponseException errorResponse) {
      return errorResponse.getStatusCode();
    }
    if (cause instanceof DataIntegrityViolationException
        || cause instanceof ObjectOptimisticLockingFailureException) {
      return HttpStatus.CONFLICT;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static String detailOf(RuntimeException cause) {
    if (cause instanceof ErrorResponseException errorResponse
        && errorResponse.getBody().getDetail() != null) {
      return errorResponse.getBody().getDetail();
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  private static ProblemDetail createProblem(
      TimesheetKey key, HttpStatusCode status, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle("Timesheet submission failed");
    problem.setDetail(detail);
    problem.setProperty("jobseekerProfileId", key.jobseekerProfileId());
    problem.setProperty("positionId", key.positionId());
    problem.setProperty("weekStartDate", String.valueOf(key.weekStartDate()));
    return problem;
  }
}
