package io.staffdesk.backoffice.timesheet;

import java.util.List;
import java.util.Optional;

/** Per-timesheet outcomes of a batch submission, in submission order. */
public record BatchSubmissionResult(List<SubmissionOutcome> outcomes) {

  public BatchSubmissionResult {
    outcomes = List.copyOf(outcomes);
  }

  public long succeeded() {
    return outcomes.stream().filter(SubmissionOutcome::isSuccess).count();
  }

  public long failed() {
    return outcomes.size() - succeeded();
  }

  public Optional<SubmissionOutcome> firstFailure() {
    return outcomes.stream().filter(o -> !o.isSuccess()).findFirst();
  }
}
