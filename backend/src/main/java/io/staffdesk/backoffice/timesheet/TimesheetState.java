package io.staffdesk.backoffice.timesheet;

/** Lifecycle of the timesheet held by a {@link TimesheetSession}. */
public enum TimesheetState {
  /** Selection incomplete or still loading. */
  UNINITIALIZED,
  SEEDED_NEW,
  SEEDED_EXISTING,
  EDITED,
  SUBMITTING
}
