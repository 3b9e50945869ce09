package io.staffdesk.backoffice.timesheet.persistence;

/** One element of the {@code version_history} JSONB array. */
public class TimesheetVersionEntry {

  public static final String CREATED = "created";
  public static final String UPDATED = "updated";

  private int version;
  private String action;
  private String at;

  public TimesheetVersionEntry() {}

  public TimesheetVersionEntry(int version, String action, String at) {
    this.version = version;
    this.action = action;
    this.at = at;
  }

  public int getVersion() {
    return version;
  }

  public void setVersion(int version) {
    this.version = version;
  }

  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
  }

  public String getAt() {
    return at;
  }

  public void setAt(String at) {
    this.at = at;
  }
}
