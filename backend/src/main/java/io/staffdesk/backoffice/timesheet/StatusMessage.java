package io.staffdesk.backoffice.timesheet;

import java.time.Duration;
import java.time.Instant;

/** A success or error message that stops being shown once {@code expiresAt} has passed. */
public record StatusMessage(Kind kind, String text, Instant expiresAt) {

  public enum Kind {
    SUCCESS,
    ERROR
  }

  public static StatusMessage success(String text, Instant now, Duration ttl) {
    return new StatusMessage(Kind.SUCCESS, text, now.plus(ttl));
  }

  public static StatusMessage error(String text, Instant now, Duration ttl) {
    return new StatusMessage(Kind.ERROR, text, now.plus(ttl));
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
