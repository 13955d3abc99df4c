package com.paysync.sync;

import java.time.Instant;

public record ProgressEvent(
    Instant timestamp,
    int page,
    String externalId,
    String message,
    Severity severity,
    FailureKind failureKind,
    Long amount,
    Instant paidAt,
    String imageUrl
) {
  public enum Severity {
    INFO,
    SUCCESS,
    ERROR
  }

  public static ProgressEvent info(Instant timestamp, int page, String externalId, String message) {
    return new ProgressEvent(timestamp, page, externalId, message, Severity.INFO, null, null, null, null);
  }

  public static ProgressEvent success(Instant timestamp, int page, String externalId, String message) {
    return new ProgressEvent(timestamp, page, externalId, message, Severity.SUCCESS, null, null, null, null);
  }

  public static ProgressEvent error(Instant timestamp, int page, String externalId, FailureKind kind, String message) {
    return new ProgressEvent(timestamp, page, externalId, message, Severity.ERROR, kind, null, null, null);
  }
}
