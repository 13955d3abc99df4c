package com.paysync.sync;

/** Raised when a run cannot start: headers, checkpoint, build token or ledger reset failed. */
public class SetupException extends RuntimeException {
  public SetupException(String message) {
    super(message);
  }

  public SetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
