package com.paysync.sync;

/** One listing page could not be fetched or parsed. The run skips to the next page. */
public class PageFetchException extends RuntimeException {
  public PageFetchException(String message) {
    super(message);
  }

  public PageFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
