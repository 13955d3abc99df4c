package com.paysync.sync;

/** Rate-limit delay between remote calls. */
@FunctionalInterface
public interface RequestPacer {
  void pause(long minMs, long maxMs);
}
