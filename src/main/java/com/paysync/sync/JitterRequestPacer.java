package com.paysync.sync;

import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

@Component
public class JitterRequestPacer implements RequestPacer {
  @Override
  public void pause(long minMs, long maxMs) {
    long low = Math.max(0, Math.min(minMs, maxMs));
    long high = Math.max(low, maxMs);
    long delay = high > low ? ThreadLocalRandom.current().nextLong(low, high + 1) : low;
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException ex) {
      // The run observes the interrupt at its next poll and stops.
      Thread.currentThread().interrupt();
    }
  }
}
