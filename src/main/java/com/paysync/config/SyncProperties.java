package com.paysync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "paysync.sync")
public record SyncProperties(
    @DefaultValue("100") long itemDelayMinMs,
    @DefaultValue("300") long itemDelayMaxMs,
    @DefaultValue("300") long pageDelayMinMs,
    @DefaultValue("1000") long pageDelayMaxMs,
    @DefaultValue("3") int maxEmptyYears,
    @DefaultValue("2010") int yearFloor,
    @DefaultValue("3") int maxConsecutivePageFailures,
    @DefaultValue("100") int logCapacity,
    @DefaultValue("Asia/Seoul") String zone,
    @DefaultValue("false") boolean schedulerEnabled,
    @DefaultValue("21600000") long autoSyncIntervalMs
) {
  public SyncProperties {
    if (logCapacity < 1) {
      throw new IllegalArgumentException("paysync.sync.log-capacity must be at least 1");
    }
    if (maxConsecutivePageFailures < 1) {
      throw new IllegalArgumentException("paysync.sync.max-consecutive-page-failures must be at least 1");
    }
  }

  /** The values bound when no {@code paysync.sync.*} keys are set. */
  public static SyncProperties defaults() {
    return new SyncProperties(100, 300, 300, 1000, 3, 2010, 3, 100, "Asia/Seoul", false, 6 * 60 * 60 * 1000L);
  }
}
