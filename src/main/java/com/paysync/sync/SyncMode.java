package com.paysync.sync;

import java.util.Locale;

public enum SyncMode {
  /** Collect only records newer than the stored checkpoint. */
  INCREMENTAL,
  /** Re-collect the whole history, replacing stored records. */
  FULL;

  public static SyncMode parse(String value) {
    if (value == null || value.isBlank()) {
      return INCREMENTAL;
    }
    return SyncMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
