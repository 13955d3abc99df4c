package com.paysync.sync;

import java.util.List;

public record CollectionStatus(
    boolean collecting,
    SyncMode mode,
    SyncProgress progress,
    List<ProgressEvent> events,
    SyncReport lastReport
) {}
