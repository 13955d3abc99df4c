package com.paysync.sync;

import java.time.Instant;

public record SyncReport(
    SyncOutcome outcome,
    SyncProgress progress,
    int pagesVisited,
    Instant startedAt,
    Instant finishedAt,
    String errorMessage
) {}
