package com.paysync.ledger;

import java.time.Instant;

/** Natural key of the most recently paid record stored for an account. */
public record Checkpoint(String lastExternalId, Instant lastPaidAt) {}
