package com.paysync.dto;

import java.util.UUID;

public record CredentialsResponse(UUID accountId, int storedHeaders) {}
