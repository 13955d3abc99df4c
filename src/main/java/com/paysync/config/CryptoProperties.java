package com.paysync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "paysync.crypto")
public record CryptoProperties(String secret) {}
