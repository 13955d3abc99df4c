package com.paysync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "paysync.providers.coupang")
public record CoupangProperties(String baseUrl, Integer pageSize) {}
