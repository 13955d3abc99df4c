package com.paysync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "paysync.providers.naver")
public record NaverProperties(String payBaseUrl, String ordersBaseUrl) {}
