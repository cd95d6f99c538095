package com.peerwarden.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Connection settings for the RouterOS REST API.
 */
@ConfigurationProperties(prefix = "peerwarden.router")
public record RouterProperties(
        @DefaultValue("https://192.168.88.1") String baseUrl,
        @DefaultValue("admin") String username,
        String password,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("10s") Duration requestTimeout
) {}
