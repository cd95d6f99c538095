package com.peerwarden.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Key generation backends.
 *
 * @param preferNativeTool  try the {@code wg} command line tool before the in-process Curve25519 backend
 * @param toolPaths         extra {@code wg} locations probed before the built-in candidates
 * @param probeTimeout      bound on each {@code wg --version} probe
 * @param invocationTimeout bound on each {@code wg genkey|pubkey|genpsk} call
 */
@ConfigurationProperties(prefix = "peerwarden.keygen")
public record KeyGenerationProperties(
        @DefaultValue("true") boolean preferNativeTool,
        @DefaultValue List<String> toolPaths,
        @DefaultValue("5s") Duration probeTimeout,
        @DefaultValue("10s") Duration invocationTimeout
) {}
