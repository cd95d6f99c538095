package com.peerwarden.api.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Generates WireGuard credentials from a ranked list of backends.
 * 
 * Backends are tried in order; unavailable ones are skipped and failing ones
 * are logged and skipped. The first success wins.
 */
public class KeyGenerationService {

    private static final Logger log = LoggerFactory.getLogger(KeyGenerationService.class);

    private final List<KeyGenerationStrategy> strategies;

    public KeyGenerationService(List<KeyGenerationStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one key generation strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Generates a key pair, with a preshared key when requested.
     */
    public GeneratedKeys generate(boolean includePresharedKey) {
        GeneratedKeys keys = firstSuccessful("key pair", strategy -> strategy.generate(includePresharedKey));
        log.info("Generated key pair, public key {}", WireGuardKeys.redact(keys.publicKey()));
        return keys;
    }

    public String generatePresharedKey() {
        return firstSuccessful("preshared key", KeyGenerationStrategy::generatePresharedKey);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(KeyGenerationStrategy::name).toList();
    }

    private <T> T firstSuccessful(String what, Function<KeyGenerationStrategy, T> operation) {
        for (KeyGenerationStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                log.debug("Key generation backend {} unavailable", strategy.name());
                continue;
            }
            try {
                T result = operation.apply(strategy);
                log.debug("Generated {} with {}", what, strategy.name());
                return result;
            } catch (RuntimeException | LinkageError e) {
                log.warn("Key generation backend {} failed to produce {}: {}", strategy.name(), what, e.getMessage());
            }
        }
        throw new KeyGenerationUnavailableException(
                "No key generation backend could produce a " + what + " (tried " + strategyNames() + ")");
    }
}
