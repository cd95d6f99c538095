package com.peerwarden.api.keys;

/**
 * A key generation backend.
 */
public interface KeyGenerationStrategy {

    String name();

    /**
     * Whether this backend can run on this host. May be expensive the first time.
     */
    boolean isAvailable();

    GeneratedKeys generate(boolean includePresharedKey);

    String generatePresharedKey();
}
