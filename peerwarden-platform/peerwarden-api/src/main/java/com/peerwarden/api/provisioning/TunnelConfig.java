package com.peerwarden.api.provisioning;

/**
 * A rendered client configuration and the file name to offer it under.
 */
public record TunnelConfig(String fileName, String content) {}
