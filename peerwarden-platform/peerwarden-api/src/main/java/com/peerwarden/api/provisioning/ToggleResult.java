package com.peerwarden.api.provisioning;

public record ToggleResult(String id, String name, boolean enabled, String message) {}
