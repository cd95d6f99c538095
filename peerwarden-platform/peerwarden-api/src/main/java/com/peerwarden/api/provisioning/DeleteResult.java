package com.peerwarden.api.provisioning;

public record DeleteResult(boolean success, String message) {}
