package com.peerwarden.routeros;

import java.io.IOException;

/**
 * Raised when the RouterOS REST endpoint answers with a non-success status.
 */
public class RouterOsException extends IOException {

    private final int statusCode;
    private final String detail;

    public RouterOsException(int statusCode, String message, String detail) {
        super(buildMessage(statusCode, message, detail));
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isNotFound() {
        return statusCode == 404
                || (detail != null && (detail.contains("no such item") || detail.contains("not found")));
    }

    private static String buildMessage(int statusCode, String message, String detail) {
        StringBuilder sb = new StringBuilder("RouterOS returned HTTP ").append(statusCode);
        if (message != null && !message.isBlank()) {
            sb.append(' ').append(message);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
