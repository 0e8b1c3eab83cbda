package com.sitecheck.common.util;

public final class ErrorMessages {

    public static final int MAX_ERROR_LENGTH = 1000;

    private ErrorMessages() {}

    /**
     * Best available one-line description of a failure, never empty.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = error.getCause();
            message = error.getClass().getSimpleName() + ": "
                + (cause != null && cause.getMessage() != null ? cause.getMessage() : "Unknown error");
        }
        return message;
    }

    public static String truncate(String message) {
        return truncate(message, MAX_ERROR_LENGTH);
    }

    public static String truncate(String message, int maxLength) {
        if (message == null || message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }
}
