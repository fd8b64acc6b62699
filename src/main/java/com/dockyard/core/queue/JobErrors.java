package com.dockyard.core.queue;

/**
 * Turns handler exceptions into the text stored as a job's last error.
 */
public final class JobErrors {

    public static final int MAX_ERROR_LENGTH = 1000;

    private JobErrors() {}

    public static String sanitize(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getMessage() == null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        return truncate(message.replaceAll("[\\p{Cntrl}&&[^\\n\\t]]", "").strip(), MAX_ERROR_LENGTH);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
