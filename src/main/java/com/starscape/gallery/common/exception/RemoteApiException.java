package com.starscape.gallery.common.exception;

/**
 * Raised when the content host answers with an unexpected status.
 */
public class RemoteApiException extends RuntimeException {

    private final int statusCode;
    private final String operation;

    public RemoteApiException(String operation, int statusCode) {
        super("Failed to " + operation + ": " + statusCode);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * User-facing explanation of the failure, keyed on the HTTP status.
     */
    public String describe() {
        String reason;
        if (statusCode == 401) {
            reason = "Authentication failed. Please check your GitHub token.";
        } else if (statusCode == 403) {
            reason = "Access denied or API rate limit exceeded. Please try again later.";
        } else if (statusCode == 404) {
            reason = "Resource not found. The repository or file may not exist.";
        } else if (statusCode == 422) {
            reason = "Invalid request. Please check your input and try again.";
        } else if (statusCode >= 500) {
            reason = "GitHub server error. Please try again later.";
        } else {
            reason = "An unexpected error occurred: " + getMessage();
        }
        return reason + " Operation: " + operation;
    }
}
