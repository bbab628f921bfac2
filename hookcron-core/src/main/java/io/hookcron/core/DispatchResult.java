package io.hookcron.core;

/**
 * Outcome of one HTTP dispatch.
 *
 * @param status HTTP status, 0 when no response was received
 * @param error  transport error message, null when a response was received
 */
public record DispatchResult(int status, String error) {

    public static DispatchResult response(int status) {
        return new DispatchResult(status, null);
    }

    public static DispatchResult transportError(String error) {
        return new DispatchResult(0, error == null || error.isBlank() ? "transport error" : error);
    }

    public boolean transportFailure() {
        return error != null;
    }

    public boolean success() {
        return error == null && status > 0 && status < 400;
    }

    /**
     * Message stored as the job's last error.
     */
    public String failureMessage() {
        return error != null ? error : "status:" + status;
    }
}
