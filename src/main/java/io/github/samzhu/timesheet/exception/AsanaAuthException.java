package io.github.samzhu.timesheet.exception;

/**
 * Asana 認證失敗 (401/403)，Token 無效或過期。
 *
 * <p>此錯誤不重試，直接中止整次執行並回報為 FAILURE。
 */
public class AsanaAuthException extends RuntimeException {

    private final int statusCode;

    public AsanaAuthException(int statusCode, String message) {
        super(String.format("Asana authentication failed (HTTP %d): %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
