package io.github.samzhu.timesheet.exception;

/**
 * 無法取得 Google API 存取權杖，或 Sheets 回應 401。
 *
 * <p>所有分頁都會失敗，因此直接中止匯出並回報為 FAILURE。
 */
public class SpreadsheetAuthException extends RuntimeException {

    public SpreadsheetAuthException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpreadsheetAuthException(String message) {
        super(message);
    }
}
