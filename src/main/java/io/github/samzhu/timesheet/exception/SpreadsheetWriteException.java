package io.github.samzhu.timesheet.exception;

/**
 * Google Sheets 寫入失敗 (不可重試)。
 *
 * <p>該分頁標記為失敗，其餘分頁仍繼續寫入。
 * 可重試的配額錯誤請見 {@link SpreadsheetQuotaException}。
 */
public class SpreadsheetWriteException extends RuntimeException {

    private final int statusCode;

    public SpreadsheetWriteException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SpreadsheetWriteException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
