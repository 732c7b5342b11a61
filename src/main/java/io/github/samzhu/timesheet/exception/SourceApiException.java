package io.github.samzhu.timesheet.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Asana API 暫時性錯誤 (網路錯誤、5xx、429)。
 *
 * <p>處理方式：
 * <ul>
 *   <li>由 source 重試策略以指數退避重試，若有 {@code Retry-After} 則依其等待</li>
 *   <li>重試耗盡後，該專案被略過並記錄，執行繼續處理其餘專案</li>
 * </ul>
 */
public class SourceApiException extends RuntimeException implements RetryAfterAware {

    private final int statusCode;
    private final Duration retryAfter;

    public SourceApiException(String message, int statusCode, Duration retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public SourceApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.retryAfter = null;
    }

    /**
     * HTTP 狀態碼，網路錯誤時為 0。
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
