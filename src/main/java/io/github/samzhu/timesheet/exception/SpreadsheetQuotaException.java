package io.github.samzhu.timesheet.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Google Sheets 暫時性錯誤：429、{@code RESOURCE_EXHAUSTED}、Quota exceeded、5xx 或連線失敗。
 *
 * <p>由 sheets 重試策略以指數退避重試。
 */
public class SpreadsheetQuotaException extends SpreadsheetWriteException implements RetryAfterAware {

    private final Duration retryAfter;

    public SpreadsheetQuotaException(String message, int statusCode, Duration retryAfter) {
        super(message, statusCode);
        this.retryAfter = retryAfter;
    }

    @Override
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
