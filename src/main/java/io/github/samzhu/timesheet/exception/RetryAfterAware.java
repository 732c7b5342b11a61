package io.github.samzhu.timesheet.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 可攜帶伺服器建議等待時間 ({@code Retry-After}) 的暫時性錯誤。
 *
 * @see io.github.samzhu.timesheet.config.RetryAfterBackOffPolicy
 */
public interface RetryAfterAware {

    Optional<Duration> retryAfter();
}
