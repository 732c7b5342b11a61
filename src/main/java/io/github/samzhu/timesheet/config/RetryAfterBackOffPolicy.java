package io.github.samzhu.timesheet.config;

import java.time.Duration;
import java.util.Optional;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import io.github.samzhu.timesheet.exception.RetryAfterAware;

/**
 * 尊重伺服器 {@code Retry-After} 的退避策略。
 *
 * <p>上一次失敗若帶有 {@link RetryAfterAware#retryAfter()}，依該值等待
 * (不超過 {@code maxIntervalMs})；否則委派給指數退避。
 */
public class RetryAfterBackOffPolicy implements BackOffPolicy {

    private final ExponentialBackOffPolicy delegate;
    private final Sleeper sleeper;
    private final long maxIntervalMs;

    public RetryAfterBackOffPolicy(ExponentialBackOffPolicy delegate, Sleeper sleeper, long maxIntervalMs) {
        this.delegate = delegate;
        this.sleeper = sleeper;
        this.maxIntervalMs = maxIntervalMs;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new RetryAfterBackOffContext(context, delegate.start(context));
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryAfterBackOffContext context = (RetryAfterBackOffContext) backOffContext;
        Optional<Duration> hint = retryAfterOf(context.retryContext.getLastThrowable());
        if (hint.isEmpty()) {
            delegate.backOff(context.delegateContext);
            return;
        }
        long waitMs = Math.min(hint.get().toMillis(), maxIntervalMs);
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while honoring Retry-After", e);
        }
    }

    private static Optional<Duration> retryAfterOf(Throwable throwable) {
        if (throwable instanceof RetryAfterAware aware) {
            return aware.retryAfter().filter(d -> !d.isNegative() && !d.isZero());
        }
        return Optional.empty();
    }

    private static final class RetryAfterBackOffContext implements BackOffContext {

        private static final long serialVersionUID = 1L;

        private final transient RetryContext retryContext;
        private final BackOffContext delegateContext;

        private RetryAfterBackOffContext(RetryContext retryContext, BackOffContext delegateContext) {
            this.retryContext = retryContext;
            this.delegateContext = delegateContext;
        }
    }
}
