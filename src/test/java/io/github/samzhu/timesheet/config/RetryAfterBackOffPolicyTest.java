package io.github.samzhu.timesheet.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;

import io.github.samzhu.timesheet.config.TimesheetProperties.RetryPolicyConfig;
import io.github.samzhu.timesheet.exception.SourceApiException;

class RetryAfterBackOffPolicyTest {

    private List<Long> sleeps;
    private RetryTemplate retryTemplate;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retryTemplate = RetryConfig.retryTemplate("test",
            new RetryPolicyConfig(4, 1_000, 2.0, 10_000), SourceApiException.class, sleeps::add);
    }

    @Test
    void shouldUseExponentialBackOffWithoutHint() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryTemplate.execute(context -> {
            if (attempts.incrementAndGet() < 4) {
                throw new SourceApiException("HTTP 503", 503, null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(sleeps).containsExactly(1_000L, 2_000L, 4_000L);
    }

    @Test
    void shouldHonorRetryAfterCappedAtMaxInterval() {
        AtomicInteger attempts = new AtomicInteger();

        retryTemplate.execute(context -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) {
                throw new SourceApiException("HTTP 429", 429, Duration.ofSeconds(3));
            }
            if (attempt == 2) {
                throw new SourceApiException("HTTP 429", 429, Duration.ofMinutes(5));
            }
            return null;
        });

        assertThat(sleeps).containsExactly(3_000L, 10_000L);
    }

    @Test
    void shouldNotRetryOtherExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute(context -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bad request");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }
}
