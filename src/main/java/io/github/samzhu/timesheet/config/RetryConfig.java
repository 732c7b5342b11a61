package io.github.samzhu.timesheet.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

import io.github.samzhu.timesheet.config.TimesheetProperties.RetryPolicyConfig;
import io.github.samzhu.timesheet.exception.SourceApiException;
import io.github.samzhu.timesheet.exception.SpreadsheetQuotaException;

/**
 * 集中管理的重試策略。
 *
 * <p>Asana 與 Google Sheets 的呼叫邊界各自使用一個 {@link RetryTemplate}：
 * <ul>
 *   <li>{@code sourceApiRetryTemplate} - 只重試 {@link SourceApiException}</li>
 *   <li>{@code sheetsRetryTemplate} - 只重試 {@link SpreadsheetQuotaException}</li>
 * </ul>
 * 兩者皆為「最大嘗試次數 + 指數退避 + 可重試例外判斷」，並優先採用 {@code Retry-After}。
 *
 * @see <a href="https://github.com/spring-projects/spring-retry">Spring Retry</a>
 */
@Configuration
public class RetryConfig {

    private static final Logger log = LoggerFactory.getLogger(RetryConfig.class);

    @Bean
    public RetryTemplate sourceApiRetryTemplate(TimesheetProperties properties) {
        return retryTemplate("asana", properties.retry().source(), SourceApiException.class, new ThreadWaitSleeper());
    }

    @Bean
    public RetryTemplate sheetsRetryTemplate(TimesheetProperties properties) {
        return retryTemplate("sheets", properties.retry().sheets(), SpreadsheetQuotaException.class, new ThreadWaitSleeper());
    }

    /**
     * 依設定建立重試樣板。
     *
     * @param name 用於日誌的邊界名稱
     * @param config 最大嘗試次數與退避曲線
     * @param retryOn 可重試的例外類別 (含子類別)
     * @param sleeper 等待實作，測試時可替換為不休眠的版本
     * @return 重試樣板
     */
    public static RetryTemplate retryTemplate(String name, RetryPolicyConfig config,
            Class<? extends Throwable> retryOn, Sleeper sleeper) {
        ExponentialBackOffPolicy exponential = new ExponentialBackOffPolicy();
        exponential.setInitialInterval(config.initialIntervalMs());
        exponential.setMultiplier(config.multiplier());
        exponential.setMaxInterval(config.maxIntervalMs());
        exponential.setSleeper(sleeper);

        return RetryTemplate.builder()
            .maxAttempts(config.maxAttempts())
            .retryOn(retryOn)
            .customBackoff(new RetryAfterBackOffPolicy(exponential, sleeper, config.maxIntervalMs()))
            .withListener(new LoggingRetryListener(name, config.maxAttempts()))
            .build();
    }

    private record LoggingRetryListener(String name, int maxAttempts) implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                Throwable throwable) {
            log.warn("[{}] attempt {}/{} failed: {}", name, context.getRetryCount(), maxAttempts,
                throwable.getMessage());
        }
    }
}
