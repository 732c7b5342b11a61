package io.github.samzhu.timesheet.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link TimesheetProperties} 的型別安全配置綁定，
 * 並提供系統 {@link Clock}，讓 {@code insertedAt} 與快照日期可在測試中固定。
 *
 * @see TimesheetProperties
 */
@Configuration
@EnableConfigurationProperties(TimesheetProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
