package io.github.samzhu.timesheet.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>排程器 (Cloud Scheduler → Pub/Sub) 可能以 <b>Structured Mode</b>
 * ({@code application/cloudevents+json}) 發送觸發事件。此配置註冊
 * {@link CloudEventMessageConverter}，讓 Spring Cloud Stream 將其轉換為：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload ({@link io.github.samzhu.timesheet.dto.JobTrigger})</li>
 * </ul>
 *
 * @see io.github.samzhu.timesheet.function.JobTriggerFunction
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
