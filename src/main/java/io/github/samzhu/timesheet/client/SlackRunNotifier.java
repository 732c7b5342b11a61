package io.github.samzhu.timesheet.client;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.config.TimesheetProperties.SlackConfig;

/**
 * 透過 Slack Incoming Webhook 發送執行摘要。
 *
 * <p>未設定 {@code timesheet.slack.webhook-url} 時不發送任何訊息。
 *
 * @see <a href="https://api.slack.com/messaging/webhooks">Slack Incoming Webhooks</a>
 */
@Component
public class SlackRunNotifier implements RunNotifier {

    private static final Logger log = LoggerFactory.getLogger(SlackRunNotifier.class);

    private final RestClient restClient;
    private final SlackConfig config;

    public SlackRunNotifier(@Qualifier("slackRestClient") RestClient restClient, TimesheetProperties properties) {
        this.restClient = restClient;
        this.config = properties.slack();
    }

    @Override
    public void notify(boolean success, String summaryLine) {
        if (!config.enabled()) {
            log.debug("Slack webhook not configured, skipping notification");
            return;
        }
        String text = (success ? ":white_check_mark: " : ":warning: ") + summaryLine;
        try {
            restClient.post()
                .uri(config.webhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("text", text))
                .retrieve()
                .toBodilessEntity();
            log.debug("Slack notification sent");
        } catch (RestClientException e) {
            log.warn("Slack notification failed: {}", e.getMessage(), e);
        }
    }
}
