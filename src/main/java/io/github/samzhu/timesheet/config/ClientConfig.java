package io.github.samzhu.timesheet.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.google.api.gax.core.CredentialsProvider;

import io.github.samzhu.timesheet.client.GoogleCredentialsInterceptor;

/**
 * 外部 API 的 {@link RestClient} 配置。
 *
 * <p>每個外部服務一個 RestClient，基底 URL 與認證方式在此集中設定：
 * <ul>
 *   <li>{@code asanaRestClient} - Asana Personal Access Token</li>
 *   <li>{@code sheetsRestClient} - Google OAuth2 (Spring Cloud GCP 憑證)</li>
 *   <li>{@code slackRestClient} - 無認證，webhook URL 本身即為憑證</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/integration/rest-clients.html#rest-restclient">RestClient</a>
 */
@Configuration
public class ClientConfig {

    @Bean
    public RestClient asanaRestClient(RestClient.Builder builder, TimesheetProperties properties) {
        RestClient.Builder asana = builder.clone()
            .baseUrl(properties.asana().baseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        String token = properties.asana().accessToken();
        if (token != null && !token.isBlank()) {
            asana.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return asana.build();
    }

    @Bean
    public RestClient sheetsRestClient(RestClient.Builder builder, TimesheetProperties properties,
            ObjectProvider<CredentialsProvider> credentialsProvider) {
        return builder.clone()
            .baseUrl(properties.sheets().baseUrl())
            .requestInterceptor(new GoogleCredentialsInterceptor(credentialsProvider.getIfAvailable()))
            .build();
    }

    @Bean
    public RestClient slackRestClient(RestClient.Builder builder) {
        return builder.clone().build();
    }
}
