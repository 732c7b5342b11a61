package io.github.samzhu.timesheet.client;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import com.google.api.gax.core.CredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;

import io.github.samzhu.timesheet.exception.SpreadsheetAuthException;

/**
 * 為 Google Sheets 請求加上 OAuth2 Bearer Token。
 *
 * <p>憑證由 Spring Cloud GCP 的 {@link CredentialsProvider} 提供 (Application Default Credentials
 * 或 {@code spring.cloud.gcp.credentials.location})，並限縮為試算表 scope。
 * Token 過期時自動更新。
 */
public class GoogleCredentialsInterceptor implements ClientHttpRequestInterceptor {

    static final String SHEETS_SCOPE = "https://www.googleapis.com/auth/spreadsheets";

    private final CredentialsProvider credentialsProvider;
    private volatile GoogleCredentials credentials;

    public GoogleCredentialsInterceptor(CredentialsProvider credentialsProvider) {
        this.credentialsProvider = credentialsProvider;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        request.getHeaders().setBearerAuth(accessToken());
        return execution.execute(request, body);
    }

    private String accessToken() {
        try {
            GoogleCredentials current = resolveCredentials();
            current.refreshIfExpired();
            if (current.getAccessToken() == null) {
                throw new SpreadsheetAuthException("Google credentials returned no access token");
            }
            return current.getAccessToken().getTokenValue();
        } catch (IOException e) {
            throw new SpreadsheetAuthException("Failed to obtain Google access token: " + e.getMessage(), e);
        }
    }

    private GoogleCredentials resolveCredentials() throws IOException {
        GoogleCredentials current = credentials;
        if (current == null) {
            if (credentialsProvider == null) {
                throw new SpreadsheetAuthException("No Google credentials configured");
            }
            if (!(credentialsProvider.getCredentials() instanceof GoogleCredentials google)) {
                throw new SpreadsheetAuthException("Unsupported credentials type for Google Sheets");
            }
            current = google.createScopedRequired() ? google.createScoped(List.of(SHEETS_SCOPE)) : google;
            credentials = current;
        }
        return current;
    }
}
