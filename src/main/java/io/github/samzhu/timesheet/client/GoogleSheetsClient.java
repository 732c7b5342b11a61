package io.github.samzhu.timesheet.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.github.samzhu.timesheet.exception.SpreadsheetAuthException;
import io.github.samzhu.timesheet.exception.SpreadsheetQuotaException;
import io.github.samzhu.timesheet.exception.SpreadsheetWriteException;

/**
 * Google Sheets REST API v4 客戶端。
 *
 * <p>只使用四個端點：
 * <ul>
 *   <li>{@code GET spreadsheets/{id}} - 列出分頁</li>
 *   <li>{@code POST spreadsheets/{id}:batchUpdate} - 新增分頁</li>
 *   <li>{@code POST spreadsheets/{id}/values/{range}:clear} - 清除範圍</li>
 *   <li>{@code PUT spreadsheets/{id}/values/{range}} - 寫入值</li>
 * </ul>
 *
 * <p>此類別不做重試，重試由 {@link io.github.samzhu.timesheet.service.SheetReportExporter}
 * 以分頁為單位進行。
 *
 * @see <a href="https://developers.google.com/sheets/api/reference/rest">Google Sheets API</a>
 */
@Component
public class GoogleSheetsClient implements SpreadsheetClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleSheetsClient.class);

    private final RestClient restClient;

    public GoogleSheetsClient(@Qualifier("sheetsRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<String> sheetTitles(String spreadsheetId) {
        SpreadsheetResponse response = call(() -> restClient.get()
            .uri(uri -> uri.path("/spreadsheets/{id}")
                .queryParam("fields", "sheets.properties.title")
                .build(spreadsheetId))
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, res) -> {
                throw toException("get spreadsheet", res);
            })
            .body(SpreadsheetResponse.class));
        if (response == null || response.sheets() == null) {
            return List.of();
        }
        return response.sheets().stream()
            .map(sheet -> sheet.properties().title())
            .toList();
    }

    @Override
    public void addSheet(String spreadsheetId, String title) {
        Map<String, Object> body = Map.of("requests",
            List.of(Map.of("addSheet", Map.of("properties", Map.of("title", title)))));
        call(() -> restClient.post()
            .uri("/spreadsheets/{id}:batchUpdate", spreadsheetId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, res) -> {
                throw toException("add sheet " + title, res);
            })
            .toBodilessEntity());
        log.info("Sheet created: {}", title);
    }

    @Override
    public void clearValues(String spreadsheetId, String range) {
        call(() -> restClient.post()
            .uri("/spreadsheets/{id}/values/{range}:clear", spreadsheetId, range)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of())
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, res) -> {
                throw toException("clear " + range, res);
            })
            .toBodilessEntity());
    }

    @Override
    public int updateValues(String spreadsheetId, String range, List<List<Object>> values) {
        Map<String, Object> body = Map.of(
            "range", range,
            "majorDimension", "ROWS",
            "values", values);
        UpdateValuesResponse response = call(() -> restClient.put()
            .uri(uri -> uri.path("/spreadsheets/{id}/values/{range}")
                .queryParam("valueInputOption", "USER_ENTERED")
                .build(spreadsheetId, range))
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, res) -> {
                throw toException("update " + range, res);
            })
            .body(UpdateValuesResponse.class));
        int cells = response != null && response.updatedCells() != null ? response.updatedCells() : 0;
        log.debug("Updated {} cells in {}", cells, range);
        return cells;
    }

    private static <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceAccessException e) {
            throw new SpreadsheetQuotaException("Sheets request failed: " + e.getMessage(), 0, null);
        }
    }

    /**
     * 依狀態碼與錯誤內容分類。
     *
     * <p>Sheets 配額錯誤通常是 429，但也可能以 403 搭配 {@code RESOURCE_EXHAUSTED}
     * 或 {@code Quota exceeded} 回應，因此需要檢查內容。
     */
    static RuntimeException toException(String operation, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        String message = "Sheets " + operation + " failed (HTTP " + status + ")";
        if (status == 429 || status >= 500 || isQuotaError(body)) {
            return new SpreadsheetQuotaException(message, status,
                parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)));
        }
        if (status == 401 || status == 403) {
            return new SpreadsheetAuthException(message + ": " + abbreviate(body));
        }
        return new SpreadsheetWriteException(message + ": " + abbreviate(body), status);
    }

    static boolean isQuotaError(String body) {
        return body != null
            && (body.contains("RESOURCE_EXHAUSTED") || body.contains("Quota exceeded")
                || body.contains("rateLimitExceeded"));
    }

    private static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SpreadsheetResponse(List<Sheet> sheets) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Sheet(SheetProperties properties) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SheetProperties(String title) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpdateValuesResponse(Integer updatedCells) {}
}
