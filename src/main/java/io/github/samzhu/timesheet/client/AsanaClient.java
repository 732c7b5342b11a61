package io.github.samzhu.timesheet.client;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.config.TimesheetProperties.AsanaConfig;
import io.github.samzhu.timesheet.dto.asana.AsanaPage;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.dto.asana.AsanaTask;
import io.github.samzhu.timesheet.exception.AsanaAuthException;
import io.github.samzhu.timesheet.exception.AsanaNotFoundException;
import io.github.samzhu.timesheet.exception.AsanaRequestException;
import io.github.samzhu.timesheet.exception.SourceApiException;

/**
 * Asana REST API 客戶端。
 *
 * <p>所有清單端點都以 {@code limit} + {@code offset} 分頁，逐頁讀到 {@code next_page} 為 null。
 * 每一頁各自經過 {@code sourceApiRetryTemplate} 重試，失敗時不必從第一頁重新開始。
 *
 * <p>錯誤對應：
 * <pre>
 * 401 / 403                     → AsanaAuthException (不重試)
 * 404                           → AsanaNotFoundException (不重試)
 * 其他 4xx                      → AsanaRequestException (不重試)
 * 429 / 500 / 502 / 503 / 504   → SourceApiException (重試，帶 Retry-After)
 * 連線錯誤 / 逾時               → SourceApiException (重試)
 * </pre>
 *
 * @see <a href="https://developers.asana.com/reference/rest-api-reference">Asana API Reference</a>
 */
@Component
public class AsanaClient {

    private static final Logger log = LoggerFactory.getLogger(AsanaClient.class);

    /**
     * 任務查詢的 {@code opt_fields}。
     */
    public static final String TASK_FIELDS = String.join(",",
        "name", "completed", "completed_at", "modified_at", "due_on",
        "assignee.name", "num_subtasks", "actual_time_minutes",
        "custom_fields.gid", "custom_fields.name", "custom_fields.resource_subtype",
        "custom_fields.number_value", "custom_fields.text_value", "custom_fields.display_value",
        "tags.name");

    static final String PROJECT_FIELDS = "name,archived";

    private static final ParameterizedTypeReference<AsanaPage<AsanaProject>> PROJECT_PAGE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<AsanaPage<AsanaTask>> TASK_PAGE =
        new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final RetryTemplate retryTemplate;
    private final AsanaConfig config;

    public AsanaClient(@Qualifier("asanaRestClient") RestClient restClient,
            @Qualifier("sourceApiRetryTemplate") RetryTemplate retryTemplate,
            TimesheetProperties properties) {
        this.restClient = restClient;
        this.retryTemplate = retryTemplate;
        this.config = properties.asana();
    }

    /**
     * 列出 workspace 中未封存的專案。
     *
     * @return 專案列表
     */
    public List<AsanaProject> listProjects() {
        List<AsanaProject> projects = fetchAll("/projects", PROJECT_PAGE, uri -> uri
            .queryParam("workspace", config.workspaceId())
            .queryParam("archived", false)
            .queryParam("opt_fields", PROJECT_FIELDS));
        return projects.stream().filter(project -> !project.archived()).toList();
    }

    /**
     * 列出專案內的任務。
     *
     * <p>Asana 的 {@code completed_since} 會回傳「未完成」以及「在該時間之後完成」的任務，
     * 傳入 {@code now} 時只回傳未完成任務。
     *
     * @param projectId 專案 gid
     * @param completedSince {@code completed_since} 參數
     * @param modifiedSince 只回傳此時間後修改的任務，可為 null
     * @return 任務列表
     */
    public List<AsanaTask> listTasks(String projectId, String completedSince, Instant modifiedSince) {
        return fetchAll("/tasks", TASK_PAGE, uri -> {
            uri.queryParam("project", projectId)
                .queryParam("completed_since", completedSince)
                .queryParam("opt_fields", TASK_FIELDS);
            if (modifiedSince != null) {
                uri.queryParam("modified_since", modifiedSince.toString());
            }
            return uri;
        });
    }

    /**
     * 列出任務的子任務。
     *
     * @param taskId 父任務 gid
     * @return 子任務列表
     */
    public List<AsanaTask> listSubtasks(String taskId) {
        return fetchAll("/tasks/" + taskId + "/subtasks", TASK_PAGE,
            uri -> uri.queryParam("opt_fields", TASK_FIELDS));
    }

    private <T> List<T> fetchAll(String path, ParameterizedTypeReference<AsanaPage<T>> type,
            Function<UriBuilder, UriBuilder> query) {
        List<T> results = new ArrayList<>();
        String offset = null;
        int pages = 0;
        do {
            String pageOffset = offset;
            AsanaPage<T> page = retryTemplate.execute(context -> getPage(path, type, query, pageOffset));
            results.addAll(page.dataOrEmpty());
            offset = page.nextOffset();
            pages++;
        } while (offset != null);

        log.debug("Fetched {} items from {} in {} pages", results.size(), path, pages);
        return results;
    }

    private <T> AsanaPage<T> getPage(String path, ParameterizedTypeReference<AsanaPage<T>> type,
            Function<UriBuilder, UriBuilder> query, String offset) {
        try {
            AsanaPage<T> page = restClient.get()
                .uri(uri -> {
                    UriBuilder builder = query.apply(uri.path(path)).queryParam("limit", config.pageSize());
                    if (offset != null) {
                        builder.queryParam("offset", offset);
                    }
                    return builder.build();
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw toException(path, response);
                })
                .body(type);
            return page != null ? page : new AsanaPage<>(List.of(), null);
        } catch (ResourceAccessException e) {
            throw new SourceApiException("Asana request failed: " + path + ": " + e.getMessage(), e);
        }
    }

    private static RuntimeException toException(String path, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        return switch (status) {
            case 401, 403 -> new AsanaAuthException(status, path);
            case 404 -> new AsanaNotFoundException(path);
            case 429, 500, 502, 503, 504 -> new SourceApiException(
                "Asana request failed: " + path + " (HTTP " + status + ")", status,
                parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)));
            default -> new AsanaRequestException(path, status);
        };
    }

    /**
     * 解析 {@code Retry-After} (秒)。
     *
     * @param value 標頭值
     * @return 等待時間，無法解析時為 null
     */
    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", value);
            return null;
        }
    }
}
