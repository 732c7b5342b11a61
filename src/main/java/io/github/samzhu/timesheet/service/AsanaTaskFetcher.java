package io.github.samzhu.timesheet.service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.client.AsanaClient;
import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.config.TimesheetProperties.AsanaConfig;
import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.ParsedTimeFields;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.dto.asana.AsanaTag;
import io.github.samzhu.timesheet.dto.asana.AsanaTask;
import io.github.samzhu.timesheet.util.PeriodUtils;

/**
 * Asana 任務抓取服務。
 *
 * <p>以專案為單位抓取任務，並以 {@link TimeFieldParser} 解析工時欄位。
 * 子任務只往下展開一層，子任務名稱加上 {@code [Subtask] } 前綴並記錄父任務 gid。
 *
 * <p>此類別不處理錯誤：{@link io.github.samzhu.timesheet.exception.SourceApiException} 等例外
 * 在 {@link AsanaClient} 重試耗盡後直接往上拋，由呼叫端決定略過專案或中止執行。
 */
@Service
public class AsanaTaskFetcher {

    private static final Logger log = LoggerFactory.getLogger(AsanaTaskFetcher.class);

    static final String SUBTASK_PREFIX = "[Subtask] ";

    private final AsanaClient asanaClient;
    private final TimeFieldParser parser;
    private final AsanaConfig config;
    private final ZoneId zone;

    public AsanaTaskFetcher(AsanaClient asanaClient, TimeFieldParser parser, TimesheetProperties properties) {
        this.asanaClient = asanaClient;
        this.parser = parser;
        this.config = properties.asana();
        this.zone = properties.report().zone();
    }

    /**
     * 列出要處理的專案，依名稱排序讓分批處理的結果穩定。
     *
     * @return 未封存的專案
     */
    public List<AsanaProject> listProjects() {
        List<AsanaProject> projects = new ArrayList<>(asanaClient.listProjects());
        projects.sort((a, b) -> String.valueOf(a.name()).compareTo(String.valueOf(b.name())));
        log.info("Found {} active projects", projects.size());
        return projects;
    }

    /**
     * 抓取專案內已完成的任務與子任務。
     *
     * @param project 專案
     * @param modifiedSince 增量抓取的起點，null 表示全量 (自 {@code completedSinceFloor} 起)
     * @return 已解析的任務
     */
    public List<FetchedTask> fetchCompletedTasks(AsanaProject project, Instant modifiedSince) {
        List<AsanaTask> tasks = asanaClient.listTasks(project.gid(), config.completedSinceFloor(), modifiedSince);
        List<FetchedTask> completed = collect(tasks, AsanaTask::isCompletedWithTimestamp);
        log.debug("Project '{}': {} tasks listed, {} completed", project.name(), tasks.size(), completed.size());
        return completed;
    }

    /**
     * 抓取專案內未完成的任務與子任務。
     *
     * @param project 專案
     * @return 已解析的任務
     */
    public List<FetchedTask> fetchOpenTasks(AsanaProject project) {
        List<AsanaTask> tasks = asanaClient.listTasks(project.gid(), "now", null);
        List<FetchedTask> open = collect(tasks, task -> !task.completed());
        log.debug("Project '{}': {} open tasks", project.name(), open.size());
        return open;
    }

    private List<FetchedTask> collect(List<AsanaTask> tasks, Predicate<AsanaTask> include) {
        Map<String, FetchedTask> byId = new LinkedHashMap<>();
        for (AsanaTask task : tasks) {
            if (include.test(task)) {
                byId.putIfAbsent(task.gid(), new FetchedTask(task, null, parser.parse(task)));
            }
            if (config.includeSubtasks() && task.numSubtasks() > 0) {
                for (AsanaTask subtask : asanaClient.listSubtasks(task.gid())) {
                    if (include.test(subtask)) {
                        byId.putIfAbsent(subtask.gid(), new FetchedTask(subtask, task.gid(), parser.parse(subtask)));
                    }
                }
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * 建立要寫入資料庫的任務文件。
     *
     * @param project 所屬專案
     * @param fetched 已解析的任務
     * @return TaskRecord，{@code insertedAt} 由 {@link TaskStoreService} 設定
     */
    public TaskRecord toRecord(AsanaProject project, FetchedTask fetched) {
        AsanaTask task = fetched.task();
        ParsedTimeFields time = fetched.timeFields();
        return new TaskRecord(
            task.gid(),
            fetched.displayName(),
            project.gid(),
            project.name(),
            task.assignee() != null ? task.assignee().gid() : null,
            task.assignee() != null ? task.assignee().name() : null,
            PeriodUtils.toLocalDate(task.completedAt(), zone),
            task.dueOn(),
            time.estimatedTime(),
            time.timeAchievementRate(),
            time.actualTimeRaw(),
            time.actualTime(),
            task.tagsOrEmpty().stream().map(AsanaTag::name).toList(),
            fetched.parentTaskId(),
            task.modifiedAt(),
            null);
    }

    /**
     * 抓取並解析後的任務。
     *
     * @param task Asana 任務
     * @param parentTaskId 父任務 gid，一般任務為 null
     * @param timeFields 工時解析結果
     */
    public record FetchedTask(AsanaTask task, String parentTaskId, ParsedTimeFields timeFields) {

        public boolean isSubtask() {
            return parentTaskId != null;
        }

        public String displayName() {
            return isSubtask() ? SUBTASK_PREFIX + task.name() : task.name();
        }
    }
}
