package io.github.samzhu.timesheet.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.client.RunNotifier;
import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.UpsertOutcome;
import io.github.samzhu.timesheet.dto.api.FetchRequest;
import io.github.samzhu.timesheet.dto.api.IngestionSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.exception.AsanaNotFoundException;
import io.github.samzhu.timesheet.exception.AsanaRequestException;
import io.github.samzhu.timesheet.exception.SourceApiException;
import io.github.samzhu.timesheet.exception.TaskStoreException;
import io.github.samzhu.timesheet.service.AsanaTaskFetcher.FetchedTask;

/**
 * 已完成任務抓取流程。
 *
 * <p>處理流程：
 * <ol>
 *   <li>列出專案，依 {@code projectFilter} 與分批設定篩選</li>
 *   <li>逐一專案抓取已完成任務並解析工時欄位</li>
 *   <li>逐筆 {@link TaskStoreService#upsert}</li>
 *   <li>專案處理完成後，將該專案的進度推進到本次開始時間</li>
 * </ol>
 *
 * <p>同一任務可能屬於多個專案。單次執行中只寫入第一次遇到的那筆 (專案依名稱排序)，
 * 因此重複執行時任務的專案不會來回切換。
 *
 * <p>增量抓取以 {@link FetchCheckpointService} 中各專案的進度作為 {@code modified_since}；
 * 沒有進度的專案 (新專案、尚未處理過的批次) 做全量抓取。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>專案抓取失敗 (重試耗盡、404、其他 4xx) → 略過該專案，狀態為 PARTIAL</li>
 *   <li>工時欄位格式錯誤 → 只計入 {@code parseWarnings}</li>
 *   <li>Asana 認證失敗 → 中止，狀態為 FAILURE</li>
 *   <li>資料庫寫入失敗 → 中止，摘要帶出失敗的 {@code taskId}；已寫入的任務不回滾</li>
 * </ul>
 *
 * <p>任何情況都回傳摘要，不會把例外拋給呼叫端。
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final AsanaTaskFetcher fetcher;
    private final TaskStoreService taskStore;
    private final FetchCheckpointService checkpoints;
    private final RunNotifier notifier;
    private final Clock clock;

    public IngestionService(AsanaTaskFetcher fetcher, TaskStoreService taskStore,
            FetchCheckpointService checkpoints, RunNotifier notifier, Clock clock) {
        this.fetcher = fetcher;
        this.taskStore = taskStore;
        this.checkpoints = checkpoints;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * 執行一次抓取。
     *
     * @param request 抓取選項
     * @return 執行摘要
     */
    public IngestionSummary runFetch(FetchRequest request) {
        Instant startedAt = clock.instant();
        log.info("Starting fetch: filter={}, incremental={}, batch={}/{}",
            request.projectFilter(), request.incremental(), request.batchNumber(), request.batchSize());

        Counters counters = new Counters();
        String failedTaskId = null;
        String error = null;

        try {
            List<AsanaProject> projects = selectProjects(fetcher.listProjects(), request);
            counters.projectsTotal = projects.size();
            Set<String> seenTaskIds = new HashSet<>();

            for (AsanaProject project : projects) {
                Instant modifiedSince = null;
                if (request.incremental()) {
                    modifiedSince = checkpoints.since(project.gid()).orElse(null);
                    log.debug("Project '{}' incremental since {}", project.name(),
                        modifiedSince != null ? modifiedSince : "(no checkpoint, full fetch)");
                }

                List<FetchedTask> tasks;
                try {
                    tasks = fetcher.fetchCompletedTasks(project, modifiedSince);
                } catch (SourceApiException | AsanaNotFoundException | AsanaRequestException e) {
                    counters.skippedProjects.add(String.valueOf(project.name()));
                    log.warn("Skipping project '{}' ({}): {}", project.name(), project.gid(), e.getMessage());
                    continue;
                }

                for (FetchedTask fetched : tasks) {
                    if (!seenTaskIds.add(fetched.task().gid())) {
                        log.debug("Task {} already stored under another project, skipping for '{}'",
                            fetched.task().gid(), project.name());
                        continue;
                    }
                    TaskRecord record = fetcher.toRecord(project, fetched);
                    counters.record(fetched, taskStore.upsert(record));
                }
                checkpoints.advance(project, startedAt);
                counters.projectsProcessed++;
                log.debug("Project '{}': {} completed tasks", project.name(), tasks.size());
            }
        } catch (TaskStoreException e) {
            failedTaskId = e.getTaskId();
            error = e.getMessage();
            log.error("Fetch aborted on task {}: {}", e.getTaskId(), e.getMessage(), e);
        } catch (RuntimeException e) {
            error = e.getMessage();
            log.error("Fetch aborted: {}", e.getMessage(), e);
        }

        RunStatus status = error != null ? RunStatus.FAILURE
            : counters.skippedProjects.isEmpty() ? RunStatus.SUCCESS : RunStatus.PARTIAL;
        IngestionSummary summary = new IngestionSummary(
            status,
            startedAt,
            clock.millis() - startedAt.toEpochMilli(),
            counters.projectsTotal,
            counters.projectsProcessed,
            counters.skippedProjects.size(),
            List.copyOf(counters.skippedProjects),
            counters.tasksFetched,
            counters.inserted,
            counters.updated,
            counters.unchanged,
            counters.parseWarnings,
            counters.unestimated,
            failedTaskId,
            error);

        log.info("Fetch completed: {}", summary.summaryLine());
        notifier.notify(status == RunStatus.SUCCESS, summary.summaryLine());
        return summary;
    }

    /**
     * 依名稱篩選並取出指定批次的專案。
     *
     * @param projects 依名稱排序的專案
     * @param request 抓取選項
     * @return 本次要處理的專案
     * @throws IllegalArgumentException 分批時 {@code batchNumber} 小於 1
     */
    static List<AsanaProject> selectProjects(List<AsanaProject> projects, FetchRequest request) {
        if (request.batched() && request.batchNumber() < 1) {
            throw new IllegalArgumentException("batchNumber must be at least 1, got " + request.batchNumber());
        }
        List<AsanaProject> selected = projects;
        if (request.projectFilter() != null) {
            String filter = request.projectFilter().toLowerCase(Locale.ROOT);
            selected = selected.stream()
                .filter(p -> p.name() != null && p.name().toLowerCase(Locale.ROOT).contains(filter))
                .toList();
        }
        if (request.batched()) {
            int from = (request.batchNumber() - 1) * request.batchSize();
            if (from >= selected.size()) {
                return List.of();
            }
            int to = Math.min(from + request.batchSize(), selected.size());
            selected = selected.subList(from, to);
        }
        return selected;
    }

    private static final class Counters {
        int projectsTotal;
        int projectsProcessed;
        final List<String> skippedProjects = new ArrayList<>();
        int tasksFetched;
        int inserted;
        int updated;
        int unchanged;
        int parseWarnings;
        int unestimated;

        void record(FetchedTask fetched, UpsertOutcome outcome) {
            tasksFetched++;
            parseWarnings += fetched.timeFields().warnings().size();
            if (fetched.timeFields().unestimated()) {
                unestimated++;
            }
            switch (outcome) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }
    }
}
