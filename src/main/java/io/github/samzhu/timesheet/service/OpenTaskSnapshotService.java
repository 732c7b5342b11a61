package io.github.samzhu.timesheet.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.client.RunNotifier;
import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.document.OpenTaskSnapshot;
import io.github.samzhu.timesheet.dto.ParsedTimeFields;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.dto.api.SnapshotSummary;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.dto.asana.AsanaTask;
import io.github.samzhu.timesheet.exception.AsanaAuthException;
import io.github.samzhu.timesheet.exception.AsanaNotFoundException;
import io.github.samzhu.timesheet.exception.AsanaRequestException;
import io.github.samzhu.timesheet.exception.SourceApiException;
import io.github.samzhu.timesheet.repository.OpenTaskSnapshotRepository;
import io.github.samzhu.timesheet.service.AsanaTaskFetcher.FetchedTask;

/**
 * 未完成任務快照服務。
 *
 * <p>每次執行時為每個未完成任務新增一筆 {@link OpenTaskSnapshot}，
 * 只使用 {@code insert}：同一天執行兩次會留下兩筆，不合併也不去重。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>單一專案抓取失敗 (重試耗盡、404 等) → 略過該專案，狀態為 PARTIAL</li>
 *   <li>{@link AsanaAuthException} 或資料庫寫入失敗 → 中止，狀態為 FAILURE</li>
 * </ul>
 */
@Service
public class OpenTaskSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(OpenTaskSnapshotService.class);

    private final AsanaTaskFetcher fetcher;
    private final OpenTaskSnapshotRepository repository;
    private final RunNotifier notifier;
    private final Clock clock;
    private final ZoneId zone;

    public OpenTaskSnapshotService(
            AsanaTaskFetcher fetcher,
            OpenTaskSnapshotRepository repository,
            RunNotifier notifier,
            Clock clock,
            TimesheetProperties properties) {
        this.fetcher = fetcher;
        this.repository = repository;
        this.notifier = notifier;
        this.clock = clock;
        this.zone = properties.report().zone();
    }

    /**
     * 執行一次快照。
     *
     * @return 執行摘要，不會拋出例外
     */
    public SnapshotSummary runSnapshot() {
        Instant startedAt = clock.instant();
        LocalDate snapshotDate = startedAt.atZone(zone).toLocalDate();
        log.info("Starting open task snapshot for {}", snapshotDate);

        int processed = 0;
        int skipped = 0;
        int rows = 0;
        int overdue = 0;
        String error = null;

        try {
            for (AsanaProject project : fetcher.listProjects()) {
                List<FetchedTask> openTasks;
                try {
                    openTasks = fetcher.fetchOpenTasks(project);
                } catch (SourceApiException | AsanaNotFoundException | AsanaRequestException e) {
                    skipped++;
                    log.warn("Skipping project '{}' ({}): {}", project.name(), project.gid(), e.getMessage());
                    continue;
                }

                List<OpenTaskSnapshot> snapshots = new ArrayList<>();
                for (FetchedTask fetched : openTasks) {
                    snapshots.add(toSnapshot(snapshotDate, project, fetched, startedAt));
                }
                if (!snapshots.isEmpty()) {
                    repository.insert(snapshots);
                }
                rows += snapshots.size();
                overdue += (int) snapshots.stream()
                    .filter(s -> s.status() == OpenTaskSnapshot.Status.OVERDUE)
                    .count();
                processed++;
                log.debug("Project '{}': {} open tasks captured", project.name(), snapshots.size());
            }
        } catch (RuntimeException e) {
            error = e.getMessage();
            log.error("Open task snapshot aborted: {}", e.getMessage(), e);
        }

        RunStatus status = error != null ? RunStatus.FAILURE : skipped > 0 ? RunStatus.PARTIAL : RunStatus.SUCCESS;
        long durationMs = clock.millis() - startedAt.toEpochMilli();
        SnapshotSummary summary = new SnapshotSummary(status, snapshotDate, startedAt, durationMs,
            processed, skipped, rows, overdue, error);
        log.info("Open task snapshot completed: {}", summary.summaryLine());
        notifier.notify(status == RunStatus.SUCCESS, summary.summaryLine());
        return summary;
    }

    private static OpenTaskSnapshot toSnapshot(LocalDate snapshotDate, AsanaProject project,
            FetchedTask fetched, Instant capturedAt) {
        AsanaTask task = fetched.task();
        ParsedTimeFields time = fetched.timeFields();
        boolean hasTimeFields = time.estimatedTime() != null || time.timeAchievementRate() != null;
        return OpenTaskSnapshot.create(
            snapshotDate,
            task.gid(),
            fetched.displayName(),
            project.gid(),
            project.name(),
            task.assignee() != null ? task.assignee().name() : null,
            task.dueOn(),
            hasTimeFields,
            fetched.parentTaskId(),
            capturedAt);
    }
}
