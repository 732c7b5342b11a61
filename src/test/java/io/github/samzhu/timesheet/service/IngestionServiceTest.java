package io.github.samzhu.timesheet.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.timesheet.client.AsanaClient;
import io.github.samzhu.timesheet.client.RunNotifier;
import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.UpsertOutcome;
import io.github.samzhu.timesheet.dto.api.FetchRequest;
import io.github.samzhu.timesheet.dto.api.IngestionSummary;
import io.github.samzhu.timesheet.dto.api.RunStatus;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.dto.asana.AsanaTag;
import io.github.samzhu.timesheet.dto.asana.AsanaTask;
import io.github.samzhu.timesheet.dto.asana.AsanaUser;
import io.github.samzhu.timesheet.dto.asana.CustomField;
import io.github.samzhu.timesheet.exception.AsanaAuthException;
import io.github.samzhu.timesheet.exception.AsanaNotFoundException;
import io.github.samzhu.timesheet.exception.SourceApiException;
import io.github.samzhu.timesheet.exception.TaskStoreException;
import io.github.samzhu.timesheet.repository.TaskRecordRepository;

class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");
    private static final String FLOOR = "2023-01-01T00:00:00.000Z";

    private AsanaClient asanaClient;
    private TaskStoreService taskStore;
    private FetchCheckpointService checkpoints;
    private RunNotifier notifier;
    private AsanaTaskFetcher fetcher;
    private IngestionService service;

    private final AsanaProject alpha = new AsanaProject("p1", "Alpha", false);
    private final AsanaProject beta = new AsanaProject("p2", "Beta", false);
    private final AsanaProject gamma = new AsanaProject("p3", "Gamma", false);

    @BeforeEach
    void setUp() {
        asanaClient = mock(AsanaClient.class);
        taskStore = mock(TaskStoreService.class);
        checkpoints = mock(FetchCheckpointService.class);
        notifier = mock(RunNotifier.class);

        TimesheetProperties properties = new TimesheetProperties(null, null, null, null, null, null, null);
        fetcher = new AsanaTaskFetcher(asanaClient, new TimeFieldParser(properties), properties);
        service = new IngestionService(fetcher, taskStore, checkpoints, notifier, Clock.fixed(NOW, ZoneOffset.UTC));

        when(asanaClient.listProjects()).thenReturn(List.of(gamma, alpha, beta));
        when(taskStore.upsert(any(TaskRecord.class))).thenReturn(UpsertOutcome.INSERTED);
    }

    @Test
    void shouldStoreCompletedTasksOnly() {
        // Given: Alpha 有一個已完成任務與一個未完成任務
        when(asanaClient.listTasks(eq("p1"), eq(FLOOR), isNull())).thenReturn(List.of(
            completedTask("t1", 600.0, 0.8),
            new AsanaTask("t2", "Open", false, null, null, null, null, 0, null, List.of(), List.of())));
        when(asanaClient.listTasks(eq("p2"), anyString(), isNull())).thenReturn(List.of());
        when(asanaClient.listTasks(eq("p3"), anyString(), isNull())).thenReturn(List.of());

        // When
        IngestionSummary summary = service.runFetch(FetchRequest.full());

        // Then
        assertThat(summary.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(summary.projectsTotal()).isEqualTo(3);
        assertThat(summary.projectsProcessed()).isEqualTo(3);
        assertThat(summary.tasksFetched()).isEqualTo(1);
        assertThat(summary.inserted()).isEqualTo(1);

        ArgumentCaptor<TaskRecord> captor = ArgumentCaptor.forClass(TaskRecord.class);
        verify(taskStore).upsert(captor.capture());
        TaskRecord stored = captor.getValue();
        assertThat(stored.taskId()).isEqualTo("t1");
        assertThat(stored.projectName()).isEqualTo("Alpha");
        assertThat(stored.assigneeName()).isEqualTo("Alice");
        // 見積 600 分 = 10 小時，10 × 0.8 = 8
        assertThat(stored.estimatedTime()).isEqualTo(10.0);
        assertThat(stored.actualTime()).isEqualTo(8.0);
        // 2024-03-31T20:00Z 在 Asia/Tokyo 為 4 月 1 日
        assertThat(stored.completedAt()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(stored.tags()).containsExactly("backend");
        verify(notifier).notify(eq(true), contains("[fetch] SUCCESS"));
    }

    @Test
    void shouldSkipProjectWhenRetriesExhausted() {
        // Given: Beta 重試耗盡，Gamma 已不存在
        when(asanaClient.listTasks(eq("p1"), anyString(), isNull())).thenReturn(List.of(completedTask("t1", 60.0, 1.0)));
        when(asanaClient.listTasks(eq("p2"), anyString(), isNull()))
            .thenThrow(new SourceApiException("Asana returned 503", 503, null));
        when(asanaClient.listTasks(eq("p3"), anyString(), isNull()))
            .thenThrow(new AsanaNotFoundException("/tasks"));

        // When
        IngestionSummary summary = service.runFetch(FetchRequest.full());

        // Then: 其餘專案照常處理
        assertThat(summary.status()).isEqualTo(RunStatus.PARTIAL);
        assertThat(summary.projectsProcessed()).isEqualTo(1);
        assertThat(summary.projectsSkipped()).isEqualTo(2);
        assertThat(summary.skippedProjects()).containsExactly("Beta", "Gamma");
        assertThat(summary.inserted()).isEqualTo(1);
        verify(notifier).notify(eq(false), contains("PARTIAL"));
        // 略過的專案不推進進度，下次重抓
        verify(checkpoints).advance(alpha, NOW);
        verify(checkpoints, never()).advance(eq(beta), any());
        verify(checkpoints, never()).advance(eq(gamma), any());
    }

    @Test
    void shouldAbortWithFailedTaskIdWhenStoreFails() {
        // Given
        when(asanaClient.listTasks(eq("p1"), anyString(), isNull())).thenReturn(List.of(
            completedTask("t1", 60.0, 1.0), completedTask("t2", 60.0, 1.0)));
        when(taskStore.upsert(any(TaskRecord.class)))
            .thenReturn(UpsertOutcome.INSERTED)
            .thenThrow(new TaskStoreException("t2", new DataAccessResourceFailureException("timeout")));

        // When
        IngestionSummary summary = service.runFetch(FetchRequest.full());

        // Then: 已寫入的 t1 保留，Beta 與 Gamma 不再處理
        assertThat(summary.status()).isEqualTo(RunStatus.FAILURE);
        assertThat(summary.failedTaskId()).isEqualTo("t2");
        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(summary.error()).contains("t2");
        verify(asanaClient, never()).listTasks(eq("p2"), anyString(), any());
        verify(checkpoints, never()).advance(any(), any());
    }

    @Test
    void shouldFailOnAuthError() {
        when(asanaClient.listProjects()).thenThrow(new AsanaAuthException(401, "Not Authorized"));

        IngestionSummary summary = service.runFetch(FetchRequest.full());

        assertThat(summary.status()).isEqualTo(RunStatus.FAILURE);
        assertThat(summary.projectsTotal()).isZero();
        verify(notifier).notify(eq(false), contains("FAILURE"));
    }

    @Test
    void shouldUseProjectCheckpointForIncrementalFetch() {
        // Given
        Instant lastRun = Instant.parse("2024-03-31T00:00:00Z");
        when(checkpoints.since("p1")).thenReturn(Optional.of(lastRun));
        when(asanaClient.listTasks(anyString(), anyString(), any())).thenReturn(List.of());

        // When
        service.runFetch(new FetchRequest("alpha", true, null, null));

        // Then: 只處理 Alpha，帶入 modified_since，並推進到本次開始時間
        verify(asanaClient).listTasks("p1", FLOOR, lastRun);
        verify(asanaClient, never()).listTasks(eq("p2"), anyString(), any());
        verify(checkpoints).advance(alpha, NOW);
    }

    @Test
    void shouldFetchUnvisitedBatchInFullDuringIncrementalRun() {
        // Given: 第 1 批 (Alpha, Beta) 已有進度，第 2 批 (Gamma) 從未處理過
        when(checkpoints.since("p1")).thenReturn(Optional.of(Instant.parse("2024-03-31T00:00:00Z")));
        when(checkpoints.since("p2")).thenReturn(Optional.of(Instant.parse("2024-03-31T00:00:00Z")));
        when(checkpoints.since("p3")).thenReturn(Optional.empty());
        when(asanaClient.listTasks(eq("p3"), anyString(), isNull())).thenReturn(List.of(completedTask("t7", 60.0, 1.0)));

        // When
        IngestionSummary summary = service.runFetch(new FetchRequest(null, true, 2, 2));

        // Then: Gamma 不受其他批次進度影響，全量抓取
        assertThat(summary.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(summary.inserted()).isEqualTo(1);
        verify(asanaClient).listTasks("p3", FLOOR, null);
        verify(asanaClient, never()).listTasks(eq("p1"), anyString(), any());
        verify(checkpoints).advance(gamma, NOW);
    }

    @Test
    void shouldKeepTaskUnchangedWhenItBelongsToSeveralProjects() {
        // Given: t1 同時屬於 Alpha 與 Beta，資料庫以 Map 模擬
        Map<String, TaskRecord> store = new HashMap<>();
        TaskRecordRepository repository = mock(TaskRecordRepository.class);
        when(repository.findById(anyString()))
            .thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        when(repository.save(any(TaskRecord.class))).thenAnswer(inv -> {
            TaskRecord saved = inv.getArgument(0);
            store.put(saved.taskId(), saved);
            return saved;
        });
        AsanaTask shared = completedTask("t1", 120.0, 0.5);
        when(asanaClient.listTasks(eq("p1"), anyString(), isNull())).thenReturn(List.of(shared));
        when(asanaClient.listTasks(eq("p2"), anyString(), isNull())).thenReturn(List.of(shared));
        when(asanaClient.listTasks(eq("p3"), anyString(), isNull())).thenReturn(List.of());

        Instant secondRun = NOW.plusSeconds(86_400);
        IngestionService firstService = new IngestionService(fetcher,
            new TaskStoreService(repository, Clock.fixed(NOW, ZoneOffset.UTC)),
            checkpoints, notifier, Clock.fixed(NOW, ZoneOffset.UTC));
        IngestionService secondService = new IngestionService(fetcher,
            new TaskStoreService(repository, Clock.fixed(secondRun, ZoneOffset.UTC)),
            checkpoints, notifier, Clock.fixed(secondRun, ZoneOffset.UTC));

        // When: 相同資料執行兩次
        IngestionSummary first = firstService.runFetch(FetchRequest.full());
        IngestionSummary second = secondService.runFetch(FetchRequest.full());

        // Then: 只以名稱排序最前的專案寫入一次，第二次完全不變
        assertThat(first.inserted()).isEqualTo(1);
        assertThat(first.tasksFetched()).isEqualTo(1);
        assertThat(second.unchanged()).isEqualTo(1);
        assertThat(second.updated()).isZero();
        assertThat(second.inserted()).isZero();
        assertThat(store.get("t1").projectId()).isEqualTo("p1");
        assertThat(store.get("t1").insertedAt()).isEqualTo(NOW);
        verify(repository, times(1)).save(any(TaskRecord.class));
    }

    @Test
    void shouldRejectBatchNumberBelowOne() {
        // Given: 未經 Bean Validation 的觸發訊息
        FetchRequest request = new FetchRequest(null, false, 2, 0);

        // When
        IngestionSummary summary = service.runFetch(request);

        // Then
        assertThat(summary.status()).isEqualTo(RunStatus.FAILURE);
        assertThat(summary.error()).isEqualTo("batchNumber must be at least 1, got 0");
        verify(asanaClient, never()).listTasks(anyString(), anyString(), any());
    }

    @Test
    void shouldExpandSubtasksOneLevel() {
        // Given: 父任務未完成，子任務已完成
        AsanaTask parent = new AsanaTask("t1", "Parent", false, null, null, null, null, 1, null, List.of(), List.of());
        when(asanaClient.listTasks(eq("p1"), anyString(), isNull())).thenReturn(List.of(parent));
        when(asanaClient.listTasks(eq("p2"), anyString(), isNull())).thenReturn(List.of());
        when(asanaClient.listTasks(eq("p3"), anyString(), isNull())).thenReturn(List.of());
        when(asanaClient.listSubtasks("t1")).thenReturn(List.of(completedTask("s1", 30.0, null)));

        // When
        IngestionSummary summary = service.runFetch(FetchRequest.full());

        // Then
        ArgumentCaptor<TaskRecord> captor = ArgumentCaptor.forClass(TaskRecord.class);
        verify(taskStore).upsert(captor.capture());
        assertThat(captor.getValue().taskId()).isEqualTo("s1");
        assertThat(captor.getValue().taskName()).isEqualTo("[Subtask] Task s1");
        assertThat(captor.getValue().parentTaskId()).isEqualTo("t1");
        assertThat(summary.unestimated()).isEqualTo(1);
    }

    @Test
    void shouldSelectProjectsByFilterAndBatch() {
        List<AsanaProject> sorted = List.of(alpha, beta, gamma, new AsanaProject("p4", "Delta-Alpha", false));

        assertThat(IngestionService.selectProjects(sorted, new FetchRequest("ALPHA", false, 0, 1)))
            .extracting(AsanaProject::gid).containsExactly("p1", "p4");
        assertThat(IngestionService.selectProjects(sorted, new FetchRequest(null, false, 3, 1)))
            .extracting(AsanaProject::gid).containsExactly("p1", "p2", "p3");
        assertThat(IngestionService.selectProjects(sorted, new FetchRequest(null, false, 3, 2)))
            .extracting(AsanaProject::gid).containsExactly("p4");
        assertThat(IngestionService.selectProjects(sorted, new FetchRequest(null, false, 3, 3))).isEmpty();
    }

    private static AsanaTask completedTask(String gid, Double estimatedMinutes, Double rate) {
        List<CustomField> fields = rate != null
            ? List.of(CustomField.number("f1", "Estimated time", estimatedMinutes),
                CustomField.number("f2", "time_achievement_rate", rate))
            : List.of();
        return new AsanaTask(gid, "Task " + gid, true,
            Instant.parse("2024-03-31T20:00:00Z"),
            Instant.parse("2024-03-31T20:00:00Z"),
            null,
            new AsanaUser("u1", "Alice"),
            0, null, fields,
            List.of(new AsanaTag("g1", "backend")));
    }
}
