package io.github.samzhu.timesheet.service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.document.TaskRecord;
import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.repository.TaskRecordRepository;
import io.github.samzhu.timesheet.util.PeriodUtils;

/**
 * 月別報表彙整服務。
 *
 * <p>依 {@code (完成月份, 維度鍵)} 分組已完成任務：
 * <ul>
 *   <li>{@link ReportDimension#PROJECT} - 專案名稱 (空白時改用專案 gid)</li>
 *   <li>{@link ReportDimension#ASSIGNEE} - 負責人名稱</li>
 *   <li>{@link ReportDimension#PROJECT_ASSIGNEE} - 專案名稱 × 負責人名稱</li>
 * </ul>
 * 未指派負責人的任務不列入負責人相關維度。
 *
 * <p>彙整規則：
 * <pre>
 * totalActualTime    = Σ actualTime     (actualTime 為 null 的任務不計入)
 * totalEstimatedTime = Σ estimatedTime  (estimatedTime 為 null 的任務不計入)
 * taskCount          = 任務數
 * unestimatedCount   = actualTime 為 null 的任務數
 * </pre>
 *
 * <p>結果依月份、主要鍵、次要鍵升序排列。
 */
@Service
public class ReportAggregationService {

    private static final Logger log = LoggerFactory.getLogger(ReportAggregationService.class);

    private static final Comparator<GroupKey> GROUP_ORDER = Comparator
        .comparing(GroupKey::month)
        .thenComparing(GroupKey::primaryKey)
        .thenComparing(GroupKey::secondaryKey, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final TaskRecordRepository repository;

    public ReportAggregationService(TaskRecordRepository repository) {
        this.repository = repository;
    }

    /**
     * 彙整資料庫中所有月份。
     *
     * @param dimension 報表維度
     * @return 排序後的報表列
     */
    public List<ReportRow> reportData(ReportDimension dimension) {
        return reportData(dimension, null, null);
    }

    /**
     * 彙整指定月份區間。
     *
     * @param dimension 報表維度
     * @param from 起始月份 (含)，null 表示不限
     * @param to 結束月份 (含)，null 表示不限
     * @return 排序後的報表列
     */
    public List<ReportRow> reportData(ReportDimension dimension, YearMonth from, YearMonth to) {
        List<TaskRecord> records = loadRecords(from, to);
        List<ReportRow> rows = aggregate(dimension, records);
        log.info("Report {} ({} ~ {}): {} tasks -> {} rows",
            dimension, from != null ? from : "*", to != null ? to : "*", records.size(), rows.size());
        return rows;
    }

    /**
     * 將任務分組彙整。
     *
     * @param dimension 報表維度
     * @param records 任務，完成日期為 null 的任務會被忽略
     * @return 排序後的報表列
     */
    public List<ReportRow> aggregate(ReportDimension dimension, List<TaskRecord> records) {
        Map<GroupKey, List<TaskRecord>> grouped = records.stream()
            .filter(record -> record.completedAt() != null)
            .filter(record -> !dimension.requiresAssignee() || assigneeKey(record) != null)
            .collect(Collectors.groupingBy(record -> groupKey(dimension, record),
                () -> new TreeMap<>(GROUP_ORDER), Collectors.toList()));

        return grouped.entrySet().stream()
            .map(entry -> toRow(entry.getKey(), entry.getValue()))
            .toList();
    }

    private List<TaskRecord> loadRecords(YearMonth from, YearMonth to) {
        if (from == null && to == null) {
            return repository.findByCompletedAtNotNull();
        }
        // Between 不含邊界，因此往外各推一天
        LocalDate after = from != null ? PeriodUtils.periodStart(from).minusDays(1) : LocalDate.of(1970, 1, 1);
        LocalDate before = to != null ? PeriodUtils.periodEnd(to).plusDays(1) : LocalDate.of(9999, 12, 31);
        return repository.findByCompletedAtBetween(after, before);
    }

    private static GroupKey groupKey(ReportDimension dimension, TaskRecord record) {
        LocalDate month = PeriodUtils.firstOfMonth(record.completedAt());
        return switch (dimension) {
            case PROJECT -> new GroupKey(month, projectKey(record), null);
            case ASSIGNEE -> new GroupKey(month, assigneeKey(record), null);
            case PROJECT_ASSIGNEE -> new GroupKey(month, projectKey(record), assigneeKey(record));
        };
    }

    private static ReportRow toRow(GroupKey key, List<TaskRecord> records) {
        double totalActual = records.stream()
            .map(TaskRecord::actualTime)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .sum();
        double totalEstimated = records.stream()
            .map(TaskRecord::estimatedTime)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .sum();
        int unestimated = (int) records.stream().filter(TaskRecord::unestimated).count();
        return new ReportRow(key.month(), key.primaryKey(), key.secondaryKey(),
            totalActual, totalEstimated, records.size(), unestimated);
    }

    static String projectKey(TaskRecord record) {
        if (record.projectName() != null && !record.projectName().isBlank()) {
            return record.projectName().trim();
        }
        return record.projectId() != null ? record.projectId() : "";
    }

    static String assigneeKey(TaskRecord record) {
        if (record.assigneeName() == null || record.assigneeName().isBlank()) {
            return null;
        }
        return record.assigneeName().trim();
    }

    private record GroupKey(LocalDate month, String primaryKey, String secondaryKey) {}
}
