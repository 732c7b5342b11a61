package io.github.samzhu.timesheet.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.client.SpreadsheetClient;
import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.dto.ExportOutcome;
import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.dto.TabOutcome;
import io.github.samzhu.timesheet.exception.SpreadsheetAuthException;
import io.github.samzhu.timesheet.util.PeriodUtils;

/**
 * 將報表寫入 Google Sheets 的月別分頁。
 *
 * <p>每個月份一個分頁 (例如 {@code 2024年3月})，三個維度在同一分頁中各佔固定欄區：
 * <pre>
 * PROJECT           A:G
 * ASSIGNEE          I:O
 * PROJECT_ASSIGNEE  Q:X
 * </pre>
 *
 * <p>寫入一個欄區時先清除整個欄區，再從第 1 列寫入標題與資料，因此重複匯出同一個月份
 * 的結果相同，資料減少時舊資料也會被清掉。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>配額等暫時性錯誤以 {@code sheetsRetryTemplate} 指數退避重試，整個分頁的寫入視為一個單位</li>
 *   <li>重試耗盡或不可重試的錯誤只讓該分頁失敗，其餘分頁繼續寫入</li>
 *   <li>{@link SpreadsheetAuthException} 會讓所有分頁失敗，直接往上拋</li>
 * </ul>
 */
@Service
public class SheetReportExporter {

    private static final Logger log = LoggerFactory.getLogger(SheetReportExporter.class);

    private static final DateTimeFormatter UPDATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<ReportDimension, Block> BLOCKS = Map.of(
        ReportDimension.PROJECT, new Block("A", "G",
            List.of("対象期間", "プロジェクト名", "完了タスク数", "見積なし件数", "合計実績時間", "合計見積時間", "最終更新日時")),
        ReportDimension.ASSIGNEE, new Block("I", "O",
            List.of("対象期間", "担当者名", "完了タスク数", "見積なし件数", "合計実績時間", "合計見積時間", "最終更新日時")),
        ReportDimension.PROJECT_ASSIGNEE, new Block("Q", "X",
            List.of("対象期間", "プロジェクト名", "担当者名", "完了タスク数", "見積なし件数", "合計実績時間", "合計見積時間", "最終更新日時")));

    private final SpreadsheetClient spreadsheetClient;
    private final RetryTemplate retryTemplate;
    private final Clock clock;
    private final ZoneId zone;
    private final String spreadsheetId;

    public SheetReportExporter(SpreadsheetClient spreadsheetClient,
            @Qualifier("sheetsRetryTemplate") RetryTemplate retryTemplate,
            Clock clock,
            TimesheetProperties properties) {
        this.spreadsheetClient = spreadsheetClient;
        this.retryTemplate = retryTemplate;
        this.clock = clock;
        this.zone = properties.report().zone();
        this.spreadsheetId = properties.sheets().spreadsheetId();
    }

    /**
     * 寫入一個維度的報表，只處理有資料的月份。
     *
     * @param dimension 報表維度
     * @param rows 報表列，可包含多個月份
     * @return 各分頁結果，依月份排序
     * @throws SpreadsheetAuthException 無法認證
     */
    public ExportOutcome write(ReportDimension dimension, List<ReportRow> rows) {
        Set<YearMonth> months = rows.stream().map(ReportRow::yearMonth).collect(Collectors.toSet());
        return write(dimension, rows, months);
    }

    /**
     * 寫入一個維度的報表，每個月份一個分頁。
     *
     * <p>{@code months} 中沒有資料的月份仍會清除該維度的欄區並只寫入標題列，
     * 避免資料消失後分頁殘留舊的列。
     *
     * @param dimension 報表維度
     * @param rows 報表列，可包含多個月份
     * @param months 要寫入的月份
     * @return 各分頁結果，依月份排序
     * @throws SpreadsheetAuthException 無法認證
     */
    public ExportOutcome write(ReportDimension dimension, List<ReportRow> rows, Set<YearMonth> months) {
        if (spreadsheetId == null || spreadsheetId.isBlank()) {
            throw new IllegalStateException("timesheet.sheets.spreadsheet-id is not configured");
        }
        Map<YearMonth, List<ReportRow>> byMonth = rows.stream()
            .collect(Collectors.groupingBy(ReportRow::yearMonth, TreeMap::new, Collectors.toList()));
        months.forEach(month -> byMonth.putIfAbsent(month, List.of()));

        TabCache tabs = new TabCache();
        String updatedAt = clock.instant().atZone(zone).format(UPDATED_AT_FORMAT);
        List<TabOutcome> outcomes = new ArrayList<>();

        for (Map.Entry<YearMonth, List<ReportRow>> entry : byMonth.entrySet()) {
            YearMonth month = entry.getKey();
            String tabName = PeriodUtils.tabName(month);
            List<List<Object>> values = toValues(dimension, entry.getValue(), updatedAt);
            try {
                retryTemplate.execute(context -> {
                    writeBlock(tabs, tabName, dimension, values);
                    return null;
                });
                outcomes.add(TabOutcome.success(tabName, month, dimension, values.size() - 1));
                log.info("Sheet {} [{}]: {} rows written", tabName, dimension, values.size() - 1);
            } catch (SpreadsheetAuthException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Sheet {} [{}] failed: {}", tabName, dimension, e.getMessage(), e);
                outcomes.add(TabOutcome.failure(tabName, month, dimension, e.getMessage()));
            }
        }
        return new ExportOutcome(dimension, outcomes);
    }

    private void writeBlock(TabCache tabs, String tabName, ReportDimension dimension, List<List<Object>> values) {
        if (!tabs.titles().contains(tabName)) {
            spreadsheetClient.addSheet(spreadsheetId, tabName);
            tabs.titles().add(tabName);
        }
        Block block = BLOCKS.get(dimension);
        spreadsheetClient.clearValues(spreadsheetId, block.clearRange(tabName));
        spreadsheetClient.updateValues(spreadsheetId, block.startCell(tabName), values);
    }

    /**
     * 轉換為試算表的列資料 (第一列為標題)。
     */
    static List<List<Object>> toValues(ReportDimension dimension, List<ReportRow> rows, String updatedAt) {
        List<List<Object>> values = new ArrayList<>();
        values.add(new ArrayList<>(BLOCKS.get(dimension).headers()));
        for (ReportRow row : rows) {
            List<Object> line = new ArrayList<>();
            line.add(PeriodUtils.formatPeriod(row.yearMonth()));
            line.add(row.primaryKey());
            if (dimension.composite()) {
                line.add(row.secondaryKey());
            }
            line.add(row.taskCount());
            line.add(row.unestimatedCount());
            line.add(round(row.totalActualTime()));
            line.add(round(row.totalEstimatedTime()));
            line.add(updatedAt);
            values.add(line);
        }
        return values;
    }

    static double round(double hours) {
        return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 分頁名稱在單次寫入中只查詢一次。
     */
    private final class TabCache {

        private Set<String> titles;

        Set<String> titles() {
            if (titles == null) {
                titles = new HashSet<>(spreadsheetClient.sheetTitles(spreadsheetId));
            }
            return titles;
        }
    }

    private record Block(String firstColumn, String lastColumn, List<String> headers) {

        String clearRange(String tabName) {
            return quote(tabName) + "!" + firstColumn + ":" + lastColumn;
        }

        String startCell(String tabName) {
            return quote(tabName) + "!" + firstColumn + "1";
        }

        private static String quote(String tabName) {
            return "'" + tabName.replace("'", "''") + "'";
        }
    }
}
