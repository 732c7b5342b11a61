package io.github.samzhu.timesheet.config;

import java.time.ZoneId;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timesheet 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link AsanaConfig} - Asana API 連線與抓取範圍</li>
 *   <li>{@link SheetsConfig} - 輸出目標 Google Sheets</li>
 *   <li>{@link FieldsConfig} - 工時相關自訂欄位的識別名稱與單位</li>
 *   <li>{@link ReportConfig} - 月份歸屬使用的時區</li>
 *   <li>{@link RetrySettings} - Asana / Sheets 呼叫的重試策略</li>
 *   <li>{@link SlackConfig} - 執行結果通知 (可選)</li>
 *   <li>{@link ScheduleConfig} - 內建排程 (預設停用)</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * timesheet:
 *   asana:
 *     access-token: ${ASANA_ACCESS_TOKEN}
 *     workspace-id: ${ASANA_WORKSPACE_ID}
 *   sheets:
 *     spreadsheet-id: ${SPREADSHEET_ID}
 *   fields:
 *     rate-key: time_achievement_rate
 *     rate-label: 時間達成率
 *     estimated-unit: MINUTES
 *   report:
 *     zone-id: Asia/Tokyo
 *   retry:
 *     sheets:
 *       max-attempts: 3
 *       initial-interval-ms: 10000
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "timesheet")
public record TimesheetProperties(
    AsanaConfig asana,
    SheetsConfig sheets,
    FieldsConfig fields,
    ReportConfig report,
    RetrySettings retry,
    SlackConfig slack,
    ScheduleConfig schedule
) {
    public TimesheetProperties {
        if (asana == null) {
            asana = AsanaConfig.defaults();
        }
        if (sheets == null) {
            sheets = SheetsConfig.defaults();
        }
        if (fields == null) {
            fields = FieldsConfig.defaults();
        }
        if (report == null) {
            report = ReportConfig.defaults();
        }
        if (retry == null) {
            retry = RetrySettings.defaults();
        }
        if (slack == null) {
            slack = new SlackConfig(null);
        }
        if (schedule == null) {
            schedule = ScheduleConfig.defaults();
        }
    }

    /**
     * Asana API 設定。
     *
     * @param baseUrl API 根路徑，預設 {@code https://app.asana.com/api/1.0}
     * @param accessToken Personal Access Token
     * @param workspaceId 抓取的 workspace gid
     * @param completedSinceFloor 全量抓取時的 {@code completed_since} 下限
     * @param pageSize 分頁大小，Asana 上限 100
     * @param includeSubtasks 是否一併抓取子任務
     */
    public record AsanaConfig(
        String baseUrl,
        String accessToken,
        String workspaceId,
        String completedSinceFloor,
        int pageSize,
        Boolean includeSubtasks
    ) {
        public AsanaConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://app.asana.com/api/1.0";
            }
            if (completedSinceFloor == null || completedSinceFloor.isBlank()) {
                completedSinceFloor = "2023-01-01T00:00:00.000Z";
            }
            if (pageSize <= 0 || pageSize > 100) {
                pageSize = 100;
            }
            if (includeSubtasks == null) {
                includeSubtasks = Boolean.TRUE;
            }
        }

        public static AsanaConfig defaults() {
            return new AsanaConfig(null, null, null, null, 100, Boolean.TRUE);
        }
    }

    /**
     * Google Sheets 設定。
     *
     * @param baseUrl Sheets REST API 根路徑
     * @param spreadsheetId 輸出目標試算表 ID
     */
    public record SheetsConfig(
        String baseUrl,
        String spreadsheetId
    ) {
        public SheetsConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://sheets.googleapis.com/v4";
            }
        }

        public static SheetsConfig defaults() {
            return new SheetsConfig(null, null);
        }
    }

    /**
     * 工時自訂欄位設定。
     *
     * <p>時間達成率可由兩種名稱識別：穩定的機器鍵 ({@code rateKey}，比對欄位 gid 或 name)
     * 與在地化顯示名稱 ({@code rateLabel})。兩者同時存在且數值不同時以機器鍵為準。
     *
     * @param rateKey 時間達成率的機器鍵
     * @param rateLabel 時間達成率的在地化名稱
     * @param estimatedFieldNames 見積時間欄位名稱 (依序比對)
     * @param rawFieldNames 實績時間欄位名稱 (依序比對)
     * @param estimatedUnit 見積時間 number_value 的單位
     * @param rawUnit 實績時間 number_value 的單位
     */
    public record FieldsConfig(
        String rateKey,
        String rateLabel,
        List<String> estimatedFieldNames,
        List<String> rawFieldNames,
        FieldUnit estimatedUnit,
        FieldUnit rawUnit
    ) {
        public FieldsConfig {
            if (rateKey == null || rateKey.isBlank()) {
                rateKey = "time_achievement_rate";
            }
            if (rateLabel == null || rateLabel.isBlank()) {
                rateLabel = "時間達成率";
            }
            if (estimatedFieldNames == null || estimatedFieldNames.isEmpty()) {
                estimatedFieldNames = List.of("Estimated time", "見積時間");
            }
            if (rawFieldNames == null || rawFieldNames.isEmpty()) {
                rawFieldNames = List.of("actual_time_raw", "実績時間");
            }
            if (estimatedUnit == null) {
                estimatedUnit = FieldUnit.MINUTES;
            }
            if (rawUnit == null) {
                rawUnit = FieldUnit.MINUTES;
            }
        }

        public static FieldsConfig defaults() {
            return new FieldsConfig(null, null, null, null, null, null);
        }
    }

    /**
     * 自訂欄位數值的單位，統一換算為小時。
     */
    public enum FieldUnit {
        HOURS,
        MINUTES;

        public double toHours(double value) {
            return this == MINUTES ? value / 60.0 : value;
        }
    }

    /**
     * 報表設定。
     *
     * @param zoneId 完成日期與月份歸屬使用的時區，預設 {@code Asia/Tokyo}
     */
    public record ReportConfig(
        String zoneId
    ) {
        public ReportConfig {
            if (zoneId == null || zoneId.isBlank()) {
                zoneId = "Asia/Tokyo";
            }
        }

        public ZoneId zone() {
            return ZoneId.of(zoneId);
        }

        public static ReportConfig defaults() {
            return new ReportConfig(null);
        }
    }

    /**
     * 重試策略設定，分別套用於 Asana 與 Google Sheets 呼叫。
     *
     * @param source Asana API 重試策略
     * @param sheets Google Sheets 重試策略
     */
    public record RetrySettings(
        RetryPolicyConfig source,
        RetryPolicyConfig sheets
    ) {
        public RetrySettings {
            if (source == null) {
                source = new RetryPolicyConfig(6, 1000, 2.0, 30_000);
            }
            if (sheets == null) {
                sheets = new RetryPolicyConfig(3, 10_000, 2.0, 60_000);
            }
        }

        public static RetrySettings defaults() {
            return new RetrySettings(null, null);
        }
    }

    /**
     * 單一重試策略：最大嘗試次數與指數退避曲線。
     *
     * @param maxAttempts 最大嘗試次數 (含第一次)
     * @param initialIntervalMs 第一次退避等待時間 (毫秒)
     * @param multiplier 退避倍率
     * @param maxIntervalMs 單次退避上限 (毫秒)
     */
    public record RetryPolicyConfig(
        int maxAttempts,
        long initialIntervalMs,
        double multiplier,
        long maxIntervalMs
    ) {
        public RetryPolicyConfig {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialIntervalMs <= 0) {
                initialIntervalMs = 1000;
            }
            if (multiplier < 1.0) {
                multiplier = 2.0;
            }
            if (maxIntervalMs < initialIntervalMs) {
                maxIntervalMs = initialIntervalMs;
            }
        }
    }

    /**
     * Slack 通知設定，未設定 webhook 時不發送。
     *
     * @param webhookUrl Incoming Webhook URL
     */
    public record SlackConfig(
        String webhookUrl
    ) {
        public boolean enabled() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    /**
     * 內建排程設定，Cron 值為 {@code -} 時停用。
     *
     * <p>正式環境通常由 Cloud Scheduler 透過 HTTP 或 Pub/Sub 觸發，
     * 因此三個排程預設皆停用。
     *
     * @param fetchCron 抓取任務排程
     * @param exportCron 匯出報表排程
     * @param snapshotCron 未完成任務快照排程
     */
    public record ScheduleConfig(
        String fetchCron,
        String exportCron,
        String snapshotCron
    ) {
        public ScheduleConfig {
            if (fetchCron == null || fetchCron.isBlank()) {
                fetchCron = "-";
            }
            if (exportCron == null || exportCron.isBlank()) {
                exportCron = "-";
            }
            if (snapshotCron == null || snapshotCron.isBlank()) {
                snapshotCron = "-";
            }
        }

        public static ScheduleConfig defaults() {
            return new ScheduleConfig(null, null, null);
        }
    }
}
