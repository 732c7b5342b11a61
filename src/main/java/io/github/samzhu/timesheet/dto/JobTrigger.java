package io.github.samzhu.timesheet.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.FetchRequest;

/**
 * 工作觸發訊息 (CloudEvents data payload)。
 *
 * <p>由 Cloud Scheduler 經 Pub/Sub 發送，例如：
 * <pre>
 * {"job": "fetch", "fetch": {"incremental": true}}
 * {"job": "export", "export": {"from": "2024-01", "to": "2024-03"}}
 * {"job": "snapshot"}
 * </pre>
 *
 * @param job 要執行的工作
 * @param fetch 抓取選項，僅 {@link Job#FETCH} 使用
 * @param export 匯出選項，僅 {@link Job#EXPORT} 使用
 */
public record JobTrigger(
    Job job,
    FetchRequest fetch,
    ExportRequest export
) {
    public enum Job {
        FETCH,
        EXPORT,
        SNAPSHOT;

        @JsonCreator
        public static Job from(String value) {
            if (value == null) {
                return null;
            }
            return Job.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
