package io.github.samzhu.timesheet.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.timesheet.dto.JobTrigger;
import io.github.samzhu.timesheet.dto.api.ExportRequest;
import io.github.samzhu.timesheet.dto.api.FetchRequest;
import io.github.samzhu.timesheet.service.IngestionService;
import io.github.samzhu.timesheet.service.OpenTaskSnapshotService;
import io.github.samzhu.timesheet.service.ReportExportService;

/**
 * CloudEvents 工作觸發消費者配置。
 *
 * <p>使用 Spring Cloud Function 程式設計模型，消費 Cloud Scheduler 發布到 Pub/Sub 的觸發事件。
 * 本地開發時可直接呼叫 {@link io.github.samzhu.timesheet.controller.JobApiController}。
 *
 * <p>CloudEvent data 自動轉換為 {@link JobTrigger}，依 {@code job} 執行抓取、匯出或快照。
 * 工作在消費者執行緒上同步完成；重複投遞是安全的，因為抓取以 upsert 寫入、
 * 匯出會覆寫整個欄區。快照則會多留一筆紀錄。
 *
 * <p>Binding name: {@code jobTriggerConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class JobTriggerFunction {

    private static final Logger log = LoggerFactory.getLogger(JobTriggerFunction.class);

    private final IngestionService ingestionService;
    private final ReportExportService reportExportService;
    private final OpenTaskSnapshotService snapshotService;

    public JobTriggerFunction(IngestionService ingestionService,
                              ReportExportService reportExportService,
                              OpenTaskSnapshotService snapshotService) {
        this.ingestionService = ingestionService;
        this.reportExportService = reportExportService;
        this.snapshotService = snapshotService;
    }

    /**
     * 工作觸發消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<JobTrigger>> jobTriggerConsumer() {
        return message -> {
            try {
                JobTrigger trigger = message.getPayload();
                log.info("Job trigger received: id={}, type={}, job={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    trigger.job());

                if (trigger.job() == null) {
                    log.warn("Job trigger without job, ignoring: id={}", CloudEventMessageUtils.getId(message));
                    return;
                }

                switch (trigger.job()) {
                    case FETCH -> ingestionService.runFetch(
                        trigger.fetch() != null ? trigger.fetch() : FetchRequest.full());
                    case EXPORT -> reportExportService.runExport(
                        trigger.export() != null ? trigger.export() : ExportRequest.allMonths());
                    case SNAPSHOT -> snapshotService.runSnapshot();
                }
            } catch (Exception e) {
                log.error("Failed to process job trigger: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
