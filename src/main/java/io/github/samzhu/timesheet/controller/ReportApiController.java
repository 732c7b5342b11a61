package io.github.samzhu.timesheet.controller;

import java.time.YearMonth;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.timesheet.dto.ReportDimension;
import io.github.samzhu.timesheet.dto.ReportRow;
import io.github.samzhu.timesheet.service.ReportAggregationService;

/**
 * 報表查詢 REST API 控制器。
 *
 * <p>端點：{@code GET /api/v1/reports/{dimension}?from=YYYY-MM&to=YYYY-MM}
 *
 * <p>{@code dimension} 為 {@code project}、{@code assignee} 或 {@code project-assignee}。
 * 回傳與匯出到試算表相同的彙整結果，不寫入試算表。
 */
@RestController
@RequestMapping("/api/v1/reports")
public class ReportApiController {

    private static final Logger log = LoggerFactory.getLogger(ReportApiController.class);

    private final ReportAggregationService aggregationService;

    public ReportApiController(ReportAggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * 查詢報表。
     *
     * @param dimension 報表維度
     * @param from 起始月份 (含)，可省略
     * @param to 結束月份 (含)，可省略
     * @return 排序後的報表列
     */
    @GetMapping("/{dimension}")
    public ResponseEntity<List<ReportRow>> getReport(
            @PathVariable String dimension,
            @RequestParam(required = false) YearMonth from,
            @RequestParam(required = false) YearMonth to) {
        ReportDimension reportDimension = ReportDimension.fromValue(dimension);
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
        log.info("API request: getReport dimension={}, period={} to {}", reportDimension, from, to);
        List<ReportRow> rows = aggregationService.reportData(reportDimension, from, to);
        return ResponseEntity.ok(rows);
    }
}
