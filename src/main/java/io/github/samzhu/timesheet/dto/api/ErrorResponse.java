package io.github.samzhu.timesheet.dto.api;

import java.time.Instant;
import java.util.List;

/**
 * API 錯誤回應。
 *
 * @param error 錯誤代碼
 * @param message 錯誤說明
 * @param details 欄位驗證錯誤
 * @param timestamp 發生時間
 */
public record ErrorResponse(
    String error,
    String message,
    List<String> details,
    Instant timestamp
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, List.of(), Instant.now());
    }
}
