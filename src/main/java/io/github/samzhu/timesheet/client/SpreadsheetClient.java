package io.github.samzhu.timesheet.client;

import java.util.List;

/**
 * 試算表寫入介面。
 *
 * <p>失敗時拋出：
 * <ul>
 *   <li>{@link io.github.samzhu.timesheet.exception.SpreadsheetAuthException} - 無法認證，整次匯出中止</li>
 *   <li>{@link io.github.samzhu.timesheet.exception.SpreadsheetQuotaException} - 暫時性錯誤，可重試</li>
 *   <li>{@link io.github.samzhu.timesheet.exception.SpreadsheetWriteException} - 其他錯誤，不重試</li>
 * </ul>
 */
public interface SpreadsheetClient {

    /**
     * 取得試算表中所有分頁名稱。
     *
     * @param spreadsheetId 試算表 ID
     * @return 分頁名稱
     */
    List<String> sheetTitles(String spreadsheetId);

    /**
     * 新增分頁。
     *
     * @param spreadsheetId 試算表 ID
     * @param title 分頁名稱
     */
    void addSheet(String spreadsheetId, String title);

    /**
     * 清除範圍內的值 (保留格式)。
     *
     * @param spreadsheetId 試算表 ID
     * @param range A1 表示法範圍，例如 {@code '2024年3月'!A:G}
     */
    void clearValues(String spreadsheetId, String range);

    /**
     * 以 {@code USER_ENTERED} 覆寫範圍內的值。
     *
     * @param spreadsheetId 試算表 ID
     * @param range 起始儲存格，例如 {@code '2024年3月'!A1}
     * @param values 列資料
     * @return 更新的儲存格數
     */
    int updateValues(String spreadsheetId, String range, List<List<Object>> values);
}
