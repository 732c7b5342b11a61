package io.github.samzhu.timesheet.client;

/**
 * 執行結果通知。
 *
 * <p>通知是附加功能：實作不可拋出例外，通知失敗也不能影響執行結果。
 */
public interface RunNotifier {

    /**
     * 發送一行摘要。
     *
     * @param success 執行是否完全成功
     * @param summaryLine 摘要文字
     */
    void notify(boolean success, String summaryLine);
}
