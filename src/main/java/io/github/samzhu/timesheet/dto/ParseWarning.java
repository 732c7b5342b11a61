package io.github.samzhu.timesheet.dto;

/**
 * 單一欄位解析時的警告，不會中斷任務處理。
 *
 * @param code 警告類型
 * @param field 欄位名稱
 * @param rawValue 原始值
 */
public record ParseWarning(Code code, String field, String rawValue) {

    public enum Code {
        /** 機器鍵與在地化名稱的達成率不一致，採用機器鍵。 */
        RATE_CONFLICT,
        /** 達成率不是數字或百分比。 */
        RATE_UNPARSEABLE,
        /** 達成率為負數。 */
        RATE_NEGATIVE,
        /** 見積時間無法解析或為負數。 */
        ESTIMATE_UNPARSEABLE,
        /** 實績時間無法解析或為負數。 */
        RAW_UNPARSEABLE
    }

    @Override
    public String toString() {
        return code + "(" + field + "=" + rawValue + ")";
    }
}
