package io.github.samzhu.timesheet.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * 月份與日期換算工具類。
 *
 * <p>完成日期依報表時區換算後再歸屬月份，因此 UTC 月底最後幾小時完成的任務
 * 會歸入時區當地的下個月。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得分頁名稱。
     *
     * @param month 月份
     * @return 格式如 "2024年3月" (月份不補零)
     */
    public static String tabName(YearMonth month) {
        return month.getYear() + "年" + month.getMonthValue() + "月";
    }

    /**
     * 將時間點換算為時區當地日期。
     *
     * @param instant 時間點，可為 null
     * @param zone 報表時區
     * @return 當地日期，輸入為 null 時回傳 null
     */
    public static LocalDate toLocalDate(Instant instant, ZoneId zone) {
        if (instant == null) {
            return null;
        }
        return instant.atZone(zone).toLocalDate();
    }

    /**
     * 取得日期所屬月份的 1 日。
     *
     * @param date 日期
     * @return 該月 1 日
     */
    public static LocalDate firstOfMonth(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    /**
     * 月份區間的第一天。
     *
     * @param month 月份
     * @return 該月 1 日
     */
    public static LocalDate periodStart(YearMonth month) {
        return month.atDay(1);
    }

    /**
     * 月份區間的最後一天。
     *
     * @param month 月份
     * @return 該月最後一天
     */
    public static LocalDate periodEnd(YearMonth month) {
        return month.atEndOfMonth();
    }

    /**
     * 取得月份的格式化字串。
     *
     * @param month 月份
     * @return 格式如 "2024-03"
     */
    public static String formatPeriod(YearMonth month) {
        return String.format("%d-%02d", month.getYear(), month.getMonthValue());
    }
}
