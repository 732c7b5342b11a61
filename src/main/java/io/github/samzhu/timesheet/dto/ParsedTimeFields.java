package io.github.samzhu.timesheet.dto;

import java.util.List;

/**
 * 任務工時欄位的正規化結果。
 *
 * <p>{@code actualTime} 推導規則 (依序，第一個符合即採用)：
 * <ol>
 *   <li>見積時間與達成率皆有值 → {@code estimatedTime × timeAchievementRate}</li>
 *   <li>有直接回報的實績時間 → {@code actualTimeRaw}</li>
 *   <li>否則為 null，任務在彙整時計入「見積なし」</li>
 * </ol>
 *
 * @param estimatedTime 見積時間 (小時)
 * @param timeAchievementRate 時間達成率 (0.8 = 80%)
 * @param actualTimeRaw 直接回報的實績時間 (小時)
 * @param actualTime 推導後的實績時間 (小時)
 * @param rateSource 達成率的來源欄位種類
 * @param warnings 解析警告
 */
public record ParsedTimeFields(
    Double estimatedTime,
    Double timeAchievementRate,
    Double actualTimeRaw,
    Double actualTime,
    FieldIdentifier.Kind rateSource,
    List<ParseWarning> warnings
) {
    public ParsedTimeFields {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean unestimated() {
        return actualTime == null;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
