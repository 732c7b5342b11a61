package io.github.samzhu.timesheet.dto.asana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asana 任務上的自訂欄位值。
 *
 * <p>Asana 依欄位型別只填入部分值：數字欄位有 {@code number_value}，
 * 文字欄位有 {@code text_value}，所有欄位都有格式化後的 {@code display_value}
 * (例如百分比欄位的 {@code "80%"})。
 *
 * @param gid 欄位定義 ID
 * @param name 欄位名稱 (工作區設定，可能為在地化名稱)
 * @param resourceSubtype 欄位型別，例如 {@code number}、{@code text}
 * @param numberValue 數值
 * @param textValue 文字值
 * @param displayValue 顯示值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomField(
    String gid,
    String name,
    @JsonProperty("resource_subtype") String resourceSubtype,
    @JsonProperty("number_value") Double numberValue,
    @JsonProperty("text_value") String textValue,
    @JsonProperty("display_value") String displayValue
) {
    public static CustomField number(String gid, String name, Double value) {
        return new CustomField(gid, name, "number", value, null, value != null ? value.toString() : null);
    }

    public static CustomField text(String gid, String name, String value) {
        return new CustomField(gid, name, "text", null, value, value);
    }
}
