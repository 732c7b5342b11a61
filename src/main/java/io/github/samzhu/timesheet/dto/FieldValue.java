package io.github.samzhu.timesheet.dto;

/**
 * 單一欄位的解析結果：值、來源欄位種類、可選的警告。
 *
 * @param value 解析後的數值，無法取得時為 null
 * @param source 取得值的識別方式，無值時為 null
 * @param warning 解析警告，無警告時為 null
 */
public record FieldValue(Double value, FieldIdentifier.Kind source, ParseWarning warning) {

    private static final FieldValue ABSENT = new FieldValue(null, null, null);

    public static FieldValue absent() {
        return ABSENT;
    }

    public static FieldValue of(Double value, FieldIdentifier.Kind source) {
        return new FieldValue(value, source, null);
    }

    public static FieldValue rejected(ParseWarning warning) {
        return new FieldValue(null, null, warning);
    }

    public boolean isPresent() {
        return value != null;
    }
}
