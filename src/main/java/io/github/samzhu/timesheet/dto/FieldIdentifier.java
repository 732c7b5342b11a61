package io.github.samzhu.timesheet.dto;

import io.github.samzhu.timesheet.dto.asana.CustomField;

/**
 * 自訂欄位的識別方式。
 *
 * <p>同一個邏輯欄位在不同工作區可能以不同名稱出現，解析時依固定順序比對
 * 一組明確的識別值，而不做模糊比對。
 *
 * @param kind 識別種類
 * @param value 比對值
 */
public record FieldIdentifier(Kind kind, String value) {

    public enum Kind {
        /** 穩定的機器鍵，比對欄位 gid 或 name。 */
        CANONICAL,
        /** 在地化顯示名稱，只比對 name。 */
        LOCALIZED
    }

    public static FieldIdentifier canonical(String value) {
        return new FieldIdentifier(Kind.CANONICAL, value);
    }

    public static FieldIdentifier localized(String value) {
        return new FieldIdentifier(Kind.LOCALIZED, value);
    }

    public boolean matches(CustomField field) {
        if (field == null || value == null) {
            return false;
        }
        String name = field.name() != null ? field.name().trim() : null;
        if (kind == Kind.CANONICAL) {
            return value.equals(field.gid()) || value.equalsIgnoreCase(name);
        }
        return value.equals(name);
    }
}
