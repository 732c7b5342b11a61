package io.github.samzhu.timesheet.dto;

import java.util.Locale;

/**
 * 報表彙整維度。
 *
 * <p>路徑參數使用小寫並以連字號分隔，例如 {@code project-assignee}。
 */
public enum ReportDimension {
    /** 依專案 */
    PROJECT("プロジェクト別"),
    /** 依負責人 */
    ASSIGNEE("担当者別"),
    /** 依專案 × 負責人 */
    PROJECT_ASSIGNEE("プロジェクト×担当者別");

    private final String label;

    ReportDimension(String label) {
        this.label = label;
    }

    /**
     * 報表區塊標題。
     */
    public String label() {
        return label;
    }

    /**
     * 是否需要負責人 (未指派的任務不列入)。
     */
    public boolean requiresAssignee() {
        return this != PROJECT;
    }

    public boolean composite() {
        return this == PROJECT_ASSIGNEE;
    }

    /**
     * 由路徑參數解析維度，接受 {@code project-assignee} 與 {@code PROJECT_ASSIGNEE} 兩種寫法。
     *
     * @param value 路徑參數
     * @return 維度
     * @throws IllegalArgumentException 未知的維度
     */
    public static ReportDimension fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report dimension is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ReportDimension dimension : values()) {
            if (dimension.name().equals(normalized)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown report dimension: " + value);
    }
}
