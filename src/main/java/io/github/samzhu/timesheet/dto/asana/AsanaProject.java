package io.github.samzhu.timesheet.dto.asana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Asana 專案摘要。
 *
 * @param gid 專案 ID
 * @param name 專案名稱
 * @param archived 是否已封存，封存專案不抓取
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsanaProject(
    String gid,
    String name,
    boolean archived
) {}
