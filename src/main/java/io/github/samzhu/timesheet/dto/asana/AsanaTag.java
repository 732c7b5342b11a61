package io.github.samzhu.timesheet.dto.asana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AsanaTag(String gid, String name) {}
