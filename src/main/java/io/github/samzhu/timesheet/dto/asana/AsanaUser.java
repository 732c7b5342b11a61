package io.github.samzhu.timesheet.dto.asana;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AsanaUser(String gid, String name) {}
