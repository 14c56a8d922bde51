package org.changeflow.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record OverwriteRowsRequest(@NotNull(message = "rows are required") List<Map<String, Object>> rows) {
}
