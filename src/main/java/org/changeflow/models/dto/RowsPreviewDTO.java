package org.changeflow.models.dto;

import java.util.List;
import java.util.Map;

public record RowsPreviewDTO(Long datasetId, List<String> columns, List<Map<String, Object>> rows, long totalRows) {
}
