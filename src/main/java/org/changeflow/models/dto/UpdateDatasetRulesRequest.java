package org.changeflow.models.dto;

import java.util.List;
import java.util.Map;

public record UpdateDatasetRulesRequest(Map<String, Object> schema, List<Map<String, Object>> rules) {
}
