package org.changeflow.service.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.changeflow.models.enums.ValidationPhase;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts reports to and from the JSON document attached to a change request.
 */
@Component
@RequiredArgsConstructor
public class ValidationReports {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> toDocument(ValidationReport report, ValidationPhase phase) {
        Map<String, Object> document = new LinkedHashMap<>(objectMapper.convertValue(report, MAP_TYPE));
        document.put("phase", phase.name());
        document.put("evaluatedAt", Instant.now().toString());
        return document;
    }

    public ValidationReport fromDocument(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return ValidationReport.notStarted();
        }
        return objectMapper.convertValue(document, ValidationReport.class);
    }
}
