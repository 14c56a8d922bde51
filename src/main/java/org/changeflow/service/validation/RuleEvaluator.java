package org.changeflow.service.validation;

import lombok.extern.slf4j.Slf4j;
import org.changeflow.models.enums.Severity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a dataset's schema and business rules against candidate rows and returns the findings in
 * row order. Rule problems (an unparsable threshold or pattern) are reported as findings, never thrown.
 * <p>
 * Schema shape: {@code {"properties": {"col": {"type": "integer"}}, "required": ["col"]}}.
 * Rule shape: {@code {"type": "greater_than", "column": "age", "value": 0, "severity": "error"}}.
 */
@Slf4j
@Component
public class RuleEvaluator {

    public List<ValidationOutcome> evaluate(Map<String, Object> schema,
                                            List<Map<String, Object>> rules,
                                            List<Map<String, Object>> rows) {
        List<ValidationOutcome> outcomes = new ArrayList<>();
        if (rows == null || rows.isEmpty()) {
            outcomes.add(ValidationOutcome.of(Severity.FATAL, "payload", null, null, "No rows to validate"));
            return outcomes;
        }
        Map<String, String> columnTypes = columnTypes(schema);
        List<String> requiredColumns = stringList(schema == null ? null : schema.get("required"));
        List<Map<String, Object>> ruleList = rules == null ? List.of() : rules;

        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index) == null ? Map.of() : rows.get(index);
            checkSchema(row, index, columnTypes, requiredColumns, outcomes);
            for (Map<String, Object> rule : ruleList) {
                checkRule(rule, row, index, outcomes);
            }
        }
        for (Map<String, Object> rule : ruleList) {
            if ("unique".equals(ruleType(rule))) {
                checkUnique(rule, rows, outcomes);
            }
        }
        return outcomes;
    }

    private void checkSchema(Map<String, Object> row,
                             int index,
                             Map<String, String> columnTypes,
                             List<String> requiredColumns,
                             List<ValidationOutcome> outcomes) {
        for (String column : requiredColumns) {
            if (isBlank(row.get(column))) {
                outcomes.add(ValidationOutcome.of(Severity.ERROR, "schema_required", column, index,
                        "'" + column + "' is required"));
            }
        }
        if (columnTypes.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Object> cell : row.entrySet()) {
            String declared = columnTypes.get(cell.getKey());
            if (declared == null) {
                outcomes.add(ValidationOutcome.of(Severity.WARNING, "schema_column", cell.getKey(), index,
                        "'" + cell.getKey() + "' is not declared in the dataset schema"));
                continue;
            }
            if (cell.getValue() != null && !matchesType(cell.getValue(), declared)) {
                outcomes.add(ValidationOutcome.of(Severity.ERROR, "schema_type", cell.getKey(), index,
                        "'" + cell.getKey() + "' must be of type " + declared));
            }
        }
    }

    private void checkRule(Map<String, Object> rule, Map<String, Object> row, int index, List<ValidationOutcome> outcomes) {
        String type = ruleType(rule);
        if (type == null) {
            if (index > 0) {
                return;
            }
            outcomes.add(ValidationOutcome.of(Severity.INFO, "unknown", null, null, "Rule without a type was skipped"));
            return;
        }
        String column = Objects.toString(rule.get("column"), null);
        Severity defaultSeverity = ("allowed_values".equals(type) || "ref_in".equals(type)) ? Severity.WARNING : Severity.ERROR;
        Severity severity = Severity.parse(Objects.toString(rule.get("severity"), null), defaultSeverity);

        switch (type) {
            case "required" -> {
                List<String> columns = stringList(rule.get("columns"));
                if (columns.isEmpty() && column != null) {
                    columns = List.of(column);
                }
                for (String col : columns) {
                    if (isBlank(row.get(col))) {
                        outcomes.add(ValidationOutcome.of(severity, type, col, index, "'" + col + "' is required"));
                    }
                }
            }
            case "greater_than", "less_than" -> {
                Object value = row.get(column);
                if (column == null || value == null) {
                    return;
                }
                BigDecimal threshold = toNumber(rule.get("value"));
                BigDecimal actual = toNumber(value);
                if (threshold == null) {
                    outcomes.add(ValidationOutcome.of(Severity.FATAL, type, column, null,
                            "Rule threshold is not numeric: " + rule.get("value")));
                    return;
                }
                boolean greater = "greater_than".equals(type);
                boolean ok = actual != null && (greater ? actual.compareTo(threshold) > 0 : actual.compareTo(threshold) < 0);
                if (!ok) {
                    outcomes.add(ValidationOutcome.of(severity, type, column, index,
                            "'" + column + "' must be " + (greater ? "greater" : "less") + " than " + rule.get("value")));
                }
            }
            case "between", "range" -> {
                Object value = row.get(column);
                if (column == null || value == null) {
                    return;
                }
                Object rawMin = rule.get("min") != null ? rule.get("min") : rule.get("value");
                Object rawMax = rule.get("max") != null ? rule.get("max") : rule.get("value2");
                BigDecimal min = toNumber(rawMin);
                BigDecimal max = toNumber(rawMax);
                BigDecimal actual = toNumber(value);
                boolean ok = actual != null
                        && (min == null || actual.compareTo(min) >= 0)
                        && (max == null || actual.compareTo(max) <= 0);
                if (!ok) {
                    outcomes.add(ValidationOutcome.of(severity, "between", column, index,
                            "'" + column + "' must be between " + rawMin + " and " + rawMax));
                }
            }
            case "equals" -> {
                Object value = row.get(column);
                if (column == null || value == null) {
                    return;
                }
                if (!sameValue(value, rule.get("value"))) {
                    outcomes.add(ValidationOutcome.of(severity, type, column, index,
                            "'" + column + "' must equal " + rule.get("value")));
                }
            }
            case "not_contains" -> {
                Object value = row.get(column);
                String needle = Objects.toString(rule.get("value"), null);
                if (column == null || value == null || !StringUtils.hasLength(needle)) {
                    return;
                }
                if (String.valueOf(value).contains(needle)) {
                    outcomes.add(ValidationOutcome.of(severity, type, column, index,
                            "'" + column + "' must not contain '" + needle + "'"));
                }
            }
            case "regex" -> {
                Object value = row.get(column);
                String pattern = Objects.toString(rule.get("pattern"), Objects.toString(rule.get("value"), null));
                if (column == null || value == null || pattern == null) {
                    return;
                }
                try {
                    if (!Pattern.compile(pattern).matcher(String.valueOf(value)).matches()) {
                        outcomes.add(ValidationOutcome.of(severity, type, column, index,
                                "'" + column + "' does not match pattern " + pattern));
                    }
                } catch (PatternSyntaxException ex) {
                    log.warn("Invalid regex rule on column {}: {}", column, ex.getDescription());
                    outcomes.add(ValidationOutcome.of(Severity.FATAL, type, column, null,
                            "Rule pattern is not a valid regular expression: " + pattern));
                }
            }
            case "allowed_values", "ref_in" -> {
                Object value = row.get(column);
                if (column == null || value == null) {
                    return;
                }
                Collection<?> allowed = rule.get("values") instanceof Collection<?> c ? c : List.of();
                boolean found = allowed.stream().anyMatch(candidate -> sameValue(value, candidate));
                if (!found) {
                    outcomes.add(ValidationOutcome.of(severity, type, column, index,
                            "'" + column + "' value " + value + " is not in the allowed set"));
                }
            }
            case "unique", "readonly" -> {
                // unique is evaluated over the whole batch, readonly only concerns the editing surface
            }
            default -> {
                if (index == 0) {
                    outcomes.add(ValidationOutcome.of(Severity.INFO, type, column, null,
                            "Unsupported rule type '" + type + "' was skipped"));
                }
            }
        }
    }

    private void checkUnique(Map<String, Object> rule, List<Map<String, Object>> rows, List<ValidationOutcome> outcomes) {
        String column = Objects.toString(rule.get("column"), null);
        if (column == null) {
            return;
        }
        Severity severity = Severity.parse(Objects.toString(rule.get("severity"), null), Severity.ERROR);
        Map<String, Integer> firstSeen = new HashMap<>();
        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index);
            Object value = row == null ? null : row.get(column);
            if (value == null) {
                continue;
            }
            String key = canonical(value);
            Integer previous = firstSeen.putIfAbsent(key, index);
            if (previous != null) {
                outcomes.add(ValidationOutcome.of(severity, "unique", column, index,
                        "'" + column + "' value " + value + " duplicates row " + previous));
            }
        }
    }

    private Map<String, String> columnTypes(Map<String, Object> schema) {
        Map<String, String> types = new HashMap<>();
        if (schema == null || !(schema.get("properties") instanceof Map<?, ?> properties)) {
            return types;
        }
        properties.forEach((name, definition) -> {
            String type = "any";
            if (definition instanceof Map<?, ?> def && def.get("type") != null) {
                type = String.valueOf(def.get("type")).toLowerCase(Locale.ROOT);
            }
            types.put(String.valueOf(name), type);
        });
        return types;
    }

    private boolean matchesType(Object value, String declared) {
        return switch (declared) {
            case "string", "text" -> value instanceof String;
            case "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof BigInteger
                    || (value instanceof BigDecimal d && d.stripTrailingZeros().scale() <= 0);
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            default -> true;
        };
    }

    private String ruleType(Map<String, Object> rule) {
        if (rule == null || rule.get("type") == null) {
            return null;
        }
        return String.valueOf(rule.get("type")).trim().toLowerCase(Locale.ROOT);
    }

    private List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> collection)) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : collection) {
            if (item != null && StringUtils.hasText(String.valueOf(item))) {
                result.add(String.valueOf(item));
            }
        }
        return new ArrayList<>(result);
    }

    private boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private boolean sameValue(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        BigDecimal l = toNumber(left);
        BigDecimal r = toNumber(right);
        if (l != null && r != null) {
            return l.compareTo(r) == 0;
        }
        return String.valueOf(left).equals(String.valueOf(right));
    }

    private String canonical(Object value) {
        BigDecimal number = toNumber(value);
        return number != null ? number.stripTrailingZeros().toPlainString() : String.valueOf(value);
    }

    private BigDecimal toNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            if (value instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
