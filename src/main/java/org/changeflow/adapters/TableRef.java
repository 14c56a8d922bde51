package org.changeflow.adapters;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Physical location of a row table.
 */
public record TableRef(String schema, String table) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public TableRef {
        if (!StringUtils.hasText(table) || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        if (StringUtils.hasText(schema) && !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        schema = StringUtils.hasText(schema) ? schema : null;
    }

    public String qualified() {
        if (StringUtils.hasText(schema)) {
            return schema + "." + table;
        }
        return table;
    }

    @Override
    public String toString() {
        return qualified();
    }
}
