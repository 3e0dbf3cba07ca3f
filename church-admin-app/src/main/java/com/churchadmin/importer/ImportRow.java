package com.churchadmin.importer;

import java.util.List;
import java.util.OptionalInt;

/**
 * One tokenized data line and its 1-based line number in the upload (the header is line 1).
 */
public record ImportRow(int lineNumber, List<String> values) {

    public ImportRow {
        values = List.copyOf(values);
    }

    /**
     * Trimmed cell at the given column, or null when the column is missing or blank.
     */
    public String valueAt(int column) {
        if (column < 0 || column >= values.size()) {
            return null;
        }
        String value = values.get(column).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * First non-blank cell among the columns named by {@code names}, tried in order.
     */
    public String value(HeaderIndex headers, String... names) {
        for (String name : names) {
            OptionalInt column = headers.indexOf(name);
            if (column.isPresent()) {
                String value = valueAt(column.getAsInt());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }
}
