package com.churchadmin.importer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Case-insensitive lookup from header text to column index.
 *
 * Every header is stored twice: normalized ("First_Name " becomes "first name") and with the spaces
 * removed ("firstname"), so "FirstName", "first_name" and "First Name" all resolve to the same column.
 */
public final class HeaderIndex {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\s]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final List<String> headers;
    private final Map<String, Integer> columns;

    private HeaderIndex(List<String> headers, Map<String, Integer> columns) {
        this.headers = headers;
        this.columns = columns;
    }

    public static HeaderIndex of(List<String> headerCells) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headerCells.size(); i++) {
            String normalized = normalize(headerCells.get(i));
            if (normalized.isEmpty()) continue;
            columns.put(normalized, i);
            columns.put(compact(normalized), i);
        }
        List<String> labels = headerCells.stream()
            .map(h -> h.replace("\uFEFF", "").trim())
            .toList();
        return new HeaderIndex(labels, columns);
    }

    public static String normalize(String header) {
        if (header == null) return "";
        String stripped = header.replace("\uFEFF", "").trim();
        return SEPARATORS.matcher(stripped).replaceAll(" ").toLowerCase();
    }

    public static String compact(String normalized) {
        return SPACES.matcher(normalized).replaceAll("");
    }

    /**
     * Column of the first name in {@code names} present in the header row.
     */
    public OptionalInt indexOf(String... names) {
        for (String name : names) {
            String normalized = normalize(name);
            Integer column = columns.get(normalized);
            if (column == null) {
                column = columns.get(compact(normalized));
            }
            if (column != null) {
                return OptionalInt.of(column);
            }
        }
        return OptionalInt.empty();
    }

    public boolean has(String... names) {
        return indexOf(names).isPresent();
    }

    /**
     * Header text as written in the file, trimmed.
     */
    public String labelAt(int column) {
        return headers.get(column);
    }

    public int size() {
        return headers.size();
    }

    public List<String> labels() {
        return headers;
    }
}
