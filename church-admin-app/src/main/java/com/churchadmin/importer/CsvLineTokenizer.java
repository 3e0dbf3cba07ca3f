package com.churchadmin.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one CSV line into fields.
 *
 * A double quote toggles quoted mode, a doubled quote inside quotes is a literal quote, and a comma
 * separates fields only outside quotes. Lines are split on newlines before they get here, so quoted
 * fields cannot span lines.
 */
public final class CsvLineTokenizer {

    private CsvLineTokenizer() {
    }

    public static List<String> tokenize(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        fields.add(current.toString());
        return fields;
    }
}
