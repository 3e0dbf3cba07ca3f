package com.churchadmin.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * An uploaded CSV file split into its header cells and data rows. Blank lines are dropped before
 * numbering, so row numbers count non-blank lines only.
 */
public record CsvDocument(List<String> header, List<ImportRow> rows) {

    public static final String TOO_FEW_LINES = "CSV file must have at least a header row and one data row";

    public CsvDocument {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public static CsvDocument parse(String text) {
        if (text == null) {
            throw new ImportFileException("No file provided");
        }
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n|\\r")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }

        if (lines.size() < 2) {
            throw new ImportFileException(TOO_FEW_LINES);
        }

        List<ImportRow> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            rows.add(new ImportRow(i + 1, CsvLineTokenizer.tokenize(lines.get(i))));
        }
        return new CsvDocument(CsvLineTokenizer.tokenize(lines.get(0)), rows);
    }
}
