package com.churchadmin.importer;

import com.churchadmin.model.GivingCategory;
import com.churchadmin.model.GivingItem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Maps CSV columns to the tenant's active giving categories and turns a row's cells into giving items.
 *
 * A column maps to a category when its header equals the category name (ignoring case, spaces and
 * underscores) or when the vocabulary's alias table points the header at that category name. That
 * covers both the legacy fixed columns ("amount", "general fund", "district synod") and columns named
 * after tenant-defined categories.
 */
public final class CategoryAmountResolver {

    private static final Set<String> NON_AMOUNT_COLUMNS = Set.of(
        "envelope number", "envelopenumber", "member id", "memberid", "date given", "dategiven",
        "date", "notes", "note");

    static final String NO_AMOUNTS = "At least one amount is required";

    private final List<CategoryColumn> columns;

    private CategoryAmountResolver(List<CategoryColumn> columns) {
        this.columns = columns;
    }

    public record CategoryColumn(int index, String header, GivingCategory category) {}

    public static CategoryAmountResolver build(HeaderIndex headers, List<GivingCategory> categories,
                                               ImportVocabulary vocabulary) {
        List<CategoryColumn> columns = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            String label = headers.labelAt(i);
            String normalized = HeaderIndex.normalize(label);
            if (normalized.isEmpty() || NON_AMOUNT_COLUMNS.contains(normalized)) continue;

            final int column = i;
            matchCategory(normalized, categories, vocabulary)
                .ifPresent(category -> columns.add(new CategoryColumn(column, label, category)));
        }
        return new CategoryAmountResolver(List.copyOf(columns));
    }

    private static Optional<GivingCategory> matchCategory(String normalizedHeader, List<GivingCategory> categories,
                                                          ImportVocabulary vocabulary) {
        String compactHeader = HeaderIndex.compact(normalizedHeader);
        for (GivingCategory category : categories) {
            String name = HeaderIndex.normalize(category.name());
            if (name.equals(normalizedHeader) || HeaderIndex.compact(name).equals(compactHeader)) {
                return Optional.of(category);
            }
        }
        Optional<String> aliased = vocabulary.categoryForHeader(normalizedHeader);
        if (aliased.isEmpty()) {
            return Optional.empty();
        }
        return categories.stream()
            .filter(category -> category.name().equalsIgnoreCase(aliased.get()))
            .findFirst();
    }

    public boolean hasColumns() {
        return !columns.isEmpty();
    }

    public List<CategoryColumn> columns() {
        return columns;
    }

    /**
     * Reads every mapped column of the row. Blank and zero cells are skipped; a cell that is not a
     * non-negative number of whole cents rejects the row. Columns that land on the same category are summed.
     */
    public RowResult<List<GivingItem>> resolve(ImportRow row) {
        Map<UUID, BigDecimal> totals = new LinkedHashMap<>();
        for (CategoryColumn column : columns) {
            String cell = row.valueAt(column.index());
            if (cell == null) continue;

            BigDecimal amount;
            try {
                amount = ImportValues.parseAmount(cell);
            } catch (NumberFormatException e) {
                return RowResult.rejected(row.lineNumber(), invalidAmount(column.header()));
            }
            if (amount.signum() < 0) {
                return RowResult.rejected(row.lineNumber(), invalidAmount(column.header()));
            }
            if (!ImportValues.hasCentPrecision(amount)) {
                return RowResult.rejected(row.lineNumber(), fractionalCents(column.header()));
            }
            if (amount.signum() == 0) continue;

            totals.merge(column.category().id(), amount.setScale(2), BigDecimal::add);
        }

        if (totals.isEmpty()) {
            return RowResult.rejected(row.lineNumber(), NO_AMOUNTS);
        }
        List<GivingItem> items = new ArrayList<>(totals.size());
        totals.forEach((categoryId, amount) -> items.add(new GivingItem(categoryId, amount)));
        return RowResult.accepted(row.lineNumber(), List.copyOf(items));
    }

    static String invalidAmount(String label) {
        return "Invalid amount for " + label + " (must be a non-negative number)";
    }

    static String fractionalCents(String label) {
        return "Invalid amount for " + label + " (no more than 2 decimal places)";
    }
}
