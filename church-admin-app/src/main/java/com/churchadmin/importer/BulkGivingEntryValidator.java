package com.churchadmin.importer;

import com.churchadmin.model.BulkGivingRequest;
import com.churchadmin.model.GivingCategory;
import com.churchadmin.model.GivingItem;
import com.churchadmin.model.GivingRecord;
import com.churchadmin.util.TextSanitizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Validates entries typed into the bulk giving grid. Entries are numbered from 1 in the order received;
 * envelope number 0 records the gift against the tenant's guest member.
 */
public final class BulkGivingEntryValidator {

    static final int GUEST_ENVELOPE = 0;

    private final Map<UUID, GivingCategory> categories;
    private final GiverResolver givers;

    public BulkGivingEntryValidator(List<GivingCategory> activeCategories, GiverResolver givers) {
        this.categories = activeCategories.stream()
            .collect(Collectors.toMap(GivingCategory::id, c -> c, (a, b) -> a, LinkedHashMap::new));
        this.givers = givers;
    }

    public RowResult<GivingRecord> validate(int rowNumber, BulkGivingRequest.Entry entry) {
        if (entry == null || isBlank(entry.envelopeNumber()) || isBlank(entry.dateGiven())) {
            return RowResult.rejected(rowNumber, "Missing required fields (envelopeNumber and dateGiven)");
        }

        Integer envelope = ImportValues.parseInteger(entry.envelopeNumber());
        if (envelope == null) {
            return RowResult.rejected(rowNumber, "Invalid envelope number");
        }
        RowResult<UUID> giver = envelope == GUEST_ENVELOPE
            ? givers.guest(rowNumber)
            : givers.byEnvelope(rowNumber, envelope);
        if (!giver.isAccepted()) {
            return giver.asRejection();
        }

        if (entry.items() == null || entry.items().isEmpty()) {
            return RowResult.rejected(rowNumber, "At least one giving item is required");
        }
        RowResult<List<GivingItem>> items = resolveItems(rowNumber, entry.items());
        if (!items.isAccepted()) {
            return items.asRejection();
        }

        LocalDate dateGiven = ImportValues.parseDate(entry.dateGiven());
        if (dateGiven == null) {
            return RowResult.rejected(rowNumber, "Invalid date format (use YYYY-MM-DD)");
        }

        String notes = TextSanitizer.sanitizeText(entry.notes());
        return RowResult.accepted(rowNumber, new GivingRecord(giver.value(), dateGiven, notes, items.value()));
    }

    private RowResult<List<GivingItem>> resolveItems(int rowNumber, List<BulkGivingRequest.Item> requested) {
        Map<UUID, BigDecimal> totals = new LinkedHashMap<>();
        for (BulkGivingRequest.Item item : requested) {
            if (item == null || isBlank(item.categoryId())) {
                return RowResult.rejected(rowNumber, "Invalid item - missing categoryId");
            }
            UUID categoryId = ImportValues.parseUuid(item.categoryId());
            if (categoryId == null || !categories.containsKey(categoryId)) {
                return RowResult.rejected(rowNumber, "Invalid categoryId " + item.categoryId());
            }

            BigDecimal amount;
            try {
                amount = ImportValues.parseAmount(item.amount());
            } catch (NumberFormatException e) {
                return RowResult.rejected(rowNumber,
                    CategoryAmountResolver.invalidAmount(categories.get(categoryId).name()));
            }
            if (amount == null) {
                continue;
            }
            String name = categories.get(categoryId).name();
            if (amount.signum() < 0) {
                return RowResult.rejected(rowNumber, CategoryAmountResolver.invalidAmount(name));
            }
            if (!ImportValues.hasCentPrecision(amount)) {
                return RowResult.rejected(rowNumber, CategoryAmountResolver.fractionalCents(name));
            }
            if (amount.signum() == 0) {
                continue;
            }
            totals.merge(categoryId, amount.setScale(2), BigDecimal::add);
        }

        if (totals.isEmpty()) {
            return RowResult.rejected(rowNumber, CategoryAmountResolver.NO_AMOUNTS);
        }
        List<GivingItem> items = totals.entrySet().stream()
            .map(e -> new GivingItem(e.getKey(), e.getValue()))
            .toList();
        return RowResult.accepted(rowNumber, items);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
