package com.churchadmin.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A giving record ready to be inserted: attributed to one member, carrying one or more items.
 */
public record GivingRecord(
    UUID memberId,
    LocalDate dateGiven,
    String notes,
    List<GivingItem> items
) {
    public GivingRecord {
        items = List.copyOf(items);
    }

    public BigDecimal total() {
        return items.stream()
            .map(GivingItem::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
