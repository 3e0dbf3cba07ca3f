package com.churchadmin.model;

import java.util.List;

/**
 * JSON body of the bulk giving input endpoint. Values arrive as loosely typed strings from the entry grid.
 */
public record BulkGivingRequest(List<Entry> records) {

    public record Entry(
        String envelopeNumber,
        String dateGiven,
        String notes,
        List<Item> items
    ) {}

    public record Item(
        String categoryId,
        String amount
    ) {}
}
