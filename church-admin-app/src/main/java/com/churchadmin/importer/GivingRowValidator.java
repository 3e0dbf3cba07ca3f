package com.churchadmin.importer;

import com.churchadmin.model.GivingItem;
import com.churchadmin.model.GivingRecord;
import com.churchadmin.util.TextSanitizer;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Turns one giving CSV row into a {@link GivingRecord} or a single rejection reason.
 *
 * Checks run in a fixed order and stop at the first failure: identifier present, date, amounts,
 * then the giver lookup.
 */
public final class GivingRowValidator {

    public static final String[] ENVELOPE_COLUMN = {"envelope number", "envelopenumber"};
    public static final String[] MEMBER_ID_COLUMN = {"member id", "memberid"};
    public static final String[] DATE_COLUMN = {"date given", "dategiven", "date"};
    public static final String[] NOTES_COLUMN = {"notes", "note"};

    private final HeaderIndex headers;
    private final CategoryAmountResolver amounts;
    private final GiverResolver givers;

    public GivingRowValidator(HeaderIndex headers, CategoryAmountResolver amounts, GiverResolver givers) {
        this.headers = headers;
        this.amounts = amounts;
        this.givers = givers;
    }

    public RowResult<GivingRecord> validate(ImportRow row) {
        int line = row.lineNumber();
        String envelope = row.value(headers, ENVELOPE_COLUMN);
        String memberId = row.value(headers, MEMBER_ID_COLUMN);
        if (envelope == null && memberId == null) {
            return RowResult.rejected(line, "Must provide either envelopeNumber or memberId");
        }

        String dateCell = row.value(headers, DATE_COLUMN);
        if (dateCell == null) {
            return RowResult.rejected(line, "Missing required field (date given)");
        }
        LocalDate dateGiven = ImportValues.parseDate(dateCell);
        if (dateGiven == null) {
            return RowResult.rejected(line, "Invalid date format (use YYYY-MM-DD)");
        }

        RowResult<List<GivingItem>> items = amounts.resolve(row);
        if (!items.isAccepted()) {
            return items.asRejection();
        }

        // envelope number wins when both identifiers are filled in
        RowResult<UUID> giver = envelope != null
            ? givers.byEnvelope(line, envelope)
            : givers.byMemberId(line, memberId);
        if (!giver.isAccepted()) {
            return giver.asRejection();
        }

        String notes = TextSanitizer.sanitizeText(row.value(headers, NOTES_COLUMN));
        return RowResult.accepted(line, new GivingRecord(giver.value(), dateGiven, notes, items.value()));
    }
}
