package com.churchadmin.importer;

import com.churchadmin.model.BulkGivingRequest;
import com.churchadmin.model.GivingCategory;
import com.churchadmin.model.GivingRecord;
import com.churchadmin.model.MemberLookup;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class BulkGivingEntryValidatorTest {

    private static final GivingCategory CURRENT = new GivingCategory(UUID.randomUUID(), "Current", true);
    private static final GivingCategory MISSION = new GivingCategory(UUID.randomUUID(), "Mission", true);

    private final MemberLookup john = new MemberLookup(
        UUID.randomUUID(), UUID.randomUUID(), 12, "male", LocalDate.of(1950, 1, 1), MemberLookup.HEAD_OF_HOUSE, null);
    private final MemberLookup guest = new MemberLookup(
        UUID.randomUUID(), UUID.randomUUID(), null, null, null, null, MemberLookup.GUEST_CODE);

    private BulkGivingEntryValidator validator(MemberLookup... members) {
        MemberSnapshot snapshot = MemberSnapshot.of(List.of(members));
        return new BulkGivingEntryValidator(List.of(CURRENT, MISSION),
            new GiverResolver(snapshot, HeadOfHouseholdStrategy.SEQUENCE.policy()));
    }

    private static BulkGivingRequest.Entry entry(String envelope, BulkGivingRequest.Item... items) {
        return new BulkGivingRequest.Entry(envelope, "2024-03-03", null, List.of(items));
    }

    private static BulkGivingRequest.Item item(GivingCategory category, String amount) {
        return new BulkGivingRequest.Item(category.id().toString(), amount);
    }

    @Test
    void acceptsEntryForEnvelope() {
        RowResult<GivingRecord> result = validator(john).validate(1,
            entry("12", item(CURRENT, "40"), item(MISSION, "0"), item(MISSION, "")));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.value().memberId()).isEqualTo(john.id());
        assertThat(result.value().items()).hasSize(1);
        assertThat(result.value().total()).isEqualByComparingTo("40.00");
    }

    @Test
    void envelopeZeroIsTheGuest() {
        RowResult<GivingRecord> result = validator(john, guest).validate(1, entry("0", item(CURRENT, "5")));

        assertThat(result.value().memberId()).isEqualTo(guest.id());
    }

    @Test
    void envelopeZeroWithoutGuestFails() {
        RowResult<GivingRecord> result = validator(john).validate(4, entry("0", item(CURRENT, "5")));

        assertThat(result.errorMessage()).isEqualTo(
            "Row 4: No guest member found. Please create a guest member through attendance records first.");
    }

    @Test
    void requiredFields() {
        BulkGivingRequest.Entry noDate = new BulkGivingRequest.Entry("12", " ", null, List.of(item(CURRENT, "5")));

        assertThat(validator(john).validate(1, noDate).reason())
            .isEqualTo("Missing required fields (envelopeNumber and dateGiven)");
        assertThat(validator(john).validate(1, entry("12")).reason())
            .isEqualTo("At least one giving item is required");
    }

    @Test
    void categoryMustBeActiveForTheChurch() {
        String foreign = UUID.randomUUID().toString();
        BulkGivingRequest.Entry entry = entry("12", new BulkGivingRequest.Item(foreign, "5"));

        assertThat(validator(john).validate(1, entry).reason()).isEqualTo("Invalid categoryId " + foreign);
        assertThat(validator(john).validate(1, entry("12", new BulkGivingRequest.Item(null, "5"))).reason())
            .isEqualTo("Invalid item - missing categoryId");
    }

    @Test
    void amounts() {
        assertThat(validator(john).validate(1, entry("12", item(CURRENT, "0"))).reason())
            .isEqualTo("At least one amount is required");
        assertThat(validator(john).validate(1, entry("12", item(CURRENT, "-3"))).reason())
            .contains("non-negative");
    }

    @Test
    void negativeBelowOneCentIsRejectedNotSkipped() {
        RowResult<GivingRecord> result = validator(john).validate(2,
            entry("12", item(CURRENT, "40"), item(MISSION, "-0.001")));

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.reason()).isEqualTo("Invalid amount for Mission (must be a non-negative number)");
    }

    @Test
    void fractionOfACentIsRejected() {
        RowResult<GivingRecord> result = validator(john).validate(3, entry("12", item(CURRENT, "0.004")));

        assertThat(result.errorMessage()).isEqualTo("Row 3: Invalid amount for Current (no more than 2 decimal places)");
    }

    @Test
    void invalidDate() {
        BulkGivingRequest.Entry entry = new BulkGivingRequest.Entry("12", "March 3rd", null, List.of(item(CURRENT, "5")));

        assertThat(validator(john).validate(1, entry).reason()).isEqualTo("Invalid date format (use YYYY-MM-DD)");
    }
}
