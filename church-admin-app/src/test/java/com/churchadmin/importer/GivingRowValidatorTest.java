package com.churchadmin.importer;

import com.churchadmin.config.ImportProperties;
import com.churchadmin.model.GivingCategory;
import com.churchadmin.model.GivingRecord;
import com.churchadmin.model.MemberLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GivingRowValidatorTest {

    private static final UUID SMITHS = UUID.randomUUID();
    private static final GivingCategory CURRENT = new GivingCategory(UUID.randomUUID(), "Current", true);

    private final MemberLookup mary = new MemberLookup(
        UUID.randomUUID(), SMITHS, 12, "female", LocalDate.of(1940, 1, 1), "spouse", null);
    private final MemberLookup john = new MemberLookup(
        UUID.randomUUID(), SMITHS, 12, "male", LocalDate.of(1950, 1, 1), MemberLookup.HEAD_OF_HOUSE, null);
    private final MemberLookup ann = new MemberLookup(
        UUID.randomUUID(), UUID.randomUUID(), 20, "female", LocalDate.of(1960, 5, 5), null, null);

    private GivingRowValidator validator;

    @BeforeEach
    void setUp() {
        HeaderIndex headers = HeaderIndex.of(List.of("Envelope Number", "Member ID", "Date Given", "Current", "Notes"));
        CategoryAmountResolver amounts = CategoryAmountResolver.build(
            headers, List.of(CURRENT), new ImportProperties().toVocabulary());
        MemberSnapshot snapshot = MemberSnapshot.of(List.of(mary, john, ann));
        validator = new GivingRowValidator(headers, amounts,
            new GiverResolver(snapshot, HeadOfHouseholdStrategy.SEQUENCE.policy()));
    }

    private RowResult<GivingRecord> validate(String envelope, String memberId, String date, String amount, String notes) {
        return validator.validate(new ImportRow(2, List.of(envelope, memberId, date, amount, notes)));
    }

    @Test
    void envelopeResolvesToHeadOfHousehold() {
        RowResult<GivingRecord> result = validate("12", "", "2024-01-15", "50.00", "");

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.value().memberId()).isEqualTo(john.id());
        assertThat(result.value().dateGiven()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(result.value().total()).isEqualByComparingTo("50.00");
        assertThat(result.value().notes()).isNull();
    }

    @Test
    void envelopeTakesPrecedenceOverMemberId() {
        RowResult<GivingRecord> result = validate("12", ann.id().toString(), "2024-01-15", "10", "");

        assertThat(result.value().memberId()).isEqualTo(john.id());
    }

    @Test
    void memberIdIsUsedWithoutEnvelope() {
        RowResult<GivingRecord> result = validate("", ann.id().toString(), "2024-01-15", "10", "");

        assertThat(result.value().memberId()).isEqualTo(ann.id());
    }

    @Test
    void identifierIsCheckedFirst() {
        RowResult<GivingRecord> result = validate("", "", "bad date", "-1", "");

        assertThat(result.errorMessage()).isEqualTo("Row 2: Must provide either envelopeNumber or memberId");
    }

    @Test
    void dateIsCheckedBeforeAmounts() {
        assertThat(validate("12", "", "", "-1", "").reason()).isEqualTo("Missing required field (date given)");
        assertThat(validate("12", "", "2024-02-30", "-1", "").reason()).isEqualTo("Invalid date format (use YYYY-MM-DD)");
    }

    @Test
    void amountsAreCheckedBeforeTheGiver() {
        assertThat(validate("99", "", "2024-01-15", "-1", "").reason()).contains("non-negative");
    }

    @Test
    void unknownGivers() {
        assertThat(validate("99", "", "2024-01-15", "5", "").reason())
            .isEqualTo("No members found for envelope number 99");
        assertThat(validate("twelve", "", "2024-01-15", "5", "").reason())
            .isEqualTo("Invalid envelope number");

        String stranger = UUID.randomUUID().toString();
        assertThat(validate("", stranger, "2024-01-15", "5", "").reason())
            .isEqualTo("Member not found with ID " + stranger);
    }

    @Test
    void notesAreSanitized() {
        RowResult<GivingRecord> result = validate("20", "", "2024-01-15", "5", "<b>In memory</b> of Ed");

        assertThat(result.value().notes()).isEqualTo("In memory of Ed");
    }
}
