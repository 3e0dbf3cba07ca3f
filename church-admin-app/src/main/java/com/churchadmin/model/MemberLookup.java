package com.churchadmin.model;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Slim projection of a member used for identifier and head-of-household lookups during an import.
 */
public record MemberLookup(
    UUID id,
    UUID householdId,
    Integer envelopeNumber,
    String sex,
    LocalDate dateOfBirth,
    String sequence,
    String membershipCode
) {
    public static final String HEAD_OF_HOUSE = "head_of_house";
    public static final String GUEST_CODE = "GUEST";

    public boolean isMale() {
        return "male".equalsIgnoreCase(sex);
    }

    public boolean isHeadOfHouse() {
        return HEAD_OF_HOUSE.equals(sequence);
    }

    public boolean isGuest() {
        return GUEST_CODE.equals(membershipCode);
    }
}
