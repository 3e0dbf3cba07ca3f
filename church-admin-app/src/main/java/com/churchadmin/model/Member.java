package com.churchadmin.model;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A member row as written by the member import. Every member belongs to a household.
 */
public record Member(
    UUID id,
    UUID householdId,
    String firstName,
    String middleName,
    String lastName,
    String suffix,
    String preferredName,
    String maidenName,
    String title,
    String sex,
    LocalDate dateOfBirth,
    String email1,
    String email2,
    String phoneHome,
    String phoneCell1,
    String phoneCell2,
    LocalDate baptismDate,
    LocalDate confirmationDate,
    String receivedBy,
    LocalDate dateReceived,
    String removedBy,
    LocalDate dateRemoved,
    LocalDate deceasedDate,
    String membershipCode,
    Integer envelopeNumber,
    String participation,
    String sequence
) {
    public String fullName() {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            sb.append(firstName);
        }
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(lastName);
        }
        return sb.toString();
    }
}
