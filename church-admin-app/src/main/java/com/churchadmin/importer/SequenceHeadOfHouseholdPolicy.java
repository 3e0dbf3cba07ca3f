package com.churchadmin.importer;

import com.churchadmin.model.MemberLookup;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Head of household is the member of the envelope's household whose sequence role is
 * {@code head_of_house}. The household is the first envelope member's; without a flagged head
 * (or without a household) the first envelope member is used.
 */
public class SequenceHeadOfHouseholdPolicy implements HeadOfHouseholdPolicy {

    @Override
    public Optional<UUID> headOf(List<MemberLookup> envelopeMembers, MemberSnapshot snapshot) {
        if (envelopeMembers.isEmpty()) {
            return Optional.empty();
        }

        MemberLookup first = envelopeMembers.get(0);
        if (first.householdId() == null) {
            return Optional.of(first.id());
        }

        return snapshot.inHousehold(first.householdId()).stream()
            .filter(MemberLookup::isHeadOfHouse)
            .map(MemberLookup::id)
            .findFirst()
            .or(() -> Optional.of(first.id()));
    }
}
