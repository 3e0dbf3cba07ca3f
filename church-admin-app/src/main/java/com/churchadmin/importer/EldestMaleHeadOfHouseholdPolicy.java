package com.churchadmin.importer;

import com.churchadmin.model.MemberLookup;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Head of household is the oldest male sharing the envelope; with no male, the oldest member.
 * Missing birth dates sort last and ties keep list order (the sort is stable).
 */
public class EldestMaleHeadOfHouseholdPolicy implements HeadOfHouseholdPolicy {

    private static final Comparator<MemberLookup> OLDEST_FIRST = Comparator.comparing(
        MemberLookup::dateOfBirth, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    @Override
    public Optional<UUID> headOf(List<MemberLookup> envelopeMembers, MemberSnapshot snapshot) {
        List<MemberLookup> candidates = envelopeMembers.stream()
            .filter(MemberLookup::isMale)
            .toList();
        if (candidates.isEmpty()) {
            candidates = envelopeMembers;
        }
        return oldest(candidates);
    }

    private static Optional<UUID> oldest(List<MemberLookup> members) {
        List<MemberLookup> sorted = new ArrayList<>(members);
        sorted.sort(OLDEST_FIRST);
        return sorted.stream().findFirst().map(MemberLookup::id);
    }
}
