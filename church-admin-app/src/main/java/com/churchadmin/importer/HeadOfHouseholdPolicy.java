package com.churchadmin.importer;

import com.churchadmin.model.MemberLookup;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Picks the member a household's giving is attributed to.
 *
 * Implementations are pure: they read only their arguments, so the same snapshot and member list
 * always produce the same answer.
 */
public interface HeadOfHouseholdPolicy {

    /**
     * @param envelopeMembers members sharing one envelope number, in snapshot order
     * @param snapshot        the tenant's member snapshot the list was taken from
     * @return the head of household's member id, or empty when the list is empty
     */
    Optional<UUID> headOf(List<MemberLookup> envelopeMembers, MemberSnapshot snapshot);
}
