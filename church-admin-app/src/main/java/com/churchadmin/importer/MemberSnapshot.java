package com.churchadmin.importer;

import com.churchadmin.model.MemberLookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory view of one tenant's members, fetched once before the row loop. Lists keep the order
 * the members were loaded in, which is what "first encountered" means for the lookups below.
 */
public final class MemberSnapshot {

    private final List<MemberLookup> members;
    private final Map<Integer, List<MemberLookup>> byEnvelope = new LinkedHashMap<>();
    private final Map<UUID, List<MemberLookup>> byHousehold = new LinkedHashMap<>();
    private final Map<UUID, MemberLookup> byId = new HashMap<>();

    private MemberSnapshot(List<MemberLookup> members) {
        this.members = List.copyOf(members);
        for (MemberLookup member : this.members) {
            if (member.envelopeNumber() != null) {
                byEnvelope.computeIfAbsent(member.envelopeNumber(), k -> new ArrayList<>()).add(member);
            }
            if (member.householdId() != null) {
                byHousehold.computeIfAbsent(member.householdId(), k -> new ArrayList<>()).add(member);
            }
            byId.put(member.id(), member);
        }
    }

    public static MemberSnapshot of(List<MemberLookup> members) {
        return new MemberSnapshot(members);
    }

    public List<MemberLookup> withEnvelope(int envelopeNumber) {
        return Collections.unmodifiableList(byEnvelope.getOrDefault(envelopeNumber, List.of()));
    }

    public List<MemberLookup> inHousehold(UUID householdId) {
        return Collections.unmodifiableList(byHousehold.getOrDefault(householdId, List.of()));
    }

    public Optional<MemberLookup> findById(UUID id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<MemberLookup> guest() {
        return members.stream().filter(MemberLookup::isGuest).findFirst();
    }

    public int size() {
        return members.size();
    }
}
