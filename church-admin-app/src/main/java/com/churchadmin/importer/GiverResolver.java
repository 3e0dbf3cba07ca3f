package com.churchadmin.importer;

import com.churchadmin.model.MemberLookup;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a giving row's identifier (envelope number or member id) to the member the gift is
 * recorded against, using the snapshot and the import's head-of-household policy.
 */
public final class GiverResolver {

    private final MemberSnapshot snapshot;
    private final HeadOfHouseholdPolicy policy;

    public GiverResolver(MemberSnapshot snapshot, HeadOfHouseholdPolicy policy) {
        this.snapshot = snapshot;
        this.policy = policy;
    }

    public RowResult<UUID> byEnvelope(int lineNumber, String envelopeCell) {
        Integer envelope = ImportValues.parseInteger(envelopeCell);
        if (envelope == null) {
            return RowResult.rejected(lineNumber, "Invalid envelope number");
        }
        return byEnvelope(lineNumber, envelope);
    }

    public RowResult<UUID> byEnvelope(int lineNumber, int envelope) {
        List<MemberLookup> members = snapshot.withEnvelope(envelope);
        Optional<UUID> head = policy.headOf(members, snapshot);
        return head
            .map(id -> RowResult.accepted(lineNumber, id))
            .orElseGet(() -> RowResult.rejected(lineNumber, "No members found for envelope number " + envelope));
    }

    public RowResult<UUID> byMemberId(int lineNumber, String memberIdCell) {
        UUID id = ImportValues.parseUuid(memberIdCell);
        Optional<MemberLookup> member = id == null ? Optional.empty() : snapshot.findById(id);
        return member
            .map(m -> RowResult.accepted(lineNumber, m.id()))
            .orElseGet(() -> RowResult.rejected(lineNumber, "Member not found with ID " + memberIdCell));
    }

    public RowResult<UUID> guest(int lineNumber) {
        return snapshot.guest()
            .map(m -> RowResult.accepted(lineNumber, m.id()))
            .orElseGet(() -> RowResult.rejected(lineNumber,
                "No guest member found. Please create a guest member through attendance records first."));
    }
}
