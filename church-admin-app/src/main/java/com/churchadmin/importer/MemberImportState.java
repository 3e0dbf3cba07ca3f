package com.churchadmin.importer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Accumulator threaded through one member import: the tenant's existing households and emails, plus
 * whatever earlier accepted rows of the same file added.
 */
public final class MemberImportState {

    private final Set<UUID> existingHouseholds;
    private final Set<String> emails = new HashSet<>();
    private final HouseholdGroupTracker groups = new HouseholdGroupTracker();

    public MemberImportState(Set<UUID> existingHouseholds, Set<String> existingEmails) {
        this.existingHouseholds = Set.copyOf(existingHouseholds);
        existingEmails.forEach(this::addEmail);
    }

    public boolean householdExists(UUID householdId) {
        return existingHouseholds.contains(householdId);
    }

    public boolean emailTaken(String email) {
        return email != null && emails.contains(email.toLowerCase(Locale.ROOT));
    }

    public HouseholdGroupTracker groups() {
        return groups;
    }

    void accept(MemberRow row, String groupToken) {
        groups.remember(groupToken, row.member().householdId());
        addEmail(row.member().email1());
        addEmail(row.member().email2());
    }

    private void addEmail(String email) {
        if (email != null) {
            emails.add(email.toLowerCase(Locale.ROOT));
        }
    }
}
