package com.churchadmin.importer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Links a "household group" token to the household chosen for it earlier in the same import.
 * One instance per import run; it is never shared between requests or tenants and is not thread-safe.
 */
public final class HouseholdGroupTracker {

    private final Map<String, UUID> households = new LinkedHashMap<>();

    public Optional<UUID> find(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(households.get(token));
    }

    /**
     * Records the household for a token. The first household recorded for a token wins.
     */
    public void remember(String token, UUID householdId) {
        if (token == null) return;
        households.putIfAbsent(token, householdId);
    }

    public int size() {
        return households.size();
    }
}
