package com.churchadmin.importer;

import java.util.Locale;

/**
 * The two head-of-household policies, selectable per import. They are not reconciled: sequence-based
 * attribution trusts the membership roll, eldest-male attribution works from demographics alone.
 */
public enum HeadOfHouseholdStrategy {

    SEQUENCE(new SequenceHeadOfHouseholdPolicy()),
    ELDEST_MALE(new EldestMaleHeadOfHouseholdPolicy());

    private final HeadOfHouseholdPolicy policy;

    HeadOfHouseholdStrategy(HeadOfHouseholdPolicy policy) {
        this.policy = policy;
    }

    public HeadOfHouseholdPolicy policy() {
        return policy;
    }

    /**
     * Parses a request parameter such as "sequence" or "eldest-male"; blank means {@code fallback}.
     */
    public static HeadOfHouseholdStrategy fromParameter(String value, HeadOfHouseholdStrategy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String name = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (HeadOfHouseholdStrategy strategy : values()) {
            if (strategy.name().equals(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown head-of-household policy: " + value);
    }
}
