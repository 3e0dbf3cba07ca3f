package com.churchadmin.importer;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class HouseholdGroupTrackerTest {

    @Test
    void firstHouseholdForATokenWins() {
        HouseholdGroupTracker tracker = new HouseholdGroupTracker();
        UUID first = UUID.randomUUID();

        tracker.remember("smith", first);
        tracker.remember("smith", UUID.randomUUID());

        assertThat(tracker.find("smith")).contains(first);
        assertThat(tracker.size()).isEqualTo(1);
    }

    @Test
    void unknownAndNullTokens() {
        HouseholdGroupTracker tracker = new HouseholdGroupTracker();
        tracker.remember(null, UUID.randomUUID());

        assertThat(tracker.find("jones")).isEmpty();
        assertThat(tracker.find(null)).isEmpty();
        assertThat(tracker.size()).isZero();
    }
}
