package com.churchadmin.importer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportVocabularyTest {

    private static ImportVocabulary vocabulary(ImportVocabulary.Alias... aliases) {
        return new ImportVocabulary("test", List.of(aliases), List.of("active"), List.of("head_of_house"),
            List.of(), List.of("moved_no_transfer"), List.of("single"), List.of("male", "female"));
    }

    @Test
    void aliasTableIsBuiltOnceWithBothSpellings() {
        ImportVocabulary vocabulary = vocabulary(
            new ImportVocabulary.Alias("General Fund", "Current"),
            new ImportVocabulary.Alias("general_fund", "Mission"));

        assertThat(vocabulary.headerAliases())
            .containsEntry("general fund", "Current")
            .containsEntry("generalfund", "Current")
            .hasSize(2);
        assertThat(vocabulary.categoryForHeader("GENERAL-FUND")).isEmpty();
        assertThat(vocabulary.categoryForHeader("GeneralFund")).contains("Current");
        assertThat(vocabulary.categoryForHeader("Building")).isEmpty();
    }

    @Test
    void aliasTableCannotBeModified() {
        ImportVocabulary vocabulary = vocabulary(new ImportVocabulary.Alias("District Synod", "Mission"));

        assertThatThrownBy(() -> vocabulary.headerAliases().put("school", "Current"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(vocabulary.categoryForHeader("district_synod")).contains("Mission");
    }

    @Test
    void enumValuesAreNormalized() {
        ImportVocabulary vocabulary = vocabulary();

        assertThat(vocabulary.removedBy("Moved (No Transfer)")).isEqualTo("moved_no_transfer");
        assertThat(vocabulary.sequenceRole("Head of House")).isEqualTo("head_of_house");
        assertThat(vocabulary.participation("lapsed")).isEqualTo(ImportVocabulary.DEFAULT_PARTICIPATION);
    }
}
