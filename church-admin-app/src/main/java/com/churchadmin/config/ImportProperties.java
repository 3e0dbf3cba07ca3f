package com.churchadmin.config;

import com.churchadmin.importer.HeadOfHouseholdStrategy;
import com.churchadmin.importer.ImportVocabulary;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Alias tables and enum vocabularies used by the CSV importers.
 * Override in application.yml under 'churchadmin.import'; the defaults below are the historical tables.
 */
@Configuration
@ConfigurationProperties(prefix = "churchadmin.import")
public class ImportProperties {

    private String vocabularyVersion = "2024.1";
    private HeadOfHouseholdStrategy headOfHouseholdPolicy = HeadOfHouseholdStrategy.SEQUENCE;
    private long maxFileBytes = 10L * 1024 * 1024;

    private List<CategoryAlias> categoryAliases = new ArrayList<>(List.of(
        new CategoryAlias("current", "Current"),
        new CategoryAlias("general fund", "Current"),
        new CategoryAlias("generalfund", "Current"),
        new CategoryAlias("amount", "Current"),
        new CategoryAlias("mission", "Mission"),
        new CategoryAlias("district synod", "Mission"),
        new CategoryAlias("districtsynod", "Mission"),
        new CategoryAlias("memorials", "Memorials"),
        new CategoryAlias("debt", "Debt"),
        new CategoryAlias("school", "School"),
        new CategoryAlias("miscellaneous", "Miscellaneous")
    ));

    private List<String> participationStatuses = new ArrayList<>(List.of(
        "active", "deceased", "homebound", "military", "inactive", "school"));
    private List<String> sequenceRoles = new ArrayList<>(List.of(
        "head_of_house", "spouse", "child"));
    private List<String> receivedByReasons = new ArrayList<>(List.of(
        "adult_confirmation", "affirmation_of_faith", "baptism", "junior_confirmation",
        "transfer", "with_parents", "other_denomination", "unknown"));
    private List<String> removedByReasons = new ArrayList<>(List.of(
        "death", "excommunication", "inactivity", "moved_no_transfer", "released",
        "removed_by_request", "transfer", "other"));
    private List<String> householdTypes = new ArrayList<>(List.of("family", "single", "other"));
    private List<String> sexes = new ArrayList<>(List.of("male", "female", "other"));

    public ImportVocabulary toVocabulary() {
        List<ImportVocabulary.Alias> aliases = categoryAliases.stream()
            .map(a -> new ImportVocabulary.Alias(a.getHeader(), a.getCategory()))
            .toList();
        return new ImportVocabulary(
            vocabularyVersion, aliases,
            participationStatuses, sequenceRoles, receivedByReasons, removedByReasons,
            householdTypes, sexes
        );
    }

    public String getVocabularyVersion() { return vocabularyVersion; }
    public void setVocabularyVersion(String vocabularyVersion) { this.vocabularyVersion = vocabularyVersion; }

    public HeadOfHouseholdStrategy getHeadOfHouseholdPolicy() { return headOfHouseholdPolicy; }
    public void setHeadOfHouseholdPolicy(HeadOfHouseholdStrategy headOfHouseholdPolicy) { this.headOfHouseholdPolicy = headOfHouseholdPolicy; }

    public long getMaxFileBytes() { return maxFileBytes; }
    public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }

    public List<CategoryAlias> getCategoryAliases() { return categoryAliases; }
    public void setCategoryAliases(List<CategoryAlias> categoryAliases) { this.categoryAliases = categoryAliases; }

    public List<String> getParticipationStatuses() { return participationStatuses; }
    public void setParticipationStatuses(List<String> participationStatuses) { this.participationStatuses = participationStatuses; }

    public List<String> getSequenceRoles() { return sequenceRoles; }
    public void setSequenceRoles(List<String> sequenceRoles) { this.sequenceRoles = sequenceRoles; }

    public List<String> getReceivedByReasons() { return receivedByReasons; }
    public void setReceivedByReasons(List<String> receivedByReasons) { this.receivedByReasons = receivedByReasons; }

    public List<String> getRemovedByReasons() { return removedByReasons; }
    public void setRemovedByReasons(List<String> removedByReasons) { this.removedByReasons = removedByReasons; }

    public List<String> getHouseholdTypes() { return householdTypes; }
    public void setHouseholdTypes(List<String> householdTypes) { this.householdTypes = householdTypes; }

    public List<String> getSexes() { return sexes; }
    public void setSexes(List<String> sexes) { this.sexes = sexes; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class CategoryAlias {
        private String header;
        private String category;

        public CategoryAlias() {
        }

        public CategoryAlias(String header, String category) {
            this.header = header;
            this.category = category;
        }

        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
    }
}
