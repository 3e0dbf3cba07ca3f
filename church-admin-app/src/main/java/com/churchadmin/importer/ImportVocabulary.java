package com.churchadmin.importer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable alias tables and enum vocabularies handed to the importers. Built once from configuration,
 * so adding a historical header alias or a new enum value never touches resolver code.
 */
public record ImportVocabulary(
    String version,
    List<Alias> categoryAliases,
    List<String> participationStatuses,
    List<String> sequenceRoles,
    List<String> receivedByReasons,
    List<String> removedByReasons,
    List<String> householdTypes,
    List<String> sexes,
    Map<String, String> headerAliases
) {
    public static final String DEFAULT_PARTICIPATION = "active";
    public static final String DEFAULT_HOUSEHOLD_TYPE = "single";

    private static final Pattern ENUM_SEPARATORS = Pattern.compile("[\\s\\-]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    public ImportVocabulary {
        categoryAliases = List.copyOf(categoryAliases);
        participationStatuses = List.copyOf(participationStatuses);
        sequenceRoles = List.copyOf(sequenceRoles);
        receivedByReasons = List.copyOf(receivedByReasons);
        removedByReasons = List.copyOf(removedByReasons);
        householdTypes = List.copyOf(householdTypes);
        sexes = List.copyOf(sexes);
        headerAliases = Map.copyOf(headerAliases);
    }

    public ImportVocabulary(String version, List<Alias> categoryAliases, List<String> participationStatuses,
                            List<String> sequenceRoles, List<String> receivedByReasons,
                            List<String> removedByReasons, List<String> householdTypes, List<String> sexes) {
        this(version, categoryAliases, participationStatuses, sequenceRoles, receivedByReasons,
            removedByReasons, householdTypes, sexes, aliasTable(categoryAliases));
    }

    /**
     * A historical header spelling and the canonical category name it stands for.
     */
    public record Alias(String header, String category) {}

    /**
     * Canonical category name for a header, matched on its normalized or compact form.
     */
    public Optional<String> categoryForHeader(String header) {
        String normalized = HeaderIndex.normalize(header);
        String compact = HeaderIndex.compact(normalized);
        String category = headerAliases.get(normalized);
        if (category == null) {
            category = headerAliases.get(compact);
        }
        return Optional.ofNullable(category);
    }

    /**
     * Normalized and compact header spellings mapped to category names; the first alias listed wins.
     */
    private static Map<String, String> aliasTable(List<Alias> categoryAliases) {
        Map<String, String> table = new LinkedHashMap<>();
        for (Alias alias : categoryAliases) {
            if (alias.header() == null || alias.category() == null) continue;
            String normalized = HeaderIndex.normalize(alias.header());
            table.putIfAbsent(normalized, alias.category());
            table.putIfAbsent(HeaderIndex.compact(normalized), alias.category());
        }
        return table;
    }

    public String participation(String raw) {
        String value = match(participationStatuses, raw);
        return value != null ? value : DEFAULT_PARTICIPATION;
    }

    public String householdType(String raw) {
        String value = match(householdTypes, raw);
        return value != null ? value : DEFAULT_HOUSEHOLD_TYPE;
    }

    public String sequenceRole(String raw) {
        return match(sequenceRoles, raw);
    }

    public String receivedBy(String raw) {
        return match(receivedByReasons, raw);
    }

    public String removedBy(String raw) {
        return match(removedByReasons, raw);
    }

    public String sex(String raw) {
        return match(sexes, raw);
    }

    /**
     * Normalizes free-form spreadsheet values such as "Head of House" or "Moved (No Transfer)" to
     * their enum spelling, returning null when the result is not in {@code allowed}.
     */
    static String match(List<String> allowed, String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim().toLowerCase().replace("(", " ").replace(")", " ").trim();
        value = ENUM_SEPARATORS.matcher(value).replaceAll("_");
        value = REPEATED_UNDERSCORES.matcher(value).replaceAll("_");
        return allowed.contains(value) ? value : null;
    }
}
