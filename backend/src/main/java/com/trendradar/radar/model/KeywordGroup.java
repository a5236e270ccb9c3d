package com.trendradar.radar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A labelled set of terms. A title satisfies the group when it contains any term, or any
 * expansion term while expansion is enabled.
 */
public record KeywordGroup(
    String label,
    List<String> terms,
    List<String> expansions,
    boolean expansionEnabled
) {
    public KeywordGroup {
        terms = cleanTerms(terms);
        expansions = cleanTerms(expansions);
        if (label == null || label.isBlank()) {
            label = terms.isEmpty() ? "" : terms.get(0);
        } else {
            label = label.trim();
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public static KeywordGroup fromJson(
        @JsonProperty("label") String label,
        @JsonProperty("terms") List<String> terms,
        @JsonProperty("expansions") List<String> expansions,
        @JsonProperty("expansionEnabled") Boolean expansionEnabled
    ) {
        List<String> safeTerms = terms;
        if ((safeTerms == null || safeTerms.isEmpty()) && label != null && !label.isBlank()) {
            safeTerms = List.of(label);
        }
        return new KeywordGroup(label, safeTerms, expansions, expansionEnabled == null || expansionEnabled);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static KeywordGroup of(String keyword) {
        return new KeywordGroup(keyword, keyword == null ? List.of() : List.of(keyword), List.of(), true);
    }

    public KeywordGroup withExpansions(List<String> extra, boolean enabled) {
        List<String> merged = new ArrayList<>(expansions);
        if (extra != null) {
            merged.addAll(extra);
        }
        return new KeywordGroup(label, terms, merged, enabled);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return terms.isEmpty();
    }

    private static List<String> cleanTerms(List<String> values) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }
}
