package com.trendradar.radar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashSet;
import java.util.List;

public record FilterSet(List<String> terms) {
    public static final FilterSet EMPTY = new FilterSet(List.of());

    public FilterSet {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    out.add(term.trim());
                }
            }
        }
        terms = List.copyOf(out);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FilterSet of(List<String> terms) {
        return new FilterSet(terms);
    }

    @JsonValue
    public List<String> terms() {
        return terms;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
