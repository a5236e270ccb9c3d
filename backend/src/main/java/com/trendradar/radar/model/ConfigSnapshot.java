package com.trendradar.radar.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Complete shared configuration. Unset fields default to empty, and the mode to
 * {@link ReportMode#CURRENT}.
 */
public record ConfigSnapshot(
    List<KeywordGroup> keywordGroups,
    FilterSet filters,
    List<String> platforms,
    ReportMode reportMode
) {
    public static final ConfigSnapshot EMPTY = new ConfigSnapshot(List.of(), FilterSet.EMPTY, List.of(), ReportMode.CURRENT);

    public ConfigSnapshot {
        keywordGroups = keywordGroups == null ? List.of() : List.copyOf(keywordGroups);
        filters = filters == null ? FilterSet.EMPTY : filters;
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        if (platforms != null) {
            for (String platform : platforms) {
                if (platform != null && !platform.isBlank()) {
                    ids.add(platform.trim());
                }
            }
        }
        platforms = List.copyOf(ids);
        reportMode = reportMode == null ? ReportMode.CURRENT : reportMode;
    }
}
