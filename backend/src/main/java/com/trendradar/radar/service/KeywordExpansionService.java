package com.trendradar.radar.service;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.KeywordGroup;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adds configured synonyms to keyword groups. Lookup is by group label, case-insensitive.
 */
@Service
public class KeywordExpansionService {
    private final RadarProperties properties;

    public KeywordExpansionService(RadarProperties properties) {
        this.properties = properties;
    }

    public List<KeywordGroup> expand(List<KeywordGroup> groups, boolean enabled) {
        List<KeywordGroup> out = new ArrayList<>(groups.size());
        for (KeywordGroup group : groups) {
            out.add(group.withExpansions(enabled ? synonymsFor(group.label()) : List.of(), enabled));
        }
        return out;
    }

    private List<String> synonymsFor(String label) {
        Map<String, List<String>> synonyms = properties.getExpansion().getSynonyms();
        List<String> exact = synonyms.get(label);
        if (exact != null) {
            return exact;
        }
        String lowered = label.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(lowered)) {
                return entry.getValue();
            }
        }
        return List.of();
    }
}
