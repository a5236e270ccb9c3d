package com.trendradar.radar.match;

import com.trendradar.radar.model.FilterSet;
import com.trendradar.radar.model.KeywordGroup;
import com.trendradar.radar.model.MatchedItem;
import com.trendradar.radar.model.RawItem;
import com.trendradar.radar.util.TitleNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Substring matcher over NFKC-folded, lower-cased item titles. Filters are checked before
 * groups and always win; the first group in declaration order that matches labels the item.
 */
@Component
public class KeywordMatcher {

    public List<MatchedItem> match(List<RawItem> items, List<KeywordGroup> groups, FilterSet filters) {
        if (items == null || items.isEmpty() || groups == null || groups.isEmpty()) {
            return List.of();
        }
        List<String> filterTerms = lowerAll(filters == null ? List.of() : filters.terms());
        List<CompiledGroup> compiled = new ArrayList<>(groups.size());
        for (KeywordGroup group : groups) {
            compiled.add(compile(group));
        }

        List<MatchedItem> out = new ArrayList<>();
        for (RawItem item : items) {
            if (item == null || item.title() == null || item.title().isBlank()) {
                continue;
            }
            String title = TitleNormalizer.fold(item.title());
            if (containsAny(title, filterTerms)) {
                continue;
            }
            for (CompiledGroup group : compiled) {
                if (containsAny(title, group.terms())) {
                    out.add(new MatchedItem(item, group.label()));
                    break;
                }
            }
        }
        return out;
    }

    private CompiledGroup compile(KeywordGroup group) {
        List<String> terms = new ArrayList<>(lowerAll(group.terms()));
        if (group.expansionEnabled()) {
            terms.addAll(lowerAll(group.expansions()));
        }
        return new CompiledGroup(group.label(), terms);
    }

    private static boolean containsAny(String title, List<String> terms) {
        for (String term : terms) {
            if (title.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerAll(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(TitleNormalizer.fold(value));
            }
        }
        return out;
    }

    private record CompiledGroup(String label, List<String> terms) {}
}
