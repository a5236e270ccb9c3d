package com.trendradar.radar.service;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.model.FilterSet;
import com.trendradar.radar.model.KeywordGroup;
import com.trendradar.radar.model.ReportMode;
import com.trendradar.radar.model.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a run request into a complete configuration override, rejecting malformed requests
 * before any execution lock is taken.
 */
@Component
public class RunRequestValidator {
    private static final Logger log = LoggerFactory.getLogger(RunRequestValidator.class);

    private final RadarProperties properties;
    private final KeywordExpansionService expansionService;

    public RunRequestValidator(RadarProperties properties, KeywordExpansionService expansionService) {
        this.properties = properties;
        this.expansionService = expansionService;
    }

    public ConfigSnapshot toOverride(RunRequest request) {
        if (request == null) {
            throw new RunValidationException("request body is required");
        }
        List<KeywordGroup> groups = new ArrayList<>();
        if (request.keywords() != null) {
            for (KeywordGroup group : request.keywords()) {
                if (group != null && !group.isEmpty()) {
                    groups.add(group);
                }
            }
        }
        if (groups.isEmpty()) {
            throw new RunValidationException("keywords must not be empty");
        }

        ReportMode mode;
        try {
            mode = ReportMode.fromCode(request.reportMode());
        } catch (IllegalArgumentException e) {
            throw new RunValidationException("reportMode must be one of daily, current, incremental");
        }

        boolean expand = request.expandKeywords() == null || request.expandKeywords();
        return new ConfigSnapshot(
            expansionService.expand(groups, expand),
            FilterSet.of(request.filters()),
            resolvePlatforms(request.platforms()),
            mode == null ? ReportMode.CURRENT : mode
        );
    }

    List<String> resolvePlatforms(List<String> requested) {
        List<String> catalogue = properties.platformIds();
        Set<String> wanted = new LinkedHashSet<>();
        if (requested != null) {
            for (String id : requested) {
                if (id != null && !id.isBlank()) {
                    wanted.add(id.trim());
                }
            }
        }
        if (wanted.isEmpty()) {
            if (catalogue.isEmpty()) {
                throw new RunValidationException("platforms must not be empty when no platform catalogue is configured");
            }
            return catalogue;
        }
        if (catalogue.isEmpty()) {
            return new ArrayList<>(wanted);
        }
        List<String> resolved = new ArrayList<>();
        for (String id : wanted) {
            if (catalogue.contains(id)) {
                resolved.add(id);
            } else {
                log.warn("Ignoring unknown platform {}", id);
            }
        }
        if (resolved.isEmpty()) {
            throw new RunValidationException("none of the requested platforms is configured: " + wanted);
        }
        return resolved;
    }
}
