package com.trendradar.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RadarPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        RadarProperties properties = new RadarProperties();
        properties.getFetch().setUserAgent("   ");
        assertTrue(properties.getFetch().getUserAgent().startsWith("trend-radar/0.1"));
    }

    @Test
    void fetchAndRetentionSettingsAreClamped() {
        RadarProperties properties = new RadarProperties();
        properties.getFetch().setConcurrency(0);
        properties.getFetch().setRounds(-1);
        properties.getFetch().setRoundIntervalMs(-50);
        properties.getHistory().setRetainRuns(0);
        properties.getTasks().setExecutionRetention(0);
        assertEquals(1, properties.getFetch().getConcurrency());
        assertEquals(1, properties.getFetch().getRounds());
        assertEquals(0, properties.getFetch().getRoundIntervalMs());
        assertEquals(1, properties.getHistory().getRetainRuns());
        assertEquals(1, properties.getTasks().getExecutionRetention());
    }

    @Test
    void platformIdsSkipBlankEntries() {
        RadarProperties properties = new RadarProperties();
        properties.setPlatforms(List.of(
            new RadarProperties.PlatformSource(" weibo ", "微博"),
            new RadarProperties.PlatformSource("  ", "blank")
        ));
        assertEquals(List.of("weibo"), properties.platformIds());
    }
}
