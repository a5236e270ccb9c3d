package com.trendradar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "radar")
public class RadarProperties {
    private static final String DEFAULT_USER_AGENT = "trend-radar/0.1 (+contact)";

    private Fetch fetch = new Fetch();
    private SharedConfig config = new SharedConfig();
    private History history = new History();
    private Tasks tasks = new Tasks();
    private Output output = new Output();
    private Expansion expansion = new Expansion();
    private List<PlatformSource> platforms = new ArrayList<>();

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public SharedConfig getConfig() {
        return config;
    }

    public void setConfig(SharedConfig config) {
        this.config = config;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Tasks getTasks() {
        return tasks;
    }

    public void setTasks(Tasks tasks) {
        this.tasks = tasks;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Expansion getExpansion() {
        return expansion;
    }

    public void setExpansion(Expansion expansion) {
        this.expansion = expansion;
    }

    public List<PlatformSource> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(List<PlatformSource> platforms) {
        this.platforms = platforms == null ? new ArrayList<>() : platforms;
    }

    public List<String> platformIds() {
        List<String> ids = new ArrayList<>();
        for (PlatformSource source : platforms) {
            if (source.getId() != null && !source.getId().isBlank()) {
                ids.add(source.getId().trim());
            }
        }
        return ids;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Fetch {
        private String baseUrl = "https://newsnow.busiyi.world";
        private String userAgent;
        private int concurrency = 4;
        private int timeoutSeconds = 15;
        private int rounds = 1;
        private long roundIntervalMs = 0;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getRounds() {
            return Math.max(1, rounds);
        }

        public void setRounds(int rounds) {
            this.rounds = Math.max(1, rounds);
        }

        public long getRoundIntervalMs() {
            return Math.max(0, roundIntervalMs);
        }

        public void setRoundIntervalMs(long roundIntervalMs) {
            this.roundIntervalMs = Math.max(0, roundIntervalMs);
        }
    }

    public static class SharedConfig {
        private String path = "config/radar-config.json";
        private boolean restoreStaleOverrideOnStartup = false;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isRestoreStaleOverrideOnStartup() {
            return restoreStaleOverrideOnStartup;
        }

        public void setRestoreStaleOverrideOnStartup(boolean restoreStaleOverrideOnStartup) {
            this.restoreStaleOverrideOnStartup = restoreStaleOverrideOnStartup;
        }
    }

    public static class History {
        private int retainRuns = 30;

        public int getRetainRuns() {
            return Math.max(1, retainRuns);
        }

        public void setRetainRuns(int retainRuns) {
            this.retainRuns = Math.max(1, retainRuns);
        }
    }

    public static class Tasks {
        private int executionRetention = 20;
        private int defaultExecutionLimit = 10;

        public int getExecutionRetention() {
            return Math.max(1, executionRetention);
        }

        public void setExecutionRetention(int executionRetention) {
            this.executionRetention = Math.max(1, executionRetention);
        }

        public int getDefaultExecutionLimit() {
            return Math.max(1, defaultExecutionLimit);
        }

        public void setDefaultExecutionLimit(int defaultExecutionLimit) {
            this.defaultExecutionLimit = Math.max(1, defaultExecutionLimit);
        }
    }

    public static class Output {
        private String dir = "output/reports";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Expansion {
        private Map<String, List<String>> synonyms = new LinkedHashMap<>();

        public Map<String, List<String>> getSynonyms() {
            return synonyms;
        }

        public void setSynonyms(Map<String, List<String>> synonyms) {
            this.synonyms = synonyms == null ? new LinkedHashMap<>() : synonyms;
        }
    }

    public static class PlatformSource {
        private String id;
        private String name;

        public PlatformSource() {
        }

        public PlatformSource(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
