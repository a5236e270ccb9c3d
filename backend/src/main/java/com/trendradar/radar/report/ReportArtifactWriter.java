package com.trendradar.radar.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a run result as a JSON report under {@code <output dir>/<yyyy-MM-dd>/}.
 */
@Component
public class ReportArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportArtifactWriter.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss-SSS");

    private final Path outputDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ReportArtifactWriter(RadarProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getOutput().getDir()), objectMapper, Clock.systemDefaultZone());
    }

    ReportArtifactWriter(Path outputDir, ObjectMapper objectMapper, Clock clock) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * @return path of the artifact relative to the output directory, with forward slashes
     */
    public String write(RunResult result, String label) {
        LocalDateTime now = LocalDateTime.now(clock);
        String day = DAY.format(now);
        String baseName = sanitize(label) + "-" + result.reportMode().code() + "-" + TIME.format(now);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("generatedAt", clock.instant());
        document.put("reportMode", result.reportMode());
        document.put("signature", result.signature());
        document.put("degraded", result.degraded());
        document.put("durationMs", result.durationMs());
        document.put("stats", result.stats());
        document.put("records", result.records());
        Path target;
        try {
            target = reserve(outputDir.resolve(day), baseName);
            objectMapper.writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report artifact " + baseName + " under " + day, e);
        }
        log.info("Wrote report artifact {} with {} records", target, result.records().size());
        return day + "/" + target.getFileName();
    }

    // searches run outside the execution lock, so two writers can share a timestamp
    private static Path reserve(Path dayDir, String baseName) throws IOException {
        Files.createDirectories(dayDir);
        for (int attempt = 0; ; attempt++) {
            String fileName = attempt == 0 ? baseName + ".json" : baseName + "-" + attempt + ".json";
            try {
                return Files.createFile(dayDir.resolve(fileName));
            } catch (FileAlreadyExistsException e) {
                log.debug("Report artifact {} already exists; trying next suffix", fileName);
            }
        }
    }

    static String sanitize(String label) {
        if (label == null || label.isBlank()) {
            return "search";
        }
        String cleaned = label.trim().replaceAll("[^A-Za-z0-9_-]+", "_");
        return cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '_') ? "search" : cleaned;
    }
}
