package com.trendradar.radar.isolation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.ConfigSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file holding the live configuration, with a sibling {@code .backup} journal while an
 * override is active.
 */
@Component
public class FileSharedConfigResource implements SharedConfigResource {
    private final Path path;
    private final Path journalPath;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSharedConfigResource(RadarProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getConfig().getPath()), objectMapper);
    }

    public FileSharedConfigResource(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath().normalize();
        this.journalPath = this.path.resolveSibling(this.path.getFileName() + ".backup");
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ConfigSnapshot read() throws IOException {
        if (!Files.exists(path)) {
            return ConfigSnapshot.EMPTY;
        }
        return parse(path);
    }

    @Override
    public void write(ConfigSnapshot snapshot) throws IOException {
        writeAtomically(path, snapshot == null ? ConfigSnapshot.EMPTY : snapshot);
    }

    @Override
    public void journalBackup(ConfigSnapshot backup) throws IOException {
        writeAtomically(journalPath, backup == null ? ConfigSnapshot.EMPTY : backup);
    }

    @Override
    public void clearJournal() throws IOException {
        Files.deleteIfExists(journalPath);
    }

    @Override
    public Optional<ConfigSnapshot> readJournal() throws IOException {
        if (!Files.exists(journalPath)) {
            return Optional.empty();
        }
        return Optional.of(parse(journalPath));
    }

    @Override
    public String describe() {
        return path.toString();
    }

    private ConfigSnapshot parse(Path file) throws IOException {
        try {
            ConfigSnapshot snapshot = objectMapper.readValue(Files.readAllBytes(file), ConfigSnapshot.class);
            return snapshot == null ? ConfigSnapshot.EMPTY : snapshot;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed configuration file " + file, e);
        }
    }

    private void writeAtomically(Path target, ConfigSnapshot snapshot) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(snapshot));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
