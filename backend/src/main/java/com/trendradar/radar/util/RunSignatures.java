package com.trendradar.radar.util;

import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.model.KeywordGroup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Fingerprints the matching-relevant part of a configuration. The report mode is left out so
 * that switching modes keeps the same incremental history.
 */
public final class RunSignatures {
    private RunSignatures() {
    }

    public static String of(ConfigSnapshot config) {
        StringBuilder canonical = new StringBuilder();
        for (KeywordGroup group : config.keywordGroups()) {
            canonical.append("g:").append(group.label())
                .append('|').append(String.join("\u001f", group.terms()))
                .append('|').append(group.expansionEnabled() ? String.join("\u001f", group.expansions()) : "")
                .append('\n');
        }
        canonical.append("f:").append(String.join("\u001f", config.filters().terms())).append('\n');
        canonical.append("p:").append(String.join("\u001f", config.platforms())).append('\n');
        return sha256Hex(canonical.toString());
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
