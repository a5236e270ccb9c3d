package com.trendradar.radar.util;

import com.trendradar.radar.model.RecordIdentity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TitleNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleNormalizer() {
    }

    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        return WHITESPACE.matcher(fold(title).strip()).replaceAll(" ");
    }

    /**
     * NFKC compatibility fold plus lower-casing, so full-width and half-width forms compare equal.
     */
    public static String fold(String value) {
        return Normalizer.normalize(value, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    }

    public static RecordIdentity identityOf(String platform, String title) {
        String safePlatform = platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
        return new RecordIdentity(safePlatform, normalize(title));
    }
}
