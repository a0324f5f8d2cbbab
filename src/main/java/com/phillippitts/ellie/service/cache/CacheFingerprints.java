package com.phillippitts.ellie.service.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable cache keys derived from normalized request content.
 *
 * <p>Normalization lower-cases, collapses whitespace and drops trailing punctuation, so
 * "Hello!" and " hello " share an entry. Keys are hex SHA-256 digests with a kind prefix.
 */
public final class CacheFingerprints {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");

    private CacheFingerprints() {
    }

    /** Fingerprint of a generated reply for a user transcript. */
    public static String text(String transcript) {
        return "text:" + sha256(normalize(transcript));
    }

    /** Fingerprint of synthesized audio for a reply text and voice parameters. */
    public static String audio(String replyText, String voice, double speed) {
        String params = (voice == null ? "" : voice.toLowerCase(Locale.ROOT)) + '|' + String.format(Locale.ROOT, "%.2f", speed);
        return "audio:" + sha256(normalize(replyText) + '|' + params);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return TRAILING_PUNCTUATION.matcher(collapsed).replaceAll("");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
