package com.tariffwise.core.gate;

import com.tariffwise.core.model.ClassificationRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the stable thread key used by the loop breaker.
 * <p>
 * Reply and forward prefixes ({@code Re:}, {@code Fwd:}, {@code FW:}, {@code AW:}, {@code TR:},
 * also stacked) and machine-generated tracking tokens are removed, the rest is lower-cased and
 * whitespace-collapsed, then hashed with SHA-256 and truncated to 16 hex characters.
 */
public final class ThreadKeys {

    private static final Pattern REPLY_PREFIX =
            Pattern.compile("^\\s*((re|fwd?|aw|tr)\\s*(\\[\\d+])?\\s*:\\s*)+", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKETS = Pattern.compile("[\\[\\](){}]");
    private static final int KEY_LENGTH = 16;

    private final Pattern trackingToken;

    public ThreadKeys(String trackingTokenPattern) {
        this.trackingToken = Pattern.compile(trackingTokenPattern);
    }

    /** Thread key for the request, from its subject or else its reference id; null if neither is usable. */
    public String keyFor(ClassificationRequest request) {
        String normalized = normalizeSubject(request.subject());
        if (!normalized.isEmpty()) {
            return hash(normalized);
        }
        String referenceId = request.referenceId();
        if (referenceId != null && !referenceId.isBlank()) {
            return hash("ref:" + referenceId.strip());
        }
        return null;
    }

    public String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        String s = trackingToken.matcher(subject).replaceAll(" ");
        // reply counters such as "Re[2]:" need their brackets, so prefixes go first
        s = REPLY_PREFIX.matcher(s).replaceFirst("");
        s = BRACKETS.matcher(s).replaceAll(" ");
        s = REPLY_PREFIX.matcher(s).replaceFirst("");
        return s.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
