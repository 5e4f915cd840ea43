package com.civicintake.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs credentials out of structured log and audit data.
 * <p>
 * Two rules apply. A value is replaced when its key contains one of the sensitive fragments
 * (password, token, secret, authorization, cookie, apikey, credential), compared
 * case-insensitively. Independently of its key, a string value that looks like a compact JWT
 * or a {@code Bearer} header is replaced as well, because callers put request details in
 * free-form metadata. Nested maps are redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** Replacement for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "cookie", "apikey", "credential"
    );

    private static final Pattern JWT_VALUE =
            Pattern.compile("^[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]*$");

    private static final Pattern BEARER_VALUE = Pattern.compile("^(?i)bearer\\s+\\S+");

    private final Set<String> sensitiveFragments;
    private final Pattern keyPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_FRAGMENTS);
    }

    /**
     * @param fragments key fragments to treat as sensitive, matched case-insensitively
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.sensitiveFragments = Set.copyOf(fragments);
        this.keyPattern = Pattern.compile(
                String.join("|", sensitiveFragments.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a redacted copy of {@code data}, preserving iteration order. Null or empty input
     * yields an empty immutable map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            result.put(entry.getKey(), redactEntry(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    /**
     * Whether the given key names a sensitive field.
     */
    public boolean isSensitiveKey(String key) {
        return key != null && keyPattern.matcher(key).find();
    }

    /**
     * Whether the given value looks like a credential regardless of its key.
     */
    public boolean looksLikeCredential(Object value) {
        if (!(value instanceof String s)) {
            return false;
        }
        String trimmed = s.strip();
        return JWT_VALUE.matcher(trimmed).matches() || BEARER_VALUE.matcher(trimmed).find();
    }

    public Set<String> sensitiveFragments() {
        return sensitiveFragments;
    }

    @SuppressWarnings("unchecked")
    private Object redactEntry(String key, Object value) {
        if (isSensitiveKey(key) || looksLikeCredential(value)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        return value;
    }
}
