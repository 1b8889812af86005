package com.parish.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive entries from structured data before it is logged or written to the
 * audit trail.
 * <p>
 * A key is sensitive when its name contains one of the configured patterns, compared
 * case-insensitively. Nested maps and lists of maps are redacted recursively, since audit
 * details usually carry {@code before}/{@code after} snapshots.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "credential", "signature"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive key patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive key patterns (case-insensitive).
     *
     * @param patterns key name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}. Insertion
     * order is preserved and keys are converted to strings. Null input returns an empty map.
     *
     * @param data structured data keyed by field name
     * @return a redacted copy
     */
    public Map<String, Object> redact(Map<?, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, redactValue(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Checks whether a key name matches any sensitive pattern.
     *
     * @param fieldName the key to check
     * @return true if the key contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::redactValue).toList();
        }
        return value;
    }
}
