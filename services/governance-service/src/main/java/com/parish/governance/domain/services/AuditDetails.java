package com.parish.governance.domain.services;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered, null-tolerant detail maps for audit entries.
 */
final class AuditDetails {

    private AuditDetails() {
        // utility class
    }

    /**
     * @param keyValues alternating keys and values
     */
    static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }
}
