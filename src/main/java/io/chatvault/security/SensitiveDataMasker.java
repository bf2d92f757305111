package io.chatvault.security;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks values that must never reach the audit trail or log output: credentials, key
 * material and message content.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "key", "salt", "hash", "content", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (input == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            out.put(entry.getKey(), isSensitiveKey(entry.getKey()) ? MASK : maskedValue(entry.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return masked((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(SensitiveDataMasker::maskedValue).toList();
        }
        if (value instanceof byte[]) {
            return MASK;
        }
        return value;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
