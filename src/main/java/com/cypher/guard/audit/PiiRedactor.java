package com.cypher.guard.audit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Replaces personal data in audit content with fixed placeholders.
 *
 * <p>Card, SSN and IPv4 patterns run before the phone patterns, which would otherwise consume
 * parts of them. Applying {@link #redact(String)} to already-redacted text is a no-op.</p>
 */
public final class PiiRedactor {

    public static final String EMAIL = "[EMAIL_REDACTED]";
    public static final String PHONE = "[PHONE_REDACTED]";
    public static final String CARD = "[CARD_REDACTED]";
    public static final String SSN = "[SSN_REDACTED]";
    public static final String IP = "[IP_REDACTED]";

    private static final String OCTET = "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

    private record Replacement(Pattern pattern, String placeholder) {
    }

    private static final List<Replacement> REPLACEMENTS = List.of(
            new Replacement(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), EMAIL),
            new Replacement(Pattern.compile("\\b\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b"), CARD),
            new Replacement(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), SSN),
            new Replacement(Pattern.compile("(?<![\\d.])(?:" + OCTET + "\\.){3}" + OCTET + "(?!\\d|\\.\\d)"), IP),
            new Replacement(Pattern.compile("(?<![\\w+])\\+\\d{1,3}[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,9}\\b"), PHONE),
            new Replacement(Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"), PHONE));

    private PiiRedactor() {
        // utility class
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Replacement replacement : REPLACEMENTS) {
            result = replacement.pattern().matcher(result).replaceAll(replacement.placeholder());
        }
        return result;
    }

    /**
     * Redacts strings nested anywhere in maps, collections and arrays. Keys are kept as is;
     * other values pass through unchanged.
     */
    public static Object redactValue(Object value) {
        if (value instanceof String s) {
            return redact(s);
        }
        if (value instanceof Map<?, ?> map) {
            return redactMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> redactMap(Map<?, ?> map) {
        if (map == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), redactValue(v)));
        return copy;
    }
}
