package com.studioflow.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the mutable {@code computed} JSON document of a job.
 *
 * Writers never replace the document; they merge a patch into it:
 * <ul>
 *   <li>a {@code null} patch value stores null,</li>
 *   <li>an empty-object patch value replaces the key with an empty object
 *       (this is how a stale pointer such as {@code candidates.audio} is cleared),</li>
 *   <li>a non-empty object merges recursively,</li>
 *   <li>anything else overwrites.</li>
 * </ul>
 * Inputs are never modified; every merge returns a fresh tree.
 */
public final class ComputedDocument {

    private ComputedDocument() {}

    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> result = copy(base);
        if (patch == null) return result;
        for (Map.Entry<String, Object> e : patch.entrySet()) {
            String key   = e.getKey();
            Object value = e.getValue();
            if (value == null) {
                result.put(key, null);
            } else if (value instanceof Map<?, ?> patchMap) {
                if (patchMap.isEmpty()) {
                    result.put(key, new LinkedHashMap<String, Object>());
                } else {
                    Map<String, Object> existing = asMap(result.get(key));
                    result.put(key, deepMerge(existing, asMap(patchMap)));
                }
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Typed reads
    // ------------------------------------------------------------------

    /** Nested object at the given path, or an empty map. */
    public static Map<String, Object> map(Map<String, Object> doc, String... path) {
        Object node = doc;
        for (String key : path) {
            if (!(node instanceof Map<?, ?> m)) return Map.of();
            node = m.get(key);
        }
        return node instanceof Map<?, ?> ? asMap(node) : Map.of();
    }

    public static String string(Map<String, Object> doc, String key) {
        Object v = doc == null ? null : doc.get(key);
        if (v == null) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    public static int integer(Map<String, Object> doc, String key, int fallback) {
        Object v = doc == null ? null : doc.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    /** Finite numeric value, or {@code fallback} when missing, unparseable, NaN or infinite. */
    public static double decimal(Map<String, Object> doc, String key, double fallback) {
        Object v = doc == null ? null : doc.get(key);
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        return Double.isFinite(d) ? d : fallback;
    }

    public static boolean flag(Map<String, Object> doc, String key) {
        Object v = doc == null ? null : doc.get(key);
        if (v instanceof Boolean b) return b;
        return v != null && "true".equalsIgnoreCase(v.toString());
    }

    /** Non-blank strings of a JSON array; a bare string counts as a one-element list. */
    public static List<String> strings(Map<String, Object> doc, String key) {
        Object v = doc == null ? null : doc.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) out.add(item.toString().trim());
            }
        } else if (v instanceof String s && !s.isBlank()) {
            out.add(s.trim());
        }
        return Collections.unmodifiableList(out);
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (source == null) return out;
        for (Map.Entry<String, Object> e : source.entrySet()) {
            Object v = e.getValue();
            out.put(e.getKey(), v instanceof Map<?, ?> m ? copy(asMap(m)) : v);
        }
        return out;
    }
}
