package io.github.riemr.mobilepost.application.importing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One loosely typed input row. Field lookup ignores case and {@code _}, {@code -} or blank separators,
 * so {@code name_en}, {@code NAMEEN} and {@code nameEN} all address the same value.
 *
 * @param index  position in the source (CSV line number, 1-based item for JSON feeds)
 * @param fields raw values as read
 */
public record ImportRow(int index, Map<String, Object> fields) {

    public ImportRow {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null) {
                    normalized.putIfAbsent(normalizeKey(k), v);
                }
            });
        }
        fields = Collections.unmodifiableMap(normalized);
    }

    public Object get(String field) {
        return fields.get(normalizeKey(field));
    }

    static String normalizeKey(String key) {
        return key.replaceAll("[_\\-\\s]", "").toLowerCase(Locale.ROOT);
    }
}
