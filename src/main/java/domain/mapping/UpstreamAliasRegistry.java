package domain.mapping;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * In-memory alias -> upstream table registry. Keys are matched case-insensitively; blank keys and
 * blank tables are not indexed.
 */
public final class UpstreamAliasRegistry implements UpstreamAliasLookup {

    // key = alias (UPPER)
    private final Map<String, String> byAlias = new LinkedHashMap<>();

    public UpstreamAliasRegistry() {
    }

    public UpstreamAliasRegistry(Map<String, String> mappings) {
        if (mappings == null) return;
        for (Map.Entry<String, String> e : mappings.entrySet()) {
            register(e.getKey(), e.getValue());
        }
    }

    /** Later registrations of the same alias win. */
    public UpstreamAliasRegistry register(String alias, String upstreamTable) {
        String key = upper(alias);
        String table = upstreamTable == null ? "" : upstreamTable.trim();
        if (key.isEmpty() || table.isEmpty()) return this;
        byAlias.put(key, table);
        return this;
    }

    @Override
    public String find(String qualifier) {
        String key = upper(qualifier);
        if (key.isEmpty()) return null;
        return byAlias.get(key);
    }

    public int size() {
        return byAlias.size();
    }

    private static String upper(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }
}
