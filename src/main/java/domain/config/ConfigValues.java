package domain.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lenient parsing of configuration values. Blank or malformed input falls back to the default.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Locator strategy; accepts enum names and the variants {@code line}, {@code lines},
     * {@code depth}, {@code depth-tracked}.
     */
    public static LocatorStrategy parseLocator(String raw, LocatorStrategy def) {
        if (raw == null || raw.isBlank()) return def;
        String v = raw.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_');

        if (v.equals("LINE") || v.equals("LINES")) return LocatorStrategy.LINE_ANCHORED;
        if (v.equals("DEPTH") || v.equals("TRACKED")) return LocatorStrategy.DEPTH_TRACKED;
        try {
            return LocatorStrategy.valueOf(v);
        } catch (IllegalArgumentException ignore) {
            return def;
        }
    }

    /** Comma or whitespace separated list, upper-cased, blanks removed. */
    public static List<String> parseWordList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split("[,\\s]+")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t.toUpperCase(Locale.ROOT));
        }
        return out;
    }
}
