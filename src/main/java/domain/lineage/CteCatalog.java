package domain.lineage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CTE names of a model ({@code <name> as (}) in source order, plus terminal CTE detection.
 */
public final class CteCatalog {

    private static final Pattern CTE_HEAD =
            Pattern.compile("(?i)(?<![A-Za-z0-9_.])([A-Za-z_][A-Za-z0-9_]*)\\s+as\\s*\\(");

    /** {@code cast(x as (...))} style matches and statement keywords are not CTE names. */
    private static final Set<String> EXCLUDED = Set.of(
            "WITH", "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "ON", "JOIN", "CAST", "TRY_CAST"
    );

    private CteCatalog() {
    }

    public static List<String> cteNames(String sql) {
        if (sql == null || sql.isEmpty()) return List.of();

        String masked = SqlText.maskLiteralsAndComments(sql);
        Matcher m = CTE_HEAD.matcher(masked);

        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        while (m.find()) {
            String name = m.group(1);
            if (EXCLUDED.contains(name.toUpperCase(Locale.ROOT))) continue;
            if (!DepthTracker.isTopLevel(masked, m.start())) continue;
            if (seen.add(name.toLowerCase(Locale.ROOT))) out.add(name);
        }
        return Collections.unmodifiableList(out);
    }

    /** Name in the last top-level {@code select * from <name>}, or null when the model has none. */
    public static String detectTerminalCte(String sql) {
        return TerminalCteFinder.detectTerminalName(sql);
    }
}
