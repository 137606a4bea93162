package domain.lineage;

import domain.model.UpstreamSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{ ref('model') }}} and {@code {{ source('schema', 'table') }}} calls of a model, in first
 * appearance order without duplicates. The two-argument form {@code ref('package', 'model')} keeps the
 * model name.
 */
public final class DbtReferenceExtractor {

    private static final String ARG = "\\s*['\"]([^'\"]+)['\"]\\s*";

    private static final Pattern CALL = Pattern.compile(
            "(?i)\\b(ref|source)\\s*\\(" + ARG + "(?:," + ARG + ")?\\)");

    private DbtReferenceExtractor() {
    }

    public static List<UpstreamSource> extract(String sql) {
        if (sql == null || sql.isEmpty()) return List.of();

        String text = SqlText.stripComments(sql);
        Matcher m = CALL.matcher(text);
        Set<UpstreamSource> seen = new LinkedHashSet<>();

        while (m.find()) {
            String fn = m.group(1);
            String first = m.group(2).trim();
            String second = m.group(3) == null ? null : m.group(3).trim();

            if ("source".equalsIgnoreCase(fn)) {
                if (second == null) continue;
                seen.add(UpstreamSource.source(first, second));
            } else {
                seen.add(UpstreamSource.ref(second == null ? first : second));
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(seen));
    }
}
