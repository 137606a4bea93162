package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|model|column|message|detail); the same qualifier or stray keyword is
 * often hit several times in one model.</p>
 */
public final class ListLineageWarningSink implements LineageWarningSink {

    private final List<LineageWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListLineageWarningSink(List<LineageWarning> target) {
        this.target = target;
    }

    private static String key(LineageWarning w) {
        return w.getCode().name() + "|"
                + w.getModel() + "|"
                + w.getColumn() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(LineageWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
