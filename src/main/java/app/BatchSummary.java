package app;

import domain.analysis.ModelLineage;
import domain.model.LineageWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Totals of a batch run plus the per-model results, lineages and collected warnings.
 */
public final class BatchSummary {

    private final List<ModelRunResult> results;
    private final List<ModelLineage> lineages;
    private final List<LineageWarning> warnings;
    private final boolean stoppedEarly;
    private final long elapsedMs;

    public BatchSummary(List<ModelRunResult> results,
                        List<ModelLineage> lineages,
                        List<LineageWarning> warnings,
                        boolean stoppedEarly,
                        long elapsedMs) {
        this.results = copy(results);
        this.lineages = copy(lineages);
        this.warnings = copy(warnings);
        this.stoppedEarly = stoppedEarly;
        this.elapsedMs = elapsedMs;
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public List<ModelRunResult> getResults() {
        return results;
    }

    public List<ModelLineage> getLineages() {
        return lineages;
    }

    public List<LineageWarning> getWarnings() {
        return warnings;
    }

    /** True when fail-fast stopped the run before every model was processed. */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public int successCount() {
        int n = 0;
        for (ModelRunResult r : results) {
            if (r.isSuccess()) n++;
        }
        return n;
    }

    public int skipCount() {
        return results.size() - successCount();
    }

    public int columnCount() {
        int n = 0;
        for (ModelLineage l : lineages) n += l.getColumns().size();
        return n;
    }

    public int conditionalCount() {
        int n = 0;
        for (ModelLineage l : lineages) n += l.getExtraction().conditionalCount();
        return n;
    }

    public int decomposedCaseCount() {
        int n = 0;
        for (ModelLineage l : lineages) n += l.getExtraction().decomposedCaseCount();
        return n;
    }

    public int skippedExpressionCount() {
        int n = 0;
        for (ModelLineage l : lineages) n += l.getExtraction().getSkippedExpressions();
        return n;
    }
}
