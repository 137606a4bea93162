package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Columns extracted from one model plus the warnings raised on the way.
 */
public final class ExtractionResult {

    private final List<ColumnMapping> columns;
    private final List<LineageWarning> warnings;
    private final int skippedExpressions;
    private final boolean structureFound;

    public ExtractionResult(List<ColumnMapping> columns,
                            List<LineageWarning> warnings,
                            int skippedExpressions,
                            boolean structureFound) {
        this.columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
        this.warnings = warnings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(warnings));
        this.skippedExpressions = Math.max(0, skippedExpressions);
        this.structureFound = structureFound;
    }

    public List<ColumnMapping> getColumns() {
        return columns;
    }

    public List<LineageWarning> getWarnings() {
        return warnings;
    }

    /** Projection items dropped because no alias could be resolved. */
    public int getSkippedExpressions() {
        return skippedExpressions;
    }

    public boolean isStructureFound() {
        return structureFound;
    }

    public int conditionalCount() {
        int n = 0;
        for (ColumnMapping c : columns) {
            if (c.isConditional()) n++;
        }
        return n;
    }

    /** Conditional columns whose CASE was decomposed into at least one branch. */
    public int decomposedCaseCount() {
        int n = 0;
        for (ColumnMapping c : columns) {
            if (c.getCaseLogic().map(l -> !l.isEmpty()).orElse(false)) n++;
        }
        return n;
    }
}
