package domain.analysis;

import domain.doc.ColumnDocumentation;
import domain.model.ColumnMapping;
import domain.model.ExtractionResult;
import domain.model.LineageWarning;
import domain.model.UpstreamSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about one model: CTEs, upstream sources, extracted columns, documentation rows
 * and the warnings of all steps.
 */
public final class ModelLineage {

    private final String modelName;
    private final String terminalCte;
    private final List<String> cteNames;
    private final List<UpstreamSource> upstreamSources;
    private final ExtractionResult extraction;
    private final List<ColumnDocumentation> documentation;
    private final List<LineageWarning> warnings;

    public ModelLineage(
            String modelName,
            String terminalCte,
            List<String> cteNames,
            List<UpstreamSource> upstreamSources,
            ExtractionResult extraction,
            List<ColumnDocumentation> documentation,
            List<LineageWarning> warnings
    ) {
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.terminalCte = terminalCte == null ? "" : terminalCte;
        this.cteNames = copy(cteNames);
        this.upstreamSources = copy(upstreamSources);
        this.extraction = Objects.requireNonNull(extraction, "extraction");
        this.documentation = copy(documentation);
        this.warnings = copy(warnings);
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public String getModelName() {
        return modelName;
    }

    /** Terminal CTE used for extraction; empty when none could be determined. */
    public String getTerminalCte() {
        return terminalCte;
    }

    public List<String> getCteNames() {
        return cteNames;
    }

    public List<UpstreamSource> getUpstreamSources() {
        return upstreamSources;
    }

    public ExtractionResult getExtraction() {
        return extraction;
    }

    public List<ColumnMapping> getColumns() {
        return extraction.getColumns();
    }

    public List<ColumnDocumentation> getDocumentation() {
        return documentation;
    }

    public List<LineageWarning> getWarnings() {
        return warnings;
    }
}
