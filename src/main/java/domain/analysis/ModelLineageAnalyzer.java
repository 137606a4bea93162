package domain.analysis;

import domain.doc.ColumnDocumentation;
import domain.doc.ColumnDocumentationBuilder;
import domain.lineage.ColumnLineageExtractor;
import domain.lineage.CteCatalog;
import domain.lineage.DbtReferenceExtractor;
import domain.mapping.UpstreamAliasLookup;
import domain.model.ExtractionContext;
import domain.model.ExtractionResult;
import domain.model.LineageWarning;
import domain.model.LineageWarningSink;
import domain.model.ListLineageWarningSink;
import domain.model.UpstreamSource;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the full per-model analysis: CTE catalog, dbt upstream sources, column extraction and
 * documentation rows.
 */
public final class ModelLineageAnalyzer {

    private final ColumnLineageExtractor extractor;
    private final ColumnDocumentationBuilder documentation;

    public ModelLineageAnalyzer(ColumnLineageExtractor extractor, UpstreamAliasLookup upstream) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.documentation = new ColumnDocumentationBuilder(upstream == null ? UpstreamAliasLookup.none() : upstream);
    }

    public ColumnLineageExtractor getExtractor() {
        return extractor;
    }

    public ModelLineage analyze(ModelSource model) {
        return analyze(model, LineageWarningSink.none());
    }

    /**
     * @param observer receives each warning as it is raised, so warnings reported before a fail-fast
     *                 stop are not lost with the discarded result
     * @throws domain.lineage.UnparseableAliasException in fail-fast mode only
     */
    public ModelLineage analyze(ModelSource model, LineageWarningSink observer) {
        Objects.requireNonNull(model, "model");

        ExtractionContext ctx = new ExtractionContext(model.getName());
        List<LineageWarning> warnings = new ArrayList<>();
        LineageWarningSink local = new ListLineageWarningSink(warnings);
        LineageWarningSink forward = (observer == null) ? LineageWarningSink.none() : observer;
        LineageWarningSink sink = w -> {
            local.warn(w);
            forward.warn(w);
        };

        if (model.isBlank()) {
            sink.warn(LineageWarning.of(WarningCode.SQL_TEXT_EMPTY, ctx, "SQL text empty", null));
            ExtractionResult empty = new ExtractionResult(List.of(), warnings, 0, false);
            return new ModelLineage(model.getName(), "", List.of(), List.of(), empty, List.of(), warnings);
        }

        String sql = model.getSqlText();
        String terminal = extractor.getOptions().getTerminalCte();
        if (terminal.isEmpty()) {
            String detected = CteCatalog.detectTerminalCte(sql);
            terminal = detected == null ? "" : detected;
        }

        List<String> ctes = CteCatalog.cteNames(sql);
        List<UpstreamSource> upstream = DbtReferenceExtractor.extract(sql);

        ExtractionResult result = extractor.extract(sql, terminal, ctx, sink);
        List<ColumnDocumentation> docs = documentation.buildAll(result.getColumns(), ctx, sink);

        return new ModelLineage(model.getName(), terminal, ctes, upstream, result, docs, warnings);
    }
}
