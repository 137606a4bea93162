package domain.doc;

import domain.mapping.ResolvedSource;
import domain.mapping.UpstreamAliasLookup;
import domain.model.CaseLogic;
import domain.model.ColumnMapping;
import domain.model.ExtractionContext;
import domain.model.LineageWarning;
import domain.model.LineageWarningSink;
import domain.model.Literal;
import domain.model.SourceReference;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds {@link ColumnDocumentation} rows from extracted columns.
 *
 * <p>Upstream tables come from the injected {@link UpstreamAliasLookup}; a qualifier it does not know
 * is reported once per model as {@link WarningCode#UPSTREAM_ALIAS_UNRESOLVED}.</p>
 */
public final class ColumnDocumentationBuilder {

    static final int TRANSFORMATION_MAX = 300;

    static final String REMARK_CONDITIONAL = "Contains conditional logic";
    static final String REMARK_CAST = "Type conversion applied";
    static final String REMARK_AGGREGATION = "Aggregation function";

    private static final Pattern CAST = Pattern.compile("(?i)\\b(try_)?cast\\s*\\(|::");
    private static final Pattern AGGREGATION = Pattern.compile("(?i)\\b(sum|avg|count|max|min)\\s*\\(");

    private final UpstreamAliasLookup upstream;

    public ColumnDocumentationBuilder(UpstreamAliasLookup upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
    }

    public List<ColumnDocumentation> buildAll(List<ColumnMapping> columns, ExtractionContext ctx, LineageWarningSink sink) {
        List<ColumnDocumentation> out = new ArrayList<>();
        if (columns == null) return out;
        Set<String> reported = new HashSet<>();
        for (ColumnMapping c : columns) {
            out.add(build(c, ctx, sink, reported));
        }
        return out;
    }

    public ColumnDocumentation build(ColumnMapping column, ExtractionContext ctx, LineageWarningSink sink) {
        return build(column, ctx, sink, new HashSet<>());
    }

    private ColumnDocumentation build(ColumnMapping column, ExtractionContext ctx, LineageWarningSink sink,
                                      Set<String> reported) {
        Objects.requireNonNull(column, "column");
        ExtractionContext c = ctx == null ? ExtractionContext.anonymous() : ctx;
        LineageWarningSink s = sink == null ? LineageWarningSink.none() : sink;

        CaseLogic logic = column.getCaseLogic().orElse(CaseLogic.empty());

        List<ResolvedSource> sources = new ArrayList<>();
        for (SourceReference ref : column.getSourceReferences()) {
            String table = upstream.find(ref.getQualifier());
            if (table == null && reported.add(ref.getQualifier())) {
                s.warn(LineageWarning.of(WarningCode.UPSTREAM_ALIAS_UNRESOLVED, c,
                        "no upstream table mapped for qualifier", ref.getQualifier()));
            }
            sources.add(new ResolvedSource(ref, table));
        }

        ResolvedSource primary = primarySource(sources);
        return new ColumnDocumentation(
                column.getAlias(),
                LogicalNames.of(column.getAlias()),
                TransformationClassifier.classify(column.getExpression()),
                transformationDisplay(column.getExpression(), logic),
                acceptedValues(logic),
                remarks(column),
                sources,
                primary == null ? "" : primary.getUpstreamTable(),
                primary == null ? "" : primary.getReference().getColumn()
        );
    }

    /** First resolved source, else the first reference at all. */
    private static ResolvedSource primarySource(List<ResolvedSource> sources) {
        for (ResolvedSource r : sources) {
            if (r.isResolved()) return r;
        }
        return sources.isEmpty() ? null : sources.get(0);
    }

    static String transformationDisplay(String expression, CaseLogic logic) {
        String summary = CaseLogicFormatter.format(logic);
        if (!summary.isEmpty()) return summary;
        String e = expression == null ? "" : expression;
        return e.length() <= TRANSFORMATION_MAX ? e : e.substring(0, TRANSFORMATION_MAX);
    }

    static List<String> acceptedValues(CaseLogic logic) {
        Set<String> out = new LinkedHashSet<>();
        for (Literal l : logic.resultLiterals()) {
            out.add(l.getText());
        }
        return new ArrayList<>(out);
    }

    static List<String> remarks(ColumnMapping column) {
        List<String> out = new ArrayList<>(3);
        String e = column.getExpression();
        if (column.isConditional()) out.add(REMARK_CONDITIONAL);
        if (CAST.matcher(e).find()) out.add(REMARK_CAST);
        if (AGGREGATION.matcher(e).find()) out.add(REMARK_AGGREGATION);
        return out;
    }
}
