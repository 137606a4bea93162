package domain.lineage;

import domain.config.ExtractionOptions;
import domain.model.CaseLogic;
import domain.model.ColumnMapping;
import domain.model.ExtractionContext;
import domain.model.ExtractionResult;
import domain.model.LineageWarning;
import domain.model.LineageWarningSink;
import domain.model.ListLineageWarningSink;
import domain.model.RawExpression;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Column-lineage extraction for one SQL model.
 *
 * <p>Pipeline: terminal CTE -> projection (SELECT ... FROM) -> top-level split -> alias and
 * source references -> CASE decomposition.</p>
 *
 * <p>Stateless apart from the options; one instance can be shared between threads. Malformed input
 * yields a partial or empty result plus warnings. The only exception thrown is
 * {@link UnparseableAliasException}, and only with {@link ExtractionOptions#isFailFast()}.</p>
 */
public final class ColumnLineageExtractor {

    private static final int DETAIL_MAX = 120;

    private final ExtractionOptions options;
    private final ProjectionLocator locator;
    private final ColumnExpressionExtractor expressions;

    public ColumnLineageExtractor() {
        this(ExtractionOptions.defaults());
    }

    public ColumnLineageExtractor(ExtractionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.locator = ProjectionLocator.of(options.getLocator());
        this.expressions = new ColumnExpressionExtractor(options);
    }

    public ExtractionOptions getOptions() {
        return options;
    }

    public ExtractionResult extract(String sqlText) {
        return extract(sqlText, options.getTerminalCte());
    }

    public ExtractionResult extract(String sqlText, String terminalCte) {
        return extract(sqlText, terminalCte, ExtractionContext.anonymous(), LineageWarningSink.none());
    }

    /**
     * @param terminalCte name of the CTE selected by the model's final {@code select * from}; blank means
     *                    detect it from the text
     * @param sink        receives every warning that also lands in the result
     */
    public ExtractionResult extract(String sqlText, String terminalCte, ExtractionContext ctx, LineageWarningSink sink) {
        ExtractionContext c = (ctx == null) ? ExtractionContext.anonymous() : ctx;
        List<LineageWarning> warnings = new ArrayList<>();
        LineageWarningSink local = new ListLineageWarningSink(warnings);

        String sql = (sqlText == null) ? "" : sqlText;
        String name = (terminalCte == null || terminalCte.isBlank())
                ? TerminalCteFinder.detectTerminalName(sql)
                : terminalCte.trim();

        if (name == null) {
            local.warn(LineageWarning.of(WarningCode.STRUCTURE_NOT_FOUND, c,
                    "no terminal select * from <cte> found", null));
            return finish(List.of(), warnings, 0, false, sink);
        }

        TerminalCteFinder.CteBody body = TerminalCteFinder.find(sql, name);
        if (body == null) {
            local.warn(LineageWarning.of(WarningCode.STRUCTURE_NOT_FOUND, c,
                    "terminal CTE not found", "cte=" + name));
            return finish(List.of(), warnings, 0, false, sink);
        }

        ProjectionSlice slice = locator.locate(body.text, body.startLine);
        if (slice == null) {
            local.warn(LineageWarning.of(WarningCode.STRUCTURE_NOT_FOUND, c,
                    "no SELECT/FROM pair in terminal CTE", "cte=" + name + ", locator=" + options.getLocator()));
            return finish(List.of(), warnings, 0, false, sink);
        }

        return columns(slice.getColumnList(), c, warnings, local, sink);
    }

    /**
     * Extracts the projection of a plain {@code SELECT ... FROM} statement (no CTE wrapper).
     * The outermost SELECT/FROM pair is found by nesting depth.
     */
    public ExtractionResult extractFromSelect(String selectSql, ExtractionContext ctx, LineageWarningSink sink) {
        ExtractionContext c = (ctx == null) ? ExtractionContext.anonymous() : ctx;
        List<LineageWarning> warnings = new ArrayList<>();
        LineageWarningSink local = new ListLineageWarningSink(warnings);

        ProjectionSlice slice = new DepthTrackedProjectionLocator().locate(selectSql, 1);
        if (slice == null) {
            local.warn(LineageWarning.of(WarningCode.STRUCTURE_NOT_FOUND, c,
                    "no SELECT/FROM pair in statement", null));
            return finish(List.of(), warnings, 0, false, sink);
        }
        return columns(slice.getColumnList(), c, warnings, local, sink);
    }

    /** Extracts columns from a bare column list (the text between SELECT and FROM). */
    public ExtractionResult extractColumns(String columnList, ExtractionContext ctx, LineageWarningSink sink) {
        ExtractionContext c = (ctx == null) ? ExtractionContext.anonymous() : ctx;
        List<LineageWarning> warnings = new ArrayList<>();
        return columns(columnList, c, warnings, new ListLineageWarningSink(warnings), sink);
    }

    /** Parses a single projection item; null when it has no resolvable alias. */
    public ColumnMapping extractColumn(String expressionText) {
        ColumnMapping col = expressions.extract(expressionText);
        if (col == null || !col.isConditional()) return col;
        return col.withCaseLogic(CaseDecomposer.decompose(col.getExpression()));
    }

    private ExtractionResult columns(
            String columnList,
            ExtractionContext ctx,
            List<LineageWarning> warnings,
            LineageWarningSink local,
            LineageWarningSink sink
    ) {
        SqlTopLevelSplitter.SplitResult split =
                SqlTopLevelSplitter.splitColumnList(columnList == null ? "" : columnList, options.getTemplatePlaceholder());

        if (split.strayClosers > 0) {
            local.warn(LineageWarning.of(WarningCode.UNBALANCED_NESTING, ctx,
                    "stray closing ) or END ignored", "count=" + split.strayClosers));
        }

        List<ColumnMapping> out = new ArrayList<>(split.expressions.size());
        int skipped = 0;

        for (RawExpression raw : split.expressions) {
            ColumnMapping col = expressions.extract(raw.getText());
            if (col == null) {
                skipped++;
                String shown = abbreviate(SqlText.normalizeWhitespace(raw.getText()));
                if (options.isFailFast()) {
                    forward(warnings, sink);
                    throw new UnparseableAliasException(ctx.getModelName(), shown);
                }
                local.warn(LineageWarning.of(WarningCode.ALIAS_UNPARSEABLE, ctx,
                        "could not parse alias for expression", shown));
                continue;
            }

            if (col.isConditional()) {
                CaseLogic logic = CaseDecomposer.decompose(col.getExpression());
                if (logic.isEmpty()) {
                    local.warn(LineageWarning.ofColumn(WarningCode.CASE_UNPARSEABLE, ctx, col.getAlias(),
                            "CASE not decomposed into literal branches", abbreviate(col.getExpression())));
                }
                col = col.withCaseLogic(logic);
            }
            out.add(col);
        }

        return finish(out, warnings, skipped, true, sink);
    }

    private static ExtractionResult finish(
            List<ColumnMapping> columns,
            List<LineageWarning> warnings,
            int skipped,
            boolean structureFound,
            LineageWarningSink sink
    ) {
        forward(warnings, sink);
        return new ExtractionResult(columns, warnings, skipped, structureFound);
    }

    private static void forward(List<LineageWarning> warnings, LineageWarningSink sink) {
        if (sink == null) return;
        for (LineageWarning w : warnings) {
            sink.warn(w);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= DETAIL_MAX ? s : s.substring(0, DETAIL_MAX - 3) + "...";
    }
}
