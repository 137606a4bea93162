package app;

import domain.analysis.ModelLineage;
import domain.analysis.ModelLineageAnalyzer;
import domain.analysis.ModelSource;
import domain.config.ConfigValues;
import domain.config.ExtractionOptions;
import domain.lineage.ColumnLineageExtractor;
import domain.lineage.UnparseableAliasException;
import domain.mapping.UpstreamAliasLookup;
import domain.model.ExtractionContext;
import domain.model.LineageWarning;
import domain.model.LineageWarningSink;
import domain.model.ListLineageWarningSink;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Analyzes many models in sequence.
 *
 * <p>A failing model is recorded as SKIP with an {@code EXTRACTION_ERROR} warning and the run goes on.
 * With fail-fast enabled the run stops at the first unparseable alias or error.</p>
 *
 * <p>System properties: {@code lineage.logEvery} (default 50), {@code lineage.slowMs} (default 2000),
 * plus everything {@link ExtractionOptions#fromSystemProperties()} reads.</p>
 */
public final class LineageBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(LineageBatchRunner.class);

    public static final String PROP_LOG_EVERY = "lineage.logEvery";
    public static final String PROP_SLOW_MS = "lineage.slowMs";

    public static final int DEFAULT_LOG_EVERY = 50;
    public static final long DEFAULT_SLOW_MS = 2000L;

    private final ModelLineageAnalyzer analyzer;
    private final int logEvery;
    private final long slowMs;

    public LineageBatchRunner(ModelLineageAnalyzer analyzer, int logEvery, long slowMs) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.logEvery = Math.max(1, logEvery);
        this.slowMs = Math.max(0L, slowMs);
    }

    public static LineageBatchRunner fromSystemProperties(UpstreamAliasLookup upstream) {
        ExtractionOptions options = ExtractionOptions.fromSystemProperties();
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(new ColumnLineageExtractor(options), upstream);
        return new LineageBatchRunner(
                analyzer,
                ConfigValues.parseInt(System.getProperty(PROP_LOG_EVERY), DEFAULT_LOG_EVERY),
                ConfigValues.parseLong(System.getProperty(PROP_SLOW_MS), DEFAULT_SLOW_MS)
        );
    }

    public BatchSummary run(List<ModelSource> models) {
        long t0 = System.nanoTime();
        List<ModelSource> todo = models == null ? List.of() : models;
        ExtractionOptions options = analyzer.getExtractor().getOptions();

        log.info("[START] column lineage extraction");
        log.info("[CONF] models         = {}", todo.size());
        log.info("[CONF] terminalCte    = {}", options.getTerminalCte().isEmpty() ? "(auto)" : options.getTerminalCte());
        log.info("[CONF] locator        = {}", options.getLocator());
        log.info("[CONF] failFast       = {}", options.isFailFast());
        log.info("[CONF] logEvery       = {}", logEvery);
        log.info("[CONF] slowMs         = {}", slowMs);

        List<ModelRunResult> results = new ArrayList<>(todo.size());
        List<ModelLineage> lineages = new ArrayList<>(todo.size());
        List<LineageWarning> warnings = new ArrayList<>();
        LineageWarningSink warningSink = new ListLineageWarningSink(warnings);

        BatchProgressLogger progress = new BatchProgressLogger(todo.size(), logEvery);
        int success = 0;
        int skip = 0;
        boolean stopped = false;

        for (int i = 0; i < todo.size(); i++) {
            ModelSource model = todo.get(i);
            String key = model.getName();
            long one0 = System.nanoTime();

            try {
                ModelLineage lineage = analyzer.analyze(model, warningSink);

                if (model.isBlank()) {
                    skip++;
                    results.add(ModelRunResult.skip(key, WarningCode.SQL_TEXT_EMPTY.name(), ms(one0)));
                } else if (!lineage.getExtraction().isStructureFound()) {
                    skip++;
                    results.add(ModelRunResult.skip(key, WarningCode.STRUCTURE_NOT_FOUND.name(), ms(one0)));
                    lineages.add(lineage);
                } else {
                    success++;
                    results.add(ModelRunResult.success(key, ms(one0)));
                    lineages.add(lineage);
                }

            } catch (UnparseableAliasException e) {
                skip++;
                results.add(ModelRunResult.skip(key, "ALIAS_UNPARSEABLE_FAILFAST", ms(one0)));
                log.warn("[FAILFAST] alias not parseable: {}", key);
                log.warn("          {}", safe(e.getExpression()));
                stopped = true;
                break;

            } catch (RuntimeException e) {
                skip++;
                results.add(ModelRunResult.skip(key, e.getClass().getSimpleName(), ms(one0)));
                warningSink.warn(LineageWarning.of(
                        WarningCode.EXTRACTION_ERROR, new ExtractionContext(key),
                        e.getClass().getSimpleName(), safe(e.getMessage())
                ));
                log.error("[ERROR] extraction failed: {}", key, e);

                if (options.isFailFast()) {
                    log.warn("[FAILFAST] stop on first error.");
                    stopped = true;
                    break;
                }
            }

            long oneMs = ms(one0);
            if (oneMs >= slowMs) {
                log.warn("[SLOW] {}ms : {}", oneMs, key);
                warningSink.warn(LineageWarning.of(
                        WarningCode.SLOW_MODEL, new ExtractionContext(key),
                        "slowMs=" + slowMs + ", actualMs=" + oneMs, null
                ));
            }

            progress.logProgress(i + 1, success, skip, key);
        }

        BatchSummary summary = new BatchSummary(results, lineages, warnings, stopped, ms(t0));

        log.info("[STAT] success={}, skip={}", success, skip);
        log.info("[STAT] columns={}, conditional={}, caseParsed={}, skippedExpressions={}",
                summary.columnCount(), summary.conditionalCount(),
                summary.decomposedCaseCount(), summary.skippedExpressionCount());
        log.info("[STAT] warnings={}", warnings.size());
        log.info("[DONE] totalElapsed={}ms", summary.getElapsedMs());
        return summary;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
