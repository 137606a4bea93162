package app;

import domain.analysis.ModelLineageAnalyzer;
import domain.analysis.ModelSource;
import domain.config.ExtractionOptions;
import domain.lineage.ColumnLineageExtractor;
import domain.mapping.UpstreamAliasRegistry;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineageBatchRunnerTest {

    private static final String GOOD = "with final as (\n" +
            "    select\n" +
            "        a.id as id,\n" +
            "        case when a.flag = 1 then 'Y' else 'N' end as is_active,\n" +
            "        a.x + 1\n" +
            "    from src a\n" +
            ")\n" +
            "select * from final";

    private static final String NO_CTE = "select 1 as one";

    private static LineageBatchRunner runner(boolean failFast) {
        ExtractionOptions options = ExtractionOptions.builder().failFast(failFast).build();
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(
                new ColumnLineageExtractor(options), new UpstreamAliasRegistry().register("a", "src_table"));
        return new LineageBatchRunner(analyzer, 1, Long.MAX_VALUE);
    }

    @Test
    void run_shouldCountSuccessAndSkips_andKeepGoing() {
        BatchSummary summary = runner(false).run(List.of(
                ModelSource.of("good", GOOD),
                ModelSource.of("empty", ""),
                ModelSource.of("no_cte", NO_CTE)
        ));

        assertEquals(1, summary.successCount());
        assertEquals(2, summary.skipCount());
        assertFalse(summary.isStoppedEarly());

        assertEquals("SQL_TEXT_EMPTY", summary.getResults().get(1).getMessage());
        assertEquals("STRUCTURE_NOT_FOUND", summary.getResults().get(2).getMessage());

        assertEquals(2, summary.columnCount());
        assertEquals(1, summary.conditionalCount());
        assertEquals(1, summary.decomposedCaseCount());
        assertEquals(1, summary.skippedExpressionCount());

        assertTrue(summary.getWarnings().stream().anyMatch(w -> w.getCode() == WarningCode.ALIAS_UNPARSEABLE));
        assertTrue(summary.getWarnings().stream().anyMatch(w -> w.getCode() == WarningCode.SQL_TEXT_EMPTY));
        assertTrue(summary.getWarnings().stream().anyMatch(w -> w.getCode() == WarningCode.STRUCTURE_NOT_FOUND));
    }

    @Test
    void run_shouldStopAtFirstUnparseableAlias_inFailFastMode() {
        BatchSummary summary = runner(true).run(List.of(
                ModelSource.of("good", GOOD),
                ModelSource.of("never_reached", GOOD)
        ));

        assertTrue(summary.isStoppedEarly());
        assertEquals(1, summary.getResults().size());
        assertEquals("ALIAS_UNPARSEABLE_FAILFAST", summary.getResults().get(0).getMessage());
        assertEquals(0, summary.successCount());
    }

    @Test
    void run_shouldRecordUnexpectedErrors_asExtractionError() {
        BatchSummary summary = new LineageBatchRunner(
                new ModelLineageAnalyzer(new ColumnLineageExtractor(), qualifier -> {
                    throw new IllegalStateException("lookup down");
                }), 10, Long.MAX_VALUE)
                .run(List.of(ModelSource.of("boom", GOOD), ModelSource.of("empty", "")));

        assertEquals(2, summary.getResults().size());
        assertEquals("IllegalStateException", summary.getResults().get(0).getMessage());
        assertTrue(summary.getWarnings().stream().anyMatch(w ->
                w.getCode() == WarningCode.EXTRACTION_ERROR && w.getDetail().equals("lookup down")));
    }

    @Test
    void run_shouldHandleEmptyInput() {
        BatchSummary summary = runner(false).run(null);
        assertEquals(0, summary.getResults().size());
        assertEquals(0, summary.successCount());
    }

    @Test
    void run_shouldKeepWarningsRaisedBeforeAFailFastStop() {
        String sql = "with final as (\n" +
                "    select\n" +
                "        case when a.k = 1 then a.v * 2 end as doubled,\n" +
                "        a.x + 1\n" +
                "    from src a\n" +
                ")\n" +
                "select * from final";

        BatchSummary summary = runner(true).run(List.of(ModelSource.of("strict", sql)));

        assertTrue(summary.isStoppedEarly());
        assertTrue(summary.getWarnings().stream().anyMatch(w ->
                w.getCode() == WarningCode.CASE_UNPARSEABLE && "DOUBLED".equals(w.getColumn())));
    }
}
