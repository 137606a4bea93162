package domain.analysis;

import domain.config.ExtractionOptions;
import domain.doc.ColumnDocumentation;
import domain.lineage.ColumnLineageExtractor;
import domain.lineage.UnparseableAliasException;
import domain.mapping.UpstreamAliasRegistry;
import domain.model.LineageWarning;
import domain.model.ListLineageWarningSink;
import domain.model.UpstreamSource;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelLineageAnalyzerTest {

    private static final Map<String, String> CASA_UPSTREAM = Map.of(
            "txn", "bronze__core_transaction_history__transactions_posting",
            "acct", "bronze__projections__accounts__account_gl_id_mapping",
            "casa_cust", "silver__onboarding__customer_master"
    );

    @Test
    void analyze_shouldCollectCtesSourcesColumnsAndDocs() throws IOException {
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(
                new ColumnLineageExtractor(), new UpstreamAliasRegistry(CASA_UPSTREAM));

        ModelLineage lineage = analyzer.analyze(ModelSource.of("silver__core__casa_transactions",
                load("models/silver__core__casa_transactions.sql")));

        assertEquals("final", lineage.getTerminalCte());
        assertEquals(List.of("raw_transactions", "accounts", "casa_customers", "final"), lineage.getCteNames());
        assertEquals(List.of(
                UpstreamSource.ref("bronze__core_transaction_history__transactions_posting"),
                UpstreamSource.source("projections", "accounts__account_gl_id_mapping"),
                UpstreamSource.ref("silver__onboarding__customer_master")
        ), lineage.getUpstreamSources());

        assertEquals(11, lineage.getColumns().size());
        assertEquals(11, lineage.getDocumentation().size());

        ColumnDocumentation segment = lineage.getDocumentation().get(6);
        assertEquals("CUSTOMER_SEGMENT", segment.getColumnName());
        assertEquals("silver__onboarding__customer_master", segment.getUpstreamTable());
        assertEquals("SEGMENT", segment.getUpstreamColumn());

        ColumnDocumentation channel = lineage.getDocumentation().get(4);
        assertEquals("WHEN txn.channel_code = 'ATM' THEN 1 | WHEN txn.channel_code = 'POS' THEN 2 | ELSE 0",
                channel.getTransformation());

        assertEquals(1, lineage.getWarnings().size(), lineage.getWarnings().toString());
        assertEquals(WarningCode.CASE_UNPARSEABLE, lineage.getWarnings().get(0).getCode());
    }

    @Test
    void analyze_shouldAutoDetectTerminalCte_andReportUnmappedQualifiers() throws IOException {
        ColumnLineageExtractor extractor = new ColumnLineageExtractor(
                ExtractionOptions.builder().detectTerminalCte().build());
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(extractor, null);

        ModelLineage lineage = analyzer.analyze(ModelSource.of("casa",
                load("models/silver__core__casa_transactions.sql")));

        assertEquals("final", lineage.getTerminalCte());
        long unresolved = lineage.getWarnings().stream()
                .filter(w -> w.getCode() == WarningCode.UPSTREAM_ALIAS_UNRESOLVED)
                .count();
        assertEquals(3, unresolved, "txn, acct and casa_cust, once each");
    }

    @Test
    void analyze_shouldReportEmptySql() {
        ModelLineage lineage = new ModelLineageAnalyzer(new ColumnLineageExtractor(), null)
                .analyze(ModelSource.of("empty", "  \n"));

        assertTrue(lineage.getColumns().isEmpty());
        assertFalse(lineage.getExtraction().isStructureFound());
        LineageWarning w = lineage.getWarnings().get(0);
        assertEquals(WarningCode.SQL_TEXT_EMPTY, w.getCode());
        assertEquals("empty", w.getModel());
    }

    @Test
    void analyze_shouldPropagateFailFast() {
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(
                new ColumnLineageExtractor(ExtractionOptions.builder().failFast(true).build()), null);

        String sql = "with final as (\n select\n  a.x + 1\n from t a\n)\nselect * from final";
        assertThrows(UnparseableAliasException.class, () -> analyzer.analyze(ModelSource.of("strict", sql)));
    }

    private static String load(String path) throws IOException {
        try (InputStream in = ModelLineageAnalyzerTest.class.getClassLoader().getResourceAsStream(path)) {
            assertNotNull(in, path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void analyze_shouldHandWarningsToTheObserver_beforeFailFastStops() {
        ModelLineageAnalyzer analyzer = new ModelLineageAnalyzer(
                new ColumnLineageExtractor(ExtractionOptions.builder().failFast(true).build()), null);

        String sql = "with final as (\n select\n  case when a.k = 1 then a.v * 2 end as c,\n  a.x + 1\n from t a\n)\n"
                + "select * from final";
        List<LineageWarning> seen = new ArrayList<>();

        assertThrows(UnparseableAliasException.class,
                () -> analyzer.analyze(ModelSource.of("strict", sql), new ListLineageWarningSink(seen)));
        assertEquals(1, seen.size(), seen.toString());
        assertEquals(WarningCode.CASE_UNPARSEABLE, seen.get(0).getCode());
        assertEquals("C", seen.get(0).getColumn());
    }
}
