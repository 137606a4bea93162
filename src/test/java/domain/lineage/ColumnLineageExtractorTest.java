package domain.lineage;

import domain.config.ExtractionOptions;
import domain.config.LocatorStrategy;
import domain.model.CaseLogic;
import domain.model.ColumnMapping;
import domain.model.ExtractionContext;
import domain.model.ExtractionResult;
import domain.model.LineageWarning;
import domain.model.ListLineageWarningSink;
import domain.model.Literal;
import domain.model.SourceReference;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ColumnLineageExtractorTest {

    private static final String CASA = "models/silver__core__casa_transactions.sql";

    @Test
    void txnDirectionScenario_shouldYieldTwoColumnsWithOrderedBranches() {
        String sql = "select a.txn_type as txn_type, case when a.amt > 0 then 'CREDIT' when a.amt < 0 then 'DEBIT' "
                + "else 'ZERO' end as txn_direction from txn a";

        ExtractionResult r = new ColumnLineageExtractor()
                .extractFromSelect(sql, new ExtractionContext("scenario"), null);

        assertTrue(r.isStructureFound());
        assertEquals(2, r.getColumns().size());

        ColumnMapping type = r.getColumns().get(0);
        assertEquals("TXN_TYPE", type.getAlias());
        assertFalse(type.isConditional());
        assertEquals(Set.of(new SourceReference("A", "TXN_TYPE")), type.getSourceReferences());

        ColumnMapping dir = r.getColumns().get(1);
        assertEquals("TXN_DIRECTION", dir.getAlias());
        assertTrue(dir.isConditional());

        CaseLogic logic = dir.getCaseLogic().orElseThrow();
        assertEquals(2, logic.getBranches().size());
        assertEquals("a.amt > 0", logic.getBranches().get(0).getCondition());
        assertEquals(Literal.singleQuoted("CREDIT"), logic.getBranches().get(0).getResultLiteral());
        assertEquals("a.amt < 0", logic.getBranches().get(1).getCondition());
        assertEquals(Literal.singleQuoted("DEBIT"), logic.getBranches().get(1).getResultLiteral());
        assertEquals(Literal.singleQuoted("ZERO"), logic.getElseLiteral().orElseThrow());
        assertTrue(r.getWarnings().isEmpty());
    }

    @Test
    void extract_shouldReadTheTerminalCteOfADbtModel() throws IOException {
        ExtractionResult r = new ColumnLineageExtractor().extract(load(CASA), "final");

        assertTrue(r.isStructureFound());
        assertEquals(List.of(
                "TXN_ID", "ACCOUNT_ID", "GL_ID", "TXN_DIRECTION", "CHANNEL_RANK", "AMOUNT",
                "CUSTOMER_SEGMENT", "LEGACY_REF", "POSTING_DATE", "SIGNED_AMOUNT", "ENDDATE"
        ), aliases(r));
        assertEquals(0, r.getSkippedExpressions());
        assertEquals(3, r.conditionalCount());
        assertEquals(2, r.decomposedCaseCount());

        ColumnMapping legacy = r.getColumns().get(7);
        assertEquals("txn.legacy_ref", legacy.getExpression());

        ColumnMapping amount = r.getColumns().get(5);
        assertEquals("cast(txn.amount as number(18, 2))", amount.getExpression());
        assertEquals(Set.of(new SourceReference("TXN", "AMOUNT")), amount.getSourceReferences());

        CaseLogic channel = r.getColumns().get(4).getCaseLogic().orElseThrow();
        assertEquals("txn.channel_code", channel.getOperand().orElseThrow());
        assertEquals(Literal.integer("0"), channel.getElseLiteral().orElseThrow());

        assertEquals(1, r.getWarnings().size());
        LineageWarning w = r.getWarnings().get(0);
        assertEquals(WarningCode.CASE_UNPARSEABLE, w.getCode());
        assertEquals("SIGNED_AMOUNT", w.getColumn());
        assertTrue(r.getColumns().get(9).getCaseLogic().orElseThrow().isEmpty());
    }

    @Test
    void extract_shouldGiveTheSameColumns_withEitherLocator() throws IOException {
        String sql = load(CASA);
        ExtractionResult lines = new ColumnLineageExtractor().extract(sql, "final");
        ExtractionResult depth = new ColumnLineageExtractor(ExtractionOptions.builder()
                .locator(LocatorStrategy.DEPTH_TRACKED)
                .build()).extract(sql, "final");

        assertEquals(aliases(lines), aliases(depth));
    }

    @Test
    void extract_shouldDetectTerminalCte_whenNameIsBlank() throws IOException {
        ColumnLineageExtractor extractor = new ColumnLineageExtractor(
                ExtractionOptions.builder().detectTerminalCte().build());

        ExtractionResult r = extractor.extract(load(CASA));
        assertEquals(11, r.getColumns().size());
    }

    @Test
    void extract_shouldReturnEmptyWithOneDiagnostic_whenTerminalCteIsMissing() throws IOException {
        List<LineageWarning> forwarded = new ArrayList<>();
        ExtractionResult r = new ColumnLineageExtractor().extract(
                load("models/no_terminal_cte.sql"), "final",
                new ExtractionContext("no_terminal_cte"), new ListLineageWarningSink(forwarded));

        assertTrue(r.getColumns().isEmpty());
        assertFalse(r.isStructureFound());
        assertEquals(1, r.getWarnings().size());
        assertEquals(WarningCode.STRUCTURE_NOT_FOUND, r.getWarnings().get(0).getCode());
        assertEquals("no_terminal_cte", r.getWarnings().get(0).getModel());
        assertEquals(r.getWarnings(), forwarded);
    }

    @Test
    void extract_shouldNotThrow_onGarbageInput() {
        ColumnLineageExtractor extractor = new ColumnLineageExtractor();
        for (String sql : new String[]{null, "", "final as (", "final as ( select ) select * from final", ")))end end"}) {
            ExtractionResult r = extractor.extract(sql, "final");
            assertTrue(r.getColumns().isEmpty(), String.valueOf(sql));
            assertEquals(1, r.getWarnings().size(), String.valueOf(sql));
        }
    }

    @Test
    void extract_shouldBeRepeatable() throws IOException {
        String sql = load(CASA);
        ColumnLineageExtractor extractor = new ColumnLineageExtractor();

        ExtractionResult first = extractor.extract(sql, "final");
        ExtractionResult second = extractor.extract(sql, "final");
        assertEquals(aliases(first), aliases(second));
        assertEquals(first.getWarnings().size(), second.getWarnings().size());
    }

    @Test
    void extractColumns_shouldSkipUnparseableAliases_inLenientMode() {
        ExtractionResult r = new ColumnLineageExtractor()
                .extractColumns("a.x as x, a.b + c, a.y", new ExtractionContext("m"), null);

        assertEquals(List.of("X", "Y"), aliases(r));
        assertEquals(1, r.getSkippedExpressions());
        assertEquals(WarningCode.ALIAS_UNPARSEABLE, r.getWarnings().get(0).getCode());
        assertEquals("a.b + c", r.getWarnings().get(0).getDetail());
    }

    @Test
    void extractColumns_shouldThrow_inFailFastMode() {
        ColumnLineageExtractor strict = new ColumnLineageExtractor(ExtractionOptions.builder().failFast(true).build());

        UnparseableAliasException e = assertThrows(UnparseableAliasException.class,
                () -> strict.extractColumns("a.x as x, a.b + c", new ExtractionContext("m1"), null));
        assertEquals("m1", e.getModel());
        assertEquals("a.b + c", e.getExpression());
    }

    @Test
    void extractColumns_shouldWarnOnce_aboutStrayClosers() {
        ExtractionResult r = new ColumnLineageExtractor()
                .extractColumns("a.x as x, f(b.y)) as y, c.z as z", ExtractionContext.anonymous(), null);

        assertEquals(List.of("X", "Y", "Z"), aliases(r));
        assertEquals(1, r.getWarnings().size());
        assertEquals(WarningCode.UNBALANCED_NESTING, r.getWarnings().get(0).getCode());
    }

    @Test
    void extractColumn_shouldDecomposeASingleItem() {
        ColumnMapping c = new ColumnLineageExtractor().extractColumn("case when x.f = 1 then 'Y' else 'N' end as flag");
        assertEquals("FLAG", c.getAlias());
        assertEquals(1, c.getCaseLogic().orElseThrow().getBranches().size());
        assertNull(new ColumnLineageExtractor().extractColumn("x +"));
    }

    private static List<String> aliases(ExtractionResult r) {
        List<String> out = new ArrayList<>();
        for (ColumnMapping c : r.getColumns()) out.add(c.getAlias());
        return out;
    }

    private static String load(String path) throws IOException {
        try (InputStream in = ColumnLineageExtractorTest.class.getClassLoader().getResourceAsStream(path)) {
            assertNotNull(in, path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void extract_shouldFindTheTerminalCte_whenItsBodyHasATemplateCommentWithAnApostrophe() {
        String sql = "with final as (\n" +
                "    {# keep only the customer's latest row #}\n" +
                "    select\n" +
                "        s.id as id,\n" +
                "        s.name as name\n" +
                "    from src s\n" +
                ")\n" +
                "select * from final";

        for (LocatorStrategy locator : LocatorStrategy.values()) {
            ExtractionResult r = new ColumnLineageExtractor(ExtractionOptions.builder().locator(locator).build())
                    .extract(sql, "final");

            assertTrue(r.isStructureFound(), locator.name());
            assertEquals(List.of("ID", "NAME"), aliases(r), locator.name());
            assertTrue(r.getWarnings().isEmpty(), r.getWarnings().toString());
        }
    }

    @Test
    void extractColumns_shouldNotSplitInsideATemplateBlock_afterACommentWithAnApostrophe() {
        ExtractionResult r = new ColumnLineageExtractor().extractColumns(
                "a.x as x, -- customer's flag\n{% set cols = [\"p\", \"q\"] %}\nb.y as y",
                new ExtractionContext("m"), null);

        assertEquals(List.of("X", "Y"), aliases(r));
        assertEquals("b.y", r.getColumns().get(1).getExpression());
        assertTrue(r.getWarnings().isEmpty(), r.getWarnings().toString());
    }
}
