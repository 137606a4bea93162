package domain.lineage;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CteCatalogTest {

    @Test
    void cteNames_shouldListTopLevelCtesInSourceOrder() {
        String sql = "with src as (select cast(x as varchar) as x from t),\n" +
                "  -- old as (select 1)\n" +
                "  agg AS(select count(*) as n from (select 1 as y) sub),\n" +
                "  final as (select 'a as (b)' as s from agg)\n" +
                "select * from final";

        assertEquals(List.of("src", "agg", "final"), CteCatalog.cteNames(sql));
    }

    @Test
    void cteNames_shouldIgnoreTemplateBlocks() {
        String sql = "{% set cols as (1) %}\nwith a as (select 1 as one)\nselect * from a";
        assertEquals(List.of("a"), CteCatalog.cteNames(sql));
    }

    @Test
    void detectTerminalCte_shouldTakeTheLastTopLevelSelectStar() {
        String sql = "with a as (select * from raw), b as (select * from a)\nselect * from b";
        assertEquals("b", CteCatalog.detectTerminalCte(sql));
        assertNull(CteCatalog.detectTerminalCte("select 1"));
        assertNull(CteCatalog.detectTerminalCte(null));
    }
}
