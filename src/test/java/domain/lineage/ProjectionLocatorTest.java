package domain.lineage;

import domain.config.LocatorStrategy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionLocatorTest {

    @Test
    void lineAnchored_shouldUseFirstSelectLineAndFirstFollowingFromLine() {
        String body = "\n" +
                "    select distinct\n" +
                "        a.x as x,\n" +
                "        (select max(y) from t) as m\n" +
                "    from src a\n" +
                "    union all\n" +
                "    select\n" +
                "        b.x\n" +
                "    from other b\n";

        ProjectionSlice slice = ProjectionLocator.of(LocatorStrategy.LINE_ANCHORED).locate(body, 10);
        assertNotNull(slice);

        String list = slice.getColumnList().trim();
        assertTrue(list.startsWith("a.x as x,"), list);
        assertTrue(list.endsWith("(select max(y) from t) as m"), list);
        assertEquals(10, slice.getBoundary().getStartLine());
        assertEquals(11, slice.getBoundary().getSelectLine());
        assertEquals(14, slice.getBoundary().getFromLine());
    }

    @Test
    void lineAnchored_shouldKeepColumnsOnTheSelectLine_andIgnoreCommentedFromLines() {
        String body = "select a.id,\n" +
                "  -- from here on\n" +
                "  a.name\n" +
                "from t a";

        ProjectionSlice slice = new LineAnchoredProjectionLocator().locate(body, 1);
        assertNotNull(slice);
        assertEquals(2, SqlTopLevelSplitter.splitColumnList(slice.getColumnList(), "[t]").expressions.size());
    }

    @Test
    void lineAnchored_shouldReturnNull_whenFromIsInline() {
        assertNull(new LineAnchoredProjectionLocator().locate("select a from t", 1));
    }

    @Test
    void depthTracked_shouldSkipFromInsideFunctionCallsAndSubqueries() {
        String body = "select a.id, extract(year from a.d) as y, (select 1 from dual) as one from t a";
        ProjectionSlice slice = ProjectionLocator.of(LocatorStrategy.DEPTH_TRACKED).locate(body, 1);

        assertNotNull(slice);
        assertEquals("a.id, extract(year from a.d) as y, (select 1 from dual) as one", slice.getColumnList().trim());
    }

    @Test
    void depthTracked_shouldSkipFromInsideCaseBlocks() {
        String body = "select case when x then 'from' else y end as z\nfrom t";
        ProjectionSlice slice = new DepthTrackedProjectionLocator().locate(body, 5);

        assertNotNull(slice);
        assertEquals("case when x then 'from' else y end as z", slice.getColumnList().trim());
        assertEquals(6, slice.getBoundary().getFromLine());
    }

    @Test
    void depthTracked_shouldReturnNull_withoutSelectOrFrom() {
        assertNull(new DepthTrackedProjectionLocator().locate("values (1, 2)", 1));
        assertNull(new DepthTrackedProjectionLocator().locate("select 1", 1));
    }
}
