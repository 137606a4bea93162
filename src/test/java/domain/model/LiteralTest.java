package domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiteralTest {

    @Test
    void render_shouldQuoteStringsAndLeaveOthersBare() {
        assertEquals("'CREDIT'", Literal.singleQuoted("CREDIT").render());
        assertEquals("'it''s'", Literal.singleQuoted("it's").render());
        assertEquals("\"Q\"", Literal.doubleQuoted("Q").render());
        assertEquals("42", Literal.integer("42").render());
        assertEquals("active", Literal.bareWord("active").render());
    }

    @Test
    void equals_shouldDistinguishKinds() {
        assertNotEquals(Literal.singleQuoted("1"), Literal.integer("1"));
        assertTrue(Literal.doubleQuoted("x").isString());
        assertFalse(Literal.bareWord("x").isString());
    }

    @Test
    void caseLogic_resultLiterals_shouldBeDistinctAndIncludeElse() {
        CaseLogic logic = CaseLogic.of(List.of(
                new CaseBranch("a", Literal.singleQuoted("X")),
                new CaseBranch("b", Literal.singleQuoted("Y")),
                new CaseBranch("c", Literal.singleQuoted("X"))
        ), Literal.singleQuoted("Z"));

        assertEquals(List.of(
                Literal.singleQuoted("X"), Literal.singleQuoted("Y"), Literal.singleQuoted("Z")
        ), logic.resultLiterals());
        assertTrue(CaseLogic.empty().isEmpty());
        assertTrue(CaseLogic.empty().getElseLiteral().isEmpty());
    }
}
