package domain.doc;

import domain.model.CaseBranch;
import domain.model.CaseLogic;

import java.util.ArrayList;
import java.util.List;

/**
 * One-line CASE summary: {@code WHEN <cond> THEN <literal> | ... | ELSE <literal>}.
 */
public final class CaseLogicFormatter {

    static final int CONDITION_MAX = 50;
    static final String SEPARATOR = " | ";

    private CaseLogicFormatter() {
    }

    /** @return summary, or empty string when the logic has no branches */
    public static String format(CaseLogic logic) {
        if (logic == null || logic.isEmpty()) return "";

        String operand = logic.getOperand().orElse("");
        List<String> parts = new ArrayList<>(logic.getBranches().size() + 1);
        for (CaseBranch b : logic.getBranches()) {
            String cond = operand.isEmpty() ? b.getCondition() : operand + " = " + b.getCondition();
            parts.add("WHEN " + shorten(cond) + " THEN " + b.getResultLiteral().render());
        }
        logic.getElseLiteral().ifPresent(l -> parts.add("ELSE " + l.render()));
        return String.join(SEPARATOR, parts);
    }

    static String shorten(String condition) {
        if (condition.length() <= CONDITION_MAX) return condition;
        return condition.substring(0, CONDITION_MAX - 3) + "...";
    }
}
