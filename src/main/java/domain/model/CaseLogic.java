package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Structured form of a CASE expression.
 *
 * <p>Branches keep source order: the first matching WHEN wins when the SQL runs, so the order is part
 * of the meaning. A missing ELSE stays absent ({@link Optional#empty()}); it is not the same as an ELSE
 * of NULL or an empty string.</p>
 */
public final class CaseLogic {

    private static final CaseLogic EMPTY = new CaseLogic(null, List.of(), null);

    private final String operand;
    private final List<CaseBranch> branches;
    private final Literal elseLiteral;

    public CaseLogic(String operand, List<CaseBranch> branches, Literal elseLiteral) {
        this.operand = (operand == null || operand.isBlank()) ? null : operand;
        this.branches = branches == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(branches));
        this.elseLiteral = elseLiteral;
    }

    /** Searched CASE ({@code CASE WHEN cond THEN ...}). */
    public static CaseLogic of(List<CaseBranch> branches, Literal elseLiteral) {
        return new CaseLogic(null, branches, elseLiteral);
    }

    /** Result for a conditional expression that could not be decomposed. */
    public static CaseLogic empty() {
        return EMPTY;
    }

    public List<CaseBranch> getBranches() {
        return branches;
    }

    public Optional<Literal> getElseLiteral() {
        return Optional.ofNullable(elseLiteral);
    }

    /** Operand of a simple CASE ({@code CASE x WHEN 1 THEN ...}); empty for a searched CASE. */
    public Optional<String> getOperand() {
        return Optional.ofNullable(operand);
    }

    public boolean isEmpty() {
        return branches.isEmpty();
    }

    /** Branch results followed by the ELSE value, distinct, in source order. */
    public List<Literal> resultLiterals() {
        List<Literal> out = new ArrayList<>(branches.size() + 1);
        for (CaseBranch b : branches) {
            if (!out.contains(b.getResultLiteral())) out.add(b.getResultLiteral());
        }
        if (elseLiteral != null && !out.contains(elseLiteral)) out.add(elseLiteral);
        return out;
    }

    @Override
    public String toString() {
        return "CaseLogic{operand=" + operand + ", branches=" + branches + ", else=" + elseLiteral + '}';
    }
}
