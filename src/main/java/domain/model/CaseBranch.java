package domain.model;

import java.util.Objects;

/** One {@code WHEN condition THEN literal} pair. */
public final class CaseBranch {

    private final String condition;
    private final Literal resultLiteral;

    public CaseBranch(String condition, Literal resultLiteral) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.resultLiteral = Objects.requireNonNull(resultLiteral, "resultLiteral");
    }

    public String getCondition() {
        return condition;
    }

    public Literal getResultLiteral() {
        return resultLiteral;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseBranch)) return false;
        CaseBranch that = (CaseBranch) o;
        return condition.equals(that.condition) && resultLiteral.equals(that.resultLiteral);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, resultLiteral);
    }

    @Override
    public String toString() {
        return "WHEN " + condition + " THEN " + resultLiteral.render();
    }
}
