package domain.lineage;

/**
 * Immutable nesting state of the depth tracker.
 *
 * <p>States are {@link Mode#NORMAL}, {@link Mode#IN_PAREN} and {@link Mode#IN_CASE}; each non-normal
 * state carries its depth. Both depths never go below zero.</p>
 */
public final class NestingState {

    public enum Mode {
        NORMAL,
        IN_PAREN,
        IN_CASE
    }

    public static final NestingState TOP = new NestingState(0, 0);

    private final int parenDepth;
    private final int caseDepth;

    private NestingState(int parenDepth, int caseDepth) {
        this.parenDepth = parenDepth;
        this.caseDepth = caseDepth;
    }

    static NestingState of(int parenDepth, int caseDepth) {
        if (parenDepth <= 0 && caseDepth <= 0) return TOP;
        return new NestingState(Math.max(0, parenDepth), Math.max(0, caseDepth));
    }

    NestingState openParen() {
        return of(parenDepth + 1, caseDepth);
    }

    NestingState closeParen() {
        return of(parenDepth - 1, caseDepth);
    }

    NestingState openCase() {
        return of(parenDepth, caseDepth + 1);
    }

    NestingState closeCase() {
        return of(parenDepth, caseDepth - 1);
    }

    /** CASE wins over parentheses when both are open. */
    public Mode mode() {
        if (caseDepth > 0) return Mode.IN_CASE;
        if (parenDepth > 0) return Mode.IN_PAREN;
        return Mode.NORMAL;
    }

    public boolean isTopLevel() {
        return parenDepth == 0 && caseDepth == 0;
    }

    public int getParenDepth() {
        return parenDepth;
    }

    public int getCaseDepth() {
        return caseDepth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NestingState)) return false;
        NestingState that = (NestingState) o;
        return parenDepth == that.parenDepth && caseDepth == that.caseDepth;
    }

    @Override
    public int hashCode() {
        return 31 * parenDepth + caseDepth;
    }

    @Override
    public String toString() {
        switch (mode()) {
            case IN_CASE:
                return "IN_CASE(" + caseDepth + (parenDepth > 0 ? ", paren=" + parenDepth : "") + ")";
            case IN_PAREN:
                return "IN_PAREN(" + parenDepth + ")";
            default:
                return "NORMAL";
        }
    }
}
