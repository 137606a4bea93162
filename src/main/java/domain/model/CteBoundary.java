package domain.model;

/**
 * Line numbers (0-based, relative to the CTE body) used to slice the projection out of a terminal CTE.
 */
public final class CteBoundary {

    private final int startLine;
    private final int selectLine;
    private final int fromLine;

    public CteBoundary(int startLine, int selectLine, int fromLine) {
        this.startLine = startLine;
        this.selectLine = selectLine;
        this.fromLine = fromLine;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getSelectLine() {
        return selectLine;
    }

    public int getFromLine() {
        return fromLine;
    }

    @Override
    public String toString() {
        return "CteBoundary{start=" + startLine + ", select=" + selectLine + ", from=" + fromLine + '}';
    }
}
