package domain.lineage;

import domain.model.CteBoundary;

/**
 * Line-based locator: the first line starting with {@code select} opens the projection and the first
 * later line starting with {@code from} closes it.
 *
 * <p>Assumes the outermost SELECT and FROM of the terminal CTE sit on their own lines, while nested
 * subqueries are written inline. Comment lines are ignored.</p>
 */
final class LineAnchoredProjectionLocator implements ProjectionLocator {

    @Override
    public ProjectionSlice locate(String body, int bodyStartLine) {
        if (body == null || body.isEmpty()) return null;

        String masked = SqlText.maskLiteralsAndComments(body);
        int selectLine = -1;
        int selectKeywordAt = -1;
        int fromLineStart = -1;
        int fromLine = -1;

        int line = 0;
        int lineStart = 0;
        while (lineStart <= masked.length()) {
            int nl = masked.indexOf('\n', lineStart);
            int lineEnd = nl < 0 ? masked.length() : nl;
            String text = masked.substring(lineStart, lineEnd);

            if (selectLine < 0) {
                if (SqlText.startsWithWord(text, "select")) {
                    selectLine = line;
                    selectKeywordAt = lineStart + SqlText.indexOfWord(text, "select", 0);
                }
            } else if (SqlText.startsWithWord(text, "from")) {
                fromLine = line;
                fromLineStart = lineStart;
                break;
            }

            if (nl < 0) break;
            lineStart = nl + 1;
            line++;
        }

        if (selectLine < 0 || fromLine < 0) return null;

        String columnList = body.substring(selectKeywordAt + "select".length(), fromLineStart);
        CteBoundary boundary = new CteBoundary(bodyStartLine, bodyStartLine + selectLine, bodyStartLine + fromLine);
        return new ProjectionSlice(ProjectionSlice.stripDistinct(columnList), boundary);
    }
}
