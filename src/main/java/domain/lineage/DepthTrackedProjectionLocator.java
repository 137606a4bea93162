package domain.lineage;

import domain.model.CteBoundary;

/**
 * Depth-aware locator: the first {@code select} and the following {@code from} keyword found at
 * parenthesis and CASE depth zero. Subqueries and {@code extract(x from y)} never match because they
 * sit inside parentheses.
 */
final class DepthTrackedProjectionLocator implements ProjectionLocator {

    @Override
    public ProjectionSlice locate(String body, int bodyStartLine) {
        if (body == null || body.isEmpty()) return null;

        NestingState state = NestingState.TOP;
        int selectAt = -1;
        int fromAt = -1;
        int pos = 0;

        while (pos < body.length()) {
            if (state.isTopLevel()) {
                if (selectAt < 0 && SqlScan.isWordAt(body, pos, "select")) {
                    selectAt = pos;
                    pos += "select".length();
                    continue;
                }
                if (selectAt >= 0 && SqlScan.isWordAt(body, pos, "from")) {
                    fromAt = pos;
                    break;
                }
            }
            DepthTracker.Step step = DepthTracker.step(body, pos, state);
            state = step.state();
            pos += step.consumed();
        }

        if (selectAt < 0 || fromAt < 0) return null;

        String columnList = body.substring(selectAt + "select".length(), fromAt);
        CteBoundary boundary = new CteBoundary(
                bodyStartLine,
                bodyStartLine + SqlText.lineOf(body, selectAt),
                bodyStartLine + SqlText.lineOf(body, fromAt)
        );
        return new ProjectionSlice(ProjectionSlice.stripDistinct(columnList), boundary);
    }
}
