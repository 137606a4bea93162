package domain.lineage;

import domain.config.LocatorStrategy;

/**
 * Finds the outermost SELECT ... FROM pair inside a CTE body.
 */
interface ProjectionLocator {

    /**
     * @param body        CTE body text (inside the parentheses)
     * @param bodyStartLine line of the body start within the whole model, recorded in the boundary
     * @return the projection, or null when no SELECT/FROM pair is found
     */
    ProjectionSlice locate(String body, int bodyStartLine);

    static ProjectionLocator of(LocatorStrategy strategy) {
        if (strategy == LocatorStrategy.DEPTH_TRACKED) return new DepthTrackedProjectionLocator();
        return new LineAnchoredProjectionLocator();
    }
}
