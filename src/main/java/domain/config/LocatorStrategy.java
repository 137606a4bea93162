package domain.config;

/** How the outermost SELECT/FROM pair of the terminal CTE is located. */
public enum LocatorStrategy {

    /**
     * First line starting with {@code select}, then the first later line starting with {@code from}.
     * Relies on the outermost SELECT/FROM of the terminal CTE being written on their own lines.
     */
    LINE_ANCHORED,

    /**
     * First {@code select} and following {@code from} keyword at parenthesis and CASE depth zero.
     */
    DEPTH_TRACKED
}
