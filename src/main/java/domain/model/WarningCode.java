package domain.model;

/**
 * Standard warning codes for lineage extraction.
 *
 * <p>Keep the set small and stable. Every code is local to one model or one column; none of them
 * stops a batch.</p>
 */
public enum WarningCode {

    /**
     * Terminal CTE, or its SELECT/FROM lines, could not be located. The model yields no columns.
     */
    STRUCTURE_NOT_FOUND,

    /**
     * A projection item has no resolvable output alias and was skipped.
     */
    ALIAS_UNPARSEABLE,

    /**
     * A conditional expression could not be decomposed into literal WHEN/THEN branches.
     */
    CASE_UNPARSEABLE,

    /**
     * A stray closing parenthesis or END keyword was ignored while splitting.
     */
    UNBALANCED_NESTING,

    /**
     * A source reference qualifier has no entry in the injected upstream alias mapping.
     */
    UPSTREAM_ALIAS_UNRESOLVED,

    /**
     * SQL text is empty and the model is skipped.
     */
    SQL_TEXT_EMPTY,

    /**
     * Extraction failed with an unexpected exception.
     */
    EXTRACTION_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_MODEL
}
