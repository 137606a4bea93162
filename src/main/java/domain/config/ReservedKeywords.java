package domain.config;

import java.util.Set;

/**
 * Keywords that never count as the column part of a {@code qualifier.column} reference.
 */
public final class ReservedKeywords {

    public static final Set<String> DEFAULTS = Set.of(
            "SELECT", "FROM", "WHERE", "CASE", "WHEN", "THEN", "ELSE", "END",
            "AND", "OR", "AS", "IS", "NOT", "NULL", "IN", "LIKE", "BETWEEN",
            "EXISTS", "ALL", "ANY", "TRUE", "FALSE"
    );

    private ReservedKeywords() {
    }
}
