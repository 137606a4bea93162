package domain.lineage;

import domain.config.ExtractionOptions;
import domain.model.ColumnMapping;
import domain.model.SourceReference;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one projection item into a {@link ColumnMapping}: output alias, normalized expression,
 * {@code qualifier.column} references and the conditional flag. CASE decomposition happens later.
 */
final class ColumnExpressionExtractor {

    private static final Pattern BARE_REFERENCE =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    /** Words that can never be an output alias without {@code as}. */
    private static final Set<String> NON_ALIAS_WORDS = Set.of(
            "END", "NULL", "TRUE", "FALSE", "CASE", "WHEN", "THEN", "ELSE",
            "AND", "OR", "NOT", "IS", "IN", "LIKE", "ILIKE", "BETWEEN", "AS",
            "DISTINCT", "SELECT", "FROM", "WHERE", "ON", "BY", "EXISTS", "ALL", "ANY"
    );

    /** An expression ending in one of these words still expects an operand. */
    private static final Set<String> DANGLING_WORDS = Set.of(
            "AND", "OR", "NOT", "CASE", "WHEN", "THEN", "ELSE", "IS", "IN", "LIKE", "ILIKE",
            "BETWEEN", "SELECT", "DISTINCT", "BY", "ON", "WHERE", "FROM", "INTERVAL"
    );

    private static final String OPERATOR_CHARS = "+-*/%|=<>,(!&^~:.";

    private final ExtractionOptions options;

    ColumnExpressionExtractor(ExtractionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /** @return the column, or null when no output alias can be resolved */
    ColumnMapping extract(String itemText) {
        String text = (itemText == null) ? "" : itemText.trim();
        if (text.isEmpty()) return null;

        AliasSplit split = splitAlias(text);
        if (split == null) return null;

        String expression = SqlText.normalizeWhitespace(split.expression);
        return new ColumnMapping(
                split.alias,
                expression,
                sourceReferences(expression),
                isConditional(expression),
                null
        );
    }

    static final class AliasSplit {
        final String expression;
        final String alias;

        AliasSplit(String expression, String alias) {
            this.expression = expression;
            this.alias = alias;
        }
    }

    /**
     * {@code expression [as] identifier}. A bare column reference ({@code a.col} or {@code col}) is named
     * after its last segment.
     */
    AliasSplit splitAlias(String text) {
        int end = text.length();
        int idStart = end;
        while (idStart > 0 && SqlScan.isWordChar(text.charAt(idStart - 1))) idStart--;
        if (idStart == end || !SqlScan.isIdentStart(text.charAt(idStart))) return null;

        String alias = text.substring(idStart, end).toUpperCase(Locale.ROOT);

        if (idStart == 0 || text.charAt(idStart - 1) == '.') {
            if (!BARE_REFERENCE.matcher(text).matches()) return null;
            if (isNonAlias(alias)) return null;
            return new AliasSplit(text, alias);
        }
        if (!Character.isWhitespace(text.charAt(idStart - 1))) return null;

        String before = text.substring(0, idStart).stripTrailing();
        if (endsWithWord(before, "as")) {
            String expr = before.substring(0, before.length() - 2).stripTrailing();
            return expr.isEmpty() ? null : new AliasSplit(expr, alias);
        }

        if (isNonAlias(alias) || !endsWithCompleteOperand(before)) return null;
        return new AliasSplit(before, alias);
    }

    private boolean isNonAlias(String upperWord) {
        return NON_ALIAS_WORDS.contains(upperWord) || options.isReserved(upperWord);
    }

    private static boolean endsWithWord(String s, String kw) {
        int at = s.length() - kw.length();
        return at >= 0 && SqlScan.isWordAt(s, at, kw);
    }

    private static boolean endsWithCompleteOperand(String before) {
        if (before.isEmpty()) return false;
        char last = before.charAt(before.length() - 1);
        if (OPERATOR_CHARS.indexOf(last) >= 0) return false;
        if (!SqlScan.isWordChar(last)) return true;

        int ws = before.length();
        while (ws > 0 && SqlScan.isWordChar(before.charAt(ws - 1))) ws--;
        String word = before.substring(ws).toUpperCase(Locale.ROOT);
        return !DANGLING_WORDS.contains(word);
    }

    /**
     * Qualified names outside literals. For longer chains ({@code db.schema.col}) the last two segments
     * are kept. Names followed by {@code (} are function calls and names whose column part is a reserved
     * keyword are skipped.
     */
    Set<SourceReference> sourceReferences(String expression) {
        Set<SourceReference> out = new LinkedHashSet<>();
        String m = SqlText.maskLiteralsAndComments(expression);
        int i = 0;

        while (i < m.length()) {
            char c = m.charAt(i);
            boolean boundary = i == 0 || (!SqlScan.isWordChar(m.charAt(i - 1)) && m.charAt(i - 1) != '.');
            if (!SqlScan.isIdentStart(c) || !boundary) {
                i++;
                continue;
            }

            List<String> parts = new ArrayList<>(3);
            int p = i;
            while (true) {
                int s = p;
                while (p < m.length() && SqlScan.isWordChar(m.charAt(p))) p++;
                parts.add(m.substring(s, p));
                if (p + 1 < m.length() && m.charAt(p) == '.' && SqlScan.isIdentStart(m.charAt(p + 1))) {
                    p++;
                    continue;
                }
                break;
            }
            i = p;

            if (parts.size() < 2) continue;
            if (nextNonSpace(m, p) == '(') continue;

            String column = parts.get(parts.size() - 1);
            if (options.isReserved(column)) continue;
            out.add(new SourceReference(parts.get(parts.size() - 2), column));
        }
        return out;
    }

    static boolean isConditional(String expression) {
        return SqlText.containsWord(SqlText.maskLiteralsAndComments(expression), "CASE");
    }

    private static char nextNonSpace(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i < s.length() ? s.charAt(i) : '\0';
    }
}
