package domain.lineage;

import domain.model.CaseBranch;
import domain.model.CaseLogic;
import domain.model.Literal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decomposes a single CASE block into ordered WHEN/THEN branches and an optional ELSE.
 *
 * <p>Only literal results are accepted: single-quoted, double-quoted, unsigned integer or bare word,
 * tried in that order. Nested or repeated CASE blocks and computed results yield
 * {@link CaseLogic#empty()} instead of a partial answer.</p>
 */
final class CaseDecomposer {

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern BARE_WORD = Pattern.compile("\\w+");

    private enum Keyword {
        WHEN, THEN, ELSE
    }

    private static final class Token {
        final Keyword keyword;
        final int pos;

        Token(Keyword keyword, int pos) {
            this.keyword = keyword;
            this.pos = pos;
        }

        int bodyStart() {
            return pos + 4;
        }
    }

    private CaseDecomposer() {
    }

    static CaseLogic decompose(String expression) {
        if (expression == null || expression.isEmpty()) return CaseLogic.empty();

        String masked = SqlText.maskLiteralsAndComments(expression);
        if (SqlText.countWord(masked, "CASE") != 1) return CaseLogic.empty();

        int casePos = SqlText.indexOfWord(masked, "CASE", 0);
        List<Token> tokens = new ArrayList<>();
        int endPos = scanBlock(masked, casePos, tokens);
        if (endPos < 0 || tokens.isEmpty() || tokens.get(0).keyword != Keyword.WHEN) return CaseLogic.empty();

        String operand = SqlText.normalizeWhitespace(expression.substring(casePos + 4, tokens.get(0).pos));

        List<CaseBranch> branches = new ArrayList<>();
        int i = 0;
        while (i < tokens.size() && tokens.get(i).keyword == Keyword.WHEN) {
            if (i + 1 >= tokens.size() || tokens.get(i + 1).keyword != Keyword.THEN) return CaseLogic.empty();

            Token when = tokens.get(i);
            Token then = tokens.get(i + 1);
            int valueEnd = (i + 2 < tokens.size()) ? tokens.get(i + 2).pos : endPos;

            String condition = SqlText.normalizeWhitespace(expression.substring(when.bodyStart(), then.pos));
            Literal result = parseLiteral(expression.substring(then.bodyStart(), valueEnd));
            if (condition.isEmpty() || result == null) return CaseLogic.empty();

            branches.add(new CaseBranch(condition, result));
            i += 2;
        }

        Literal elseLiteral = null;
        if (i < tokens.size()) {
            Token last = tokens.get(i);
            if (last.keyword != Keyword.ELSE || i != tokens.size() - 1) return CaseLogic.empty();
            elseLiteral = parseLiteral(expression.substring(last.bodyStart(), endPos));
            if (elseLiteral == null) return CaseLogic.empty();
        }

        return new CaseLogic(operand, branches, elseLiteral);
    }

    /**
     * Collects WHEN/THEN/ELSE keywords that belong to the CASE at {@code casePos} (not inside parentheses)
     * and returns the offset of its END, or -1 when the block is never closed.
     */
    private static int scanBlock(String masked, int casePos, List<Token> tokens) {
        NestingState state = NestingState.TOP;
        int pos = casePos;

        while (pos < masked.length()) {
            if (state.getCaseDepth() == 1 && state.getParenDepth() == 0) {
                Keyword kw = keywordAt(masked, pos);
                if (kw != null) {
                    tokens.add(new Token(kw, pos));
                    pos += 4;
                    continue;
                }
            }

            DepthTracker.Step step = DepthTracker.step(masked, pos, state);
            if (state.getCaseDepth() == 1 && step.state().getCaseDepth() == 0) return pos;
            state = step.state();
            pos += step.consumed();
        }
        return -1;
    }

    private static Keyword keywordAt(String s, int pos) {
        for (Keyword k : Keyword.values()) {
            if (SqlScan.isWordAt(s, pos, k.name())) return k;
        }
        return null;
    }

    /** Whole value must be one literal; returns null otherwise. */
    static Literal parseLiteral(String raw) {
        String v = (raw == null) ? "" : raw.trim();
        if (v.isEmpty()) return null;

        if (v.charAt(0) == '\'') {
            SqlScan st = new SqlScan(v);
            String tok = st.readSingleQuotedString();
            if (st.pos != v.length() || tok.length() < 2 || !tok.endsWith("'")) return null;
            return Literal.singleQuoted(tok.substring(1, tok.length() - 1).replace("''", "'"));
        }
        if (v.charAt(0) == '"') {
            SqlScan st = new SqlScan(v);
            String tok = st.readDoubleQuotedString();
            if (st.pos != v.length() || tok.length() < 2 || !tok.endsWith("\"")) return null;
            return Literal.doubleQuoted(tok.substring(1, tok.length() - 1));
        }
        if (INTEGER.matcher(v).matches()) return Literal.integer(v);
        if (BARE_WORD.matcher(v).matches()) return Literal.bareWord(v);
        return null;
    }
}
