package domain.lineage;

/**
 * Consumes one unit of SQL text and reports the nesting state after it.
 *
 * <p>A unit is a single character, a {@code CASE}/{@code END} keyword at word boundaries, a quoted
 * literal, a comment or a template block; the last three never change the state. A stray {@code )} or
 * {@code END} is tolerated: the depth floors at zero and the step is flagged as {@link Step#isStray()}.</p>
 */
public final class DepthTracker {

    private DepthTracker() {
    }

    public record Step(NestingState state, int consumed, boolean isStray) {
    }

    public static Step step(String text, int pos, NestingState state) {
        NestingState cur = (state == null) ? NestingState.TOP : state;
        if (text == null || pos < 0 || pos >= text.length()) {
            return new Step(cur, 0, false);
        }

        SqlScan st = new SqlScan(text, pos);
        if (st.peekIsSingleQuotedString()) return atomic(st.readSingleQuotedString(), cur);
        if (st.peekIsDoubleQuotedString()) return atomic(st.readDoubleQuotedString(), cur);
        if (st.peekIsLineComment()) return atomic(st.readLineComment(), cur);
        if (st.peekIsBlockComment()) return atomic(st.readBlockComment(), cur);
        if (st.peekIsTemplateBlock()) return atomic(st.readTemplateBlock(), cur);

        if (st.peekWord("CASE")) return new Step(cur.openCase(), 4, false);
        if (st.peekWord("END")) return new Step(cur.closeCase(), 3, cur.getCaseDepth() == 0);

        char ch = text.charAt(pos);
        if (ch == '(') return new Step(cur.openParen(), 1, false);
        if (ch == ')') return new Step(cur.closeParen(), 1, cur.getParenDepth() == 0);
        return new Step(cur, 1, false);
    }

    private static Step atomic(String token, NestingState cur) {
        return new Step(cur, Math.max(1, token.length()), false);
    }

    /** Nesting state at {@code end}, scanning from the start of the text (exclusive of {@code end}). */
    public static NestingState stateAt(String text, int end) {
        NestingState state = NestingState.TOP;
        if (text == null) return state;
        int limit = Math.min(end, text.length());
        int pos = 0;
        while (pos < limit) {
            Step step = step(text, pos, state);
            state = step.state();
            pos += step.consumed();
        }
        return state;
    }

    public static boolean isTopLevel(String text, int pos) {
        return stateAt(text, pos).isTopLevel();
    }

    /**
     * Index of the {@code )} matching the {@code (} at {@code openIdx}, or -1 when it is never closed.
     */
    public static int findMatchingParen(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length() || text.charAt(openIdx) != '(') return -1;

        NestingState state = NestingState.TOP;
        int pos = openIdx;
        while (pos < text.length()) {
            Step step = step(text, pos, state);
            int before = state.getParenDepth();
            state = step.state();
            if (step.consumed() == 1 && text.charAt(pos) == ')' && before == 1) return pos;
            pos += step.consumed();
        }
        return -1;
    }
}
