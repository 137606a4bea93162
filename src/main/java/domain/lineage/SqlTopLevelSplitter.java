package domain.lineage;

import domain.model.RawExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Splits a projection list at commas outside parentheses, CASE...END blocks and quoted literals. */
final class SqlTopLevelSplitter {

    private SqlTopLevelSplitter() {
    }

    /** Split outcome plus the number of stray {@code )} / {@code END} tokens that were ignored. */
    static final class SplitResult {
        final List<RawExpression> expressions;
        final int strayClosers;

        SplitResult(List<RawExpression> expressions, int strayClosers) {
            this.expressions = Collections.unmodifiableList(expressions);
            this.strayClosers = strayClosers;
        }
    }

    static List<String> splitTopLevelByComma(String s) {
        List<String> out = new ArrayList<>();
        for (RawExpression e : split(s).expressions) {
            out.add(e.getText());
        }
        return out;
    }

    static SplitResult split(String s) {
        List<RawExpression> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return new SplitResult(out, 0);

        NestingState state = NestingState.TOP;
        int segStart = 0;
        int pos = 0;
        int stray = 0;

        while (pos < s.length()) {
            if (s.charAt(pos) == ',' && state.isTopLevel()) {
                addTrimmed(out, s, segStart, pos);
                segStart = pos + 1;
                pos++;
                continue;
            }

            DepthTracker.Step step = DepthTracker.step(s, pos, state);
            if (step.isStray()) stray++;
            state = step.state();
            pos += step.consumed();
        }

        addTrimmed(out, s, segStart, s.length());
        return new SplitResult(out, stray);
    }

    /**
     * Prepares a raw column list (comments removed, then template blocks neutralized) and splits it.
     * Placeholders at either end of a fragment are cut off; fragments left empty are dropped.
     */
    static SplitResult splitColumnList(String columnList, String placeholder) {
        String prepared = SqlText.neutralizeTemplateBlocks(SqlText.stripComments(columnList), placeholder);
        SplitResult raw = split(prepared);

        List<RawExpression> kept = new ArrayList<>(raw.expressions.size());
        for (RawExpression e : raw.expressions) {
            RawExpression cut = trimPlaceholders(prepared, e, placeholder);
            if (cut != null) kept.add(cut);
        }
        return new SplitResult(kept, raw.strayClosers);
    }

    private static RawExpression trimPlaceholders(String s, RawExpression e, String placeholder) {
        int a = e.getStartOffset();
        int b = e.getEndOffset();
        int n = placeholder.length();
        boolean changed = true;

        while (changed && a < b) {
            changed = false;
            if (b - a >= n && s.startsWith(placeholder, a)) {
                a += n;
                changed = true;
            }
            if (b - a >= n && s.startsWith(placeholder, b - n)) {
                b -= n;
                changed = true;
            }
            while (a < b && Character.isWhitespace(s.charAt(a))) a++;
            while (b > a && Character.isWhitespace(s.charAt(b - 1))) b--;
        }
        if (a >= b) return null;
        if (a == e.getStartOffset() && b == e.getEndOffset()) return e;
        return new RawExpression(a, b, s.substring(a, b));
    }

    private static void addTrimmed(List<RawExpression> out, String s, int start, int end) {
        int a = start;
        int b = end;
        while (a < b && Character.isWhitespace(s.charAt(a))) a++;
        while (b > a && Character.isWhitespace(s.charAt(b - 1))) b--;
        if (a < b) out.add(new RawExpression(a, b, s.substring(a, b)));
    }
}
