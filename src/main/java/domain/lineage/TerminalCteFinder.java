package domain.lineage;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the terminal CTE: {@code <name> as ( ... )} directly followed by {@code select * from <name>}.
 */
final class TerminalCteFinder {

    private static final Pattern SELECT_STAR_FROM =
            Pattern.compile("(?i)select\\s*\\*\\s*from\\s+([A-Za-z_][A-Za-z0-9_]*)\\b");

    private TerminalCteFinder() {
    }

    /** Body of the terminal CTE and the line it starts on. */
    static final class CteBody {
        final String name;
        final String text;
        /** 1-based line of the first body character. */
        final int startLine;

        CteBody(String name, String text, int startLine) {
            this.name = name;
            this.text = text;
            this.startLine = startLine;
        }
    }

    static CteBody find(String sql, String cteName) {
        if (sql == null || sql.isEmpty() || cteName == null || cteName.isBlank()) return null;

        String name = cteName.trim();
        String masked = SqlText.maskLiteralsAndComments(sql);
        Pattern head = Pattern.compile("(?i)(?<![A-Za-z0-9_])" + Pattern.quote(name) + "\\s+as\\s*\\(");
        Matcher m = head.matcher(masked);

        while (m.find()) {
            int open = m.end() - 1;
            int close = DepthTracker.findMatchingParen(masked, open);
            if (close < 0) continue;

            SqlScan st = new SqlScan(masked, close + 1);
            st.skipSpacesAndComments();

            Matcher tail = SELECT_STAR_FROM.matcher(masked).region(st.pos, masked.length());
            if (tail.lookingAt() && tail.group(1).equalsIgnoreCase(name)) {
                String body = sql.substring(open + 1, close);
                return new CteBody(name, body, SqlText.lineOf(sql, open + 1) + 1);
            }
        }
        return null;
    }

    /** Name in the last top-level {@code select * from <name>} of the model, or null. */
    static String detectTerminalName(String sql) {
        if (sql == null || sql.isEmpty()) return null;
        String masked = SqlText.maskLiteralsAndComments(sql);
        Matcher m = SELECT_STAR_FROM.matcher(masked);

        String last = null;
        while (m.find()) {
            if (DepthTracker.isTopLevel(masked, m.start())) last = m.group(1);
        }
        return last;
    }
}
