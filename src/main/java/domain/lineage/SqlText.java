package domain.lineage;

/**
 * Text helpers shared by the locator, splitter and extractor. All of them skip quoted literals.
 */
final class SqlText {

    private SqlText() {
    }

    /**
     * Same-length copy with quoted literals, comments and template blocks blanked out (line breaks kept), so keyword
     * and identifier searches never match inside them while offsets stay valid.
     */
    static String maskLiteralsAndComments(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = new StringBuilder(s.length());
        SqlScan st = new SqlScan(s);

        while (st.hasNext()) {
            if (st.peekIsLineComment()) { blank(out, st.readLineComment()); continue; }
            if (st.peekIsBlockComment()) { blank(out, st.readBlockComment()); continue; }
            if (st.peekIsTemplateBlock()) { blank(out, st.readTemplateBlock()); continue; }
            if (st.peekIsSingleQuotedString()) { blank(out, st.readSingleQuotedString()); continue; }
            if (st.peekIsDoubleQuotedString()) { blank(out, st.readDoubleQuotedString()); continue; }
            out.append(st.read());
        }
        return out.toString();
    }

    private static void blank(StringBuilder out, String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            out.append(c == '\n' || c == '\r' ? c : ' ');
        }
    }

    /** Removes line and block comments outside literals and template blocks. Line breaks survive. */
    static String stripComments(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = new StringBuilder(s.length());
        SqlScan st = new SqlScan(s);

        while (st.hasNext()) {
            if (st.peekIsLineComment()) {
                String c = st.readLineComment();
                if (c.endsWith("\n")) out.append('\n');
                continue;
            }
            if (st.peekIsBlockComment()) { st.readBlockComment(); out.append(' '); continue; }
            if (st.peekIsTemplateBlock()) { out.append(st.readTemplateBlock()); continue; }
            if (st.peekIsSingleQuotedString()) { out.append(st.readSingleQuotedString()); continue; }
            if (st.peekIsDoubleQuotedString()) { out.append(st.readDoubleQuotedString()); continue; }
            out.append(st.read());
        }
        return out.toString();
    }

    /** Replaces {@code {% ... %}} and {@code {# ... #}} blocks outside literals and comments with a placeholder token. */
    static String neutralizeTemplateBlocks(String s, String placeholder) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = new StringBuilder(s.length());
        SqlScan st = new SqlScan(s);

        while (st.hasNext()) {
            if (st.peekIsLineComment()) { out.append(st.readLineComment()); continue; }
            if (st.peekIsBlockComment()) { out.append(st.readBlockComment()); continue; }
            if (st.peekIsSingleQuotedString()) { out.append(st.readSingleQuotedString()); continue; }
            if (st.peekIsDoubleQuotedString()) { out.append(st.readDoubleQuotedString()); continue; }
            if (st.peekIsTemplateBlock()) {
                st.readTemplateBlock();
                out.append(' ').append(placeholder).append(' ');
                continue;
            }
            out.append(st.read());
        }
        return out.toString();
    }

    /** Collapses whitespace runs to one space outside literals and trims. */
    static String normalizeWhitespace(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = new StringBuilder(s.length());
        SqlScan st = new SqlScan(s.trim());
        boolean pendingSpace = false;

        while (st.hasNext()) {
            if (Character.isWhitespace(st.peek())) {
                st.readSpaces();
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                out.append(' ');
                pendingSpace = false;
            }
            if (st.peekIsTemplateBlock()) { out.append(st.readTemplateBlock()); continue; }
            if (st.peekIsSingleQuotedString()) { out.append(st.readSingleQuotedString()); continue; }
            if (st.peekIsDoubleQuotedString()) { out.append(st.readDoubleQuotedString()); continue; }
            out.append(st.read());
        }
        return out.toString();
    }

    /** True when {@code line}, after leading whitespace, starts with keyword {@code kw} as a whole word. */
    static boolean startsWithWord(String line, String kw) {
        if (line == null) return false;
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return SqlScan.isWordAt(line, i, kw);
    }

    static boolean containsWord(String s, String kw) {
        return indexOfWord(s, kw, 0) >= 0;
    }

    static int indexOfWord(String s, String kw, int from) {
        if (s == null || kw == null || kw.isEmpty()) return -1;
        int i = Math.max(0, from);
        while (true) {
            int hit = indexOfIgnoreCase(s, kw, i);
            if (hit < 0) return -1;
            if (SqlScan.isWordAt(s, hit, kw)) return hit;
            i = hit + 1;
        }
    }

    static int countWord(String s, String kw) {
        int n = 0;
        int i = indexOfWord(s, kw, 0);
        while (i >= 0) {
            n++;
            i = indexOfWord(s, kw, i + kw.length());
        }
        return n;
    }

    private static int indexOfIgnoreCase(String s, String needle, int from) {
        int max = s.length() - needle.length();
        for (int i = from; i <= max; i++) {
            if (s.regionMatches(true, i, needle, 0, needle.length())) return i;
        }
        return -1;
    }

    static int lineOf(String s, int offset) {
        int line = 0;
        int end = Math.min(offset, s.length());
        for (int i = 0; i < end; i++) {
            if (s.charAt(i) == '\n') line++;
        }
        return line;
    }
}
