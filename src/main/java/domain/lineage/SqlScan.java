package domain.lineage;

/**
 * Cursor over SQL text with look-ahead helpers for the tokens we keep atomic
 * (quoted literals, comments, template blocks).
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    SqlScan(String s, int pos) {
        this(s);
        this.pos = Math.max(0, pos);
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    /** Case-insensitive keyword match at the cursor, bounded by non-word chars on both sides. */
    boolean peekWord(String kw) {
        return isWordAt(s, pos, kw);
    }

    static boolean isWordAt(String text, int at, String kw) {
        int n = kw.length();
        if (at < 0 || at + n > text.length()) return false;
        if (at > 0 && isWordChar(text.charAt(at - 1))) return false;

        for (int i = 0; i < n; i++) {
            if (Character.toUpperCase(text.charAt(at + i)) != Character.toUpperCase(kw.charAt(i))) return false;
        }
        return at + n >= text.length() || !isWordChar(text.charAt(at + n));
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    /** {@code {% ... %}} statement block or {@code {# ... #}} template comment. */
    boolean peekIsTemplateBlock() {
        return pos + 1 < s.length() && s.charAt(pos) == '{'
                && (s.charAt(pos + 1) == '%' || s.charAt(pos + 1) == '#');
    }

    String readTemplateBlock() {
        int start = pos;
        char marker = s.charAt(pos + 1);
        String close = marker + "}";
        int end = s.indexOf(close, pos + 2);
        if (end < 0) {
            pos = s.length();
            return s.substring(start);
        }
        pos = end + 2;
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        int start = pos;
        pos++; // '
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\'') {
                // escaped ''
                if (pos < s.length() && s.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    String readDoubleQuotedString() {
        int start = pos;
        pos++; // "
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '"') break;
        }
        return s.substring(start, pos);
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos < s.length()) {
            if (pos + 1 < s.length() && s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        return s.substring(start, pos);
    }

    /** Skips whitespace and SQL comments. */
    void skipSpacesAndComments() {
        while (hasNext()) {
            if (Character.isWhitespace(peek())) { pos++; continue; }
            if (peekIsLineComment()) { readLineComment(); continue; }
            if (peekIsBlockComment()) { readBlockComment(); continue; }
            break;
        }
    }
}
