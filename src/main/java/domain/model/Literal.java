package domain.model;

import java.util.Objects;

/**
 * A decoded CASE result value tagged with the syntax it was written in.
 *
 * <p>{@link #getText()} holds the value without quotes (an escaped {@code ''} becomes {@code '}).
 * {@link #render()} restores the SQL spelling so renderers can quote strings and leave integers and
 * bare words unquoted.</p>
 */
public final class Literal {

    private final LiteralKind kind;
    private final String text;

    public Literal(LiteralKind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Literal singleQuoted(String text) {
        return new Literal(LiteralKind.SINGLE_QUOTED, text);
    }

    public static Literal doubleQuoted(String text) {
        return new Literal(LiteralKind.DOUBLE_QUOTED, text);
    }

    public static Literal integer(String digits) {
        return new Literal(LiteralKind.INTEGER, digits);
    }

    public static Literal bareWord(String word) {
        return new Literal(LiteralKind.BARE_WORD, word);
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isString() {
        return kind == LiteralKind.SINGLE_QUOTED || kind == LiteralKind.DOUBLE_QUOTED;
    }

    public String render() {
        switch (kind) {
            case SINGLE_QUOTED:
                return "'" + text.replace("'", "''") + "'";
            case DOUBLE_QUOTED:
                return "\"" + text + "\"";
            default:
                return text;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal that = (Literal) o;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return render();
    }
}
