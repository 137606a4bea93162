package domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A {@code qualifier.column} reference found in a column expression. Both parts are stored upper-cased.
 */
public final class SourceReference {

    private final String qualifier;
    private final String column;

    public SourceReference(String qualifier, String column) {
        this.qualifier = upper(Objects.requireNonNull(qualifier, "qualifier"));
        this.column = upper(Objects.requireNonNull(column, "column"));
    }

    /** Parses {@code a.b}; returns null when the text is not a two-part name. */
    public static SourceReference parse(String qualified) {
        if (qualified == null) return null;
        String t = qualified.trim();
        int dot = t.indexOf('.');
        if (dot <= 0 || dot == t.length() - 1 || t.indexOf('.', dot + 1) >= 0) return null;
        return new SourceReference(t.substring(0, dot), t.substring(dot + 1));
    }

    private static String upper(String s) {
        return s.trim().toUpperCase(Locale.ROOT);
    }

    public String getQualifier() {
        return qualifier;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceReference)) return false;
        SourceReference that = (SourceReference) o;
        return qualifier.equals(that.qualifier) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, column);
    }

    @Override
    public String toString() {
        return qualifier + "." + column;
    }
}
