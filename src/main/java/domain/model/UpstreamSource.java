package domain.model;

import java.util.Objects;

/**
 * An upstream relation referenced by a dbt model through {@code ref()} or {@code source()}.
 */
public final class UpstreamSource {

    public enum Kind {
        REF,
        SOURCE
    }

    private final Kind kind;
    private final String schema;
    private final String name;

    private UpstreamSource(Kind kind, String schema, String name) {
        this.kind = kind;
        this.schema = schema == null ? "" : schema;
        this.name = Objects.requireNonNull(name, "name");
    }

    public static UpstreamSource ref(String model) {
        return new UpstreamSource(Kind.REF, "", model);
    }

    public static UpstreamSource source(String schema, String table) {
        return new UpstreamSource(Kind.SOURCE, schema, table);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /** {@code name} for refs, {@code schema__name} for sources. */
    public String getFullName() {
        return kind == Kind.SOURCE ? schema + "__" + name : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpstreamSource)) return false;
        UpstreamSource that = (UpstreamSource) o;
        return kind == that.kind && schema.equals(that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, schema, name);
    }

    @Override
    public String toString() {
        return kind + ":" + getFullName();
    }
}
