package domain.analysis;

import java.util.Objects;

/** Name and SQL text of one dbt model. */
public final class ModelSource {

    private final String name;
    private final String sqlText;

    public ModelSource(String name, String sqlText) {
        this.name = Objects.requireNonNull(name, "name");
        this.sqlText = sqlText == null ? "" : sqlText;
    }

    public static ModelSource of(String name, String sqlText) {
        return new ModelSource(name, sqlText);
    }

    public String getName() {
        return name;
    }

    public String getSqlText() {
        return sqlText;
    }

    public boolean isBlank() {
        return sqlText.isBlank();
    }

    @Override
    public String toString() {
        return "ModelSource{" + name + ", chars=" + sqlText.length() + '}';
    }
}
