package domain.doc;

import domain.mapping.ResolvedSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Documentation row for one output column.
 */
public final class ColumnDocumentation {

    static final int ACCEPTED_VALUES_SHOWN = 10;

    private final String columnName;
    private final String logicalName;
    private final TransformationClass transformationClass;
    private final String transformation;
    private final List<String> acceptedValues;
    private final List<String> remarks;
    private final List<ResolvedSource> sources;
    private final String upstreamTable;
    private final String upstreamColumn;

    public ColumnDocumentation(
            String columnName,
            String logicalName,
            TransformationClass transformationClass,
            String transformation,
            List<String> acceptedValues,
            List<String> remarks,
            List<ResolvedSource> sources,
            String upstreamTable,
            String upstreamColumn
    ) {
        this.columnName = Objects.requireNonNull(columnName, "columnName");
        this.logicalName = logicalName == null ? "" : logicalName;
        this.transformationClass = Objects.requireNonNull(transformationClass, "transformationClass");
        this.transformation = transformation == null ? "" : transformation;
        this.acceptedValues = copy(acceptedValues);
        this.remarks = copy(remarks);
        this.sources = copy(sources);
        this.upstreamTable = upstreamTable == null ? "" : upstreamTable;
        this.upstreamColumn = upstreamColumn == null ? "" : upstreamColumn;
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public String getColumnName() {
        return columnName;
    }

    public String getLogicalName() {
        return logicalName;
    }

    public TransformationClass getTransformationClass() {
        return transformationClass;
    }

    public String getTransformation() {
        return transformation;
    }

    public List<String> getAcceptedValues() {
        return acceptedValues;
    }

    /** First values joined with {@code ", "}, then {@code ... (N total)} when there are more. */
    public String getAcceptedValuesDisplay() {
        if (acceptedValues.isEmpty()) return "";
        int shown = Math.min(ACCEPTED_VALUES_SHOWN, acceptedValues.size());
        String head = String.join(", ", acceptedValues.subList(0, shown));
        if (acceptedValues.size() > ACCEPTED_VALUES_SHOWN) {
            head += " ... (" + acceptedValues.size() + " total)";
        }
        return head;
    }

    public List<String> getRemarks() {
        return remarks;
    }

    public String getRemarksDisplay() {
        return String.join("; ", remarks);
    }

    public List<ResolvedSource> getSources() {
        return sources;
    }

    public String getUpstreamTable() {
        return upstreamTable;
    }

    public String getUpstreamColumn() {
        return upstreamColumn;
    }

    @Override
    public String toString() {
        return "ColumnDocumentation{" +
                "columnName='" + columnName + '\'' +
                ", class=" + transformationClass +
                ", upstream='" + upstreamTable + "." + upstreamColumn + '\'' +
                '}';
    }
}
