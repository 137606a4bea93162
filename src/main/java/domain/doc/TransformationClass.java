package domain.doc;

/** Documentation class of a column transformation. */
public enum TransformationClass {
    /** Pass-through of an upstream column. */
    R3("R3"),
    /** Anything computed. */
    R3_PLUS("R3+");

    private final String label;

    TransformationClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
