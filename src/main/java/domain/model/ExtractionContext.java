package domain.model;

/**
 * Per-model context used for warning attribution.
 */
public final class ExtractionContext {

    private final String modelName;

    public ExtractionContext(String modelName) {
        this.modelName = modelName == null ? "" : modelName.trim();
    }

    public static ExtractionContext anonymous() {
        return new ExtractionContext("");
    }

    public String getModelName() {
        return modelName;
    }
}
