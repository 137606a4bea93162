package domain.lineage;

/**
 * Raised in fail-fast mode when a projection item has no resolvable output alias.
 */
public final class UnparseableAliasException extends RuntimeException {

    private final String model;
    private final String expression;

    public UnparseableAliasException(String model, String expression) {
        super("could not parse alias for expression" + (model == null || model.isEmpty() ? "" : " in " + model)
                + ": " + expression);
        this.model = model == null ? "" : model;
        this.expression = expression == null ? "" : expression;
    }

    public String getModel() {
        return model;
    }

    public String getExpression() {
        return expression;
    }
}
