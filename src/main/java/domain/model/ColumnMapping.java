package domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One output column of a model: alias, normalized expression, upstream references and, for
 * conditional expressions, the decomposed CASE logic.
 *
 * <p>Immutable. {@link #getCaseLogic()} is present exactly when {@link #isConditional()} is true; it may
 * be {@link CaseLogic#isEmpty() empty} when the CASE could not be decomposed.</p>
 */
public final class ColumnMapping {

    private final String alias;
    private final String expression;
    private final Set<SourceReference> sourceReferences;
    private final boolean conditional;
    private final CaseLogic caseLogic;

    public ColumnMapping(
            String alias,
            String expression,
            Set<SourceReference> sourceReferences,
            boolean conditional,
            CaseLogic caseLogic
    ) {
        this.alias = Objects.requireNonNull(alias, "alias");
        if (alias.isBlank()) throw new IllegalArgumentException("alias is blank");
        this.expression = expression == null ? "" : expression;
        this.sourceReferences = sourceReferences == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sourceReferences));
        this.conditional = conditional;
        this.caseLogic = conditional ? (caseLogic == null ? CaseLogic.empty() : caseLogic) : null;
    }

    public String getAlias() {
        return alias;
    }

    public String getExpression() {
        return expression;
    }

    public Set<SourceReference> getSourceReferences() {
        return sourceReferences;
    }

    public boolean isConditional() {
        return conditional;
    }

    public Optional<CaseLogic> getCaseLogic() {
        return Optional.ofNullable(caseLogic);
    }

    /** Same column with the given CASE logic attached. */
    public ColumnMapping withCaseLogic(CaseLogic logic) {
        return new ColumnMapping(alias, expression, sourceReferences, conditional, logic);
    }

    @Override
    public String toString() {
        return "ColumnMapping{" +
                "alias='" + alias + '\'' +
                ", expression='" + expression + '\'' +
                ", sourceReferences=" + sourceReferences +
                ", conditional=" + conditional +
                '}';
    }
}
