package domain.mapping;

import domain.model.SourceReference;

import java.util.Objects;

/** A source reference together with the upstream table its qualifier maps to (empty when unmapped). */
public final class ResolvedSource {

    private final SourceReference reference;
    private final String upstreamTable;

    public ResolvedSource(SourceReference reference, String upstreamTable) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.upstreamTable = upstreamTable == null ? "" : upstreamTable;
    }

    public SourceReference getReference() {
        return reference;
    }

    public String getUpstreamTable() {
        return upstreamTable;
    }

    public boolean isResolved() {
        return !upstreamTable.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedSource)) return false;
        ResolvedSource that = (ResolvedSource) o;
        return reference.equals(that.reference) && upstreamTable.equals(that.upstreamTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, upstreamTable);
    }

    @Override
    public String toString() {
        return reference + (isResolved() ? " <- " + upstreamTable : " <- ?");
    }
}
