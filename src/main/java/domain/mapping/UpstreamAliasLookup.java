package domain.mapping;

/**
 * Read-only lookup from a CTE alias / qualifier to the upstream table it reads.
 *
 * <p>Keeps documentation building testable without any configuration store.</p>
 */
public interface UpstreamAliasLookup {

    /** @return upstream table name, or null when the qualifier is not mapped */
    String find(String qualifier);

    static UpstreamAliasLookup none() {
        return qualifier -> null;
    }
}
