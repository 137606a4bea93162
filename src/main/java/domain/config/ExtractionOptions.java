package domain.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Extraction settings.
 *
 * <p>Defaults can be overridden with JVM system properties (see {@link #fromSystemProperties()}):</p>
 * <ul>
 *   <li>{@code lineage.terminalCte} - terminal CTE name, default {@code final}; blank means auto-detect</li>
 *   <li>{@code lineage.locator} - {@code LINE_ANCHORED} (default) or {@code DEPTH_TRACKED}</li>
 *   <li>{@code lineage.failFast} - throw on the first projection item without alias, default false</li>
 *   <li>{@code lineage.reservedKeywords.extra} - comma list added to the reserved keyword set</li>
 *   <li>{@code lineage.templatePlaceholder} - token that replaces {@code {% ... %}} blocks</li>
 * </ul>
 */
public final class ExtractionOptions {

    public static final String PROP_TERMINAL_CTE = "lineage.terminalCte";
    public static final String PROP_LOCATOR = "lineage.locator";
    public static final String PROP_FAIL_FAST = "lineage.failFast";
    public static final String PROP_RESERVED_EXTRA = "lineage.reservedKeywords.extra";
    public static final String PROP_TEMPLATE_PLACEHOLDER = "lineage.templatePlaceholder";

    public static final String DEFAULT_TERMINAL_CTE = "final";
    public static final String DEFAULT_TEMPLATE_PLACEHOLDER = "[template]";

    private final String terminalCte;
    private final LocatorStrategy locator;
    private final boolean failFast;
    private final Set<String> reservedKeywords;
    private final String templatePlaceholder;

    private ExtractionOptions(Builder b) {
        this.terminalCte = b.terminalCte == null ? "" : b.terminalCte.trim();
        this.locator = b.locator == null ? LocatorStrategy.LINE_ANCHORED : b.locator;
        this.failFast = b.failFast;
        this.reservedKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(b.reservedKeywords));
        this.templatePlaceholder = (b.templatePlaceholder == null || b.templatePlaceholder.isBlank())
                ? DEFAULT_TEMPLATE_PLACEHOLDER
                : b.templatePlaceholder.trim();
    }

    public static ExtractionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ExtractionOptions fromSystemProperties() {
        Builder b = builder()
                .terminalCte(System.getProperty(PROP_TERMINAL_CTE, DEFAULT_TERMINAL_CTE))
                .locator(ConfigValues.parseLocator(System.getProperty(PROP_LOCATOR), LocatorStrategy.LINE_ANCHORED))
                .failFast(ConfigValues.parseBoolean(System.getProperty(PROP_FAIL_FAST), false))
                .templatePlaceholder(System.getProperty(PROP_TEMPLATE_PLACEHOLDER, DEFAULT_TEMPLATE_PLACEHOLDER));
        b.addReservedKeywords(ConfigValues.parseWordList(System.getProperty(PROP_RESERVED_EXTRA)));
        return b.build();
    }

    /** Empty when the terminal CTE should be detected from the trailing {@code select * from <name>}. */
    public String getTerminalCte() {
        return terminalCte;
    }

    public LocatorStrategy getLocator() {
        return locator;
    }

    public boolean isFailFast() {
        return failFast;
    }

    /** Upper-cased. */
    public Set<String> getReservedKeywords() {
        return reservedKeywords;
    }

    public boolean isReserved(String word) {
        return word != null && reservedKeywords.contains(word.toUpperCase(Locale.ROOT));
    }

    public String getTemplatePlaceholder() {
        return templatePlaceholder;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.terminalCte = terminalCte;
        b.locator = locator;
        b.failFast = failFast;
        b.reservedKeywords.clear();
        b.reservedKeywords.addAll(reservedKeywords);
        b.templatePlaceholder = templatePlaceholder;
        return b;
    }

    @Override
    public String toString() {
        return "ExtractionOptions{" +
                "terminalCte='" + terminalCte + '\'' +
                ", locator=" + locator +
                ", failFast=" + failFast +
                ", reservedKeywords=" + reservedKeywords.size() +
                ", templatePlaceholder='" + templatePlaceholder + '\'' +
                '}';
    }

    public static final class Builder {
        private String terminalCte = DEFAULT_TERMINAL_CTE;
        private LocatorStrategy locator = LocatorStrategy.LINE_ANCHORED;
        private boolean failFast;
        private final Set<String> reservedKeywords = new LinkedHashSet<>(ReservedKeywords.DEFAULTS);
        private String templatePlaceholder = DEFAULT_TEMPLATE_PLACEHOLDER;

        private Builder() {
        }

        public Builder terminalCte(String name) {
            this.terminalCte = name;
            return this;
        }

        /** Detect the terminal CTE from the model text. */
        public Builder detectTerminalCte() {
            this.terminalCte = "";
            return this;
        }

        public Builder locator(LocatorStrategy locator) {
            this.locator = locator;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder addReservedKeywords(Collection<String> words) {
            if (words == null) return this;
            for (String w : words) {
                if (w != null && !w.isBlank()) reservedKeywords.add(w.trim().toUpperCase(Locale.ROOT));
            }
            return this;
        }

        public Builder addReservedKeywords(String... words) {
            return words == null ? this : addReservedKeywords(Arrays.asList(words));
        }

        /** Replaces the whole reserved set, defaults included. */
        public Builder reservedKeywords(Collection<String> words) {
            reservedKeywords.clear();
            return addReservedKeywords(words);
        }

        public Builder templatePlaceholder(String placeholder) {
            this.templatePlaceholder = placeholder;
            return this;
        }

        public ExtractionOptions build() {
            return new ExtractionOptions(this);
        }
    }
}
