package domain.model;

/**
 * Sink for extraction warnings.
 *
 * <p>The locator, splitter, extractor and CASE decomposer all report through a sink so that the
 * caller decides severity and output; the parsing core never prints.</p>
 */
public interface LineageWarningSink {

    static LineageWarningSink none() {
        return NullLineageWarningSink.INSTANCE;
    }

    void warn(LineageWarning warning);
}
