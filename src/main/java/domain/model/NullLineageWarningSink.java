package domain.model;
/** No-op warning sink. */
final class NullLineageWarningSink implements LineageWarningSink {

    static final NullLineageWarningSink INSTANCE = new NullLineageWarningSink();

    private NullLineageWarningSink() {
    }

    @Override
    public void warn(LineageWarning warning) {
        // no-op
    }
}
