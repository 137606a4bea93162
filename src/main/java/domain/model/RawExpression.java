package domain.model;

/** One projection item exactly as written, with its offsets in the column-list text. */
public final class RawExpression {

    private final int startOffset;
    private final int endOffset;
    private final String text;

    public RawExpression(int startOffset, int endOffset, String text) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.text = text == null ? "" : text;
    }

    public int getStartOffset() {
        return startOffset;
    }

    /** Exclusive. */
    public int getEndOffset() {
        return endOffset;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "RawExpression{" + startOffset + ".." + endOffset + ", '" + text + "'}";
    }
}
