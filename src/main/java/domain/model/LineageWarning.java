package domain.model;

/**
 * A single diagnostic emitted during extraction.
 *
 * <p>Warnings are not fatal; they tell the caller which columns are missing or only partially
 * described.</p>
 */
public final class LineageWarning {

    private final WarningCode code;
    private final String model;
    private final String column;
    private final String message;
    private final String detail;

    public LineageWarning(
            WarningCode code,
            String model,
            String column,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.EXTRACTION_ERROR : code;
        this.model = nullToEmpty(model);
        this.column = nullToEmpty(column);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static LineageWarning of(WarningCode code, ExtractionContext ctx, String message, String detail) {
        return new LineageWarning(code, ctx == null ? "" : ctx.getModelName(), "", message, detail);
    }

    public static LineageWarning ofColumn(WarningCode code, ExtractionContext ctx, String column,
                                          String message, String detail) {
        return new LineageWarning(code, ctx == null ? "" : ctx.getModelName(), column, message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getModel() {
        return model;
    }

    public String getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code).append(']');
        if (!model.isEmpty()) sb.append(' ').append(model);
        if (!column.isEmpty()) sb.append('.').append(column);
        sb.append(": ").append(message);
        if (!detail.isEmpty()) sb.append(" (").append(detail).append(')');
        return sb.toString();
    }
}
