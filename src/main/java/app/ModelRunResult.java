package app;

/**
 * Outcome row of one model in a batch run.
 */
public final class ModelRunResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String SKIP = "SKIP";

    /** SUCCESS / SKIP */
    private final String status;
    private final String modelName;

    /** reason for SKIP, empty on success */
    private final String message;

    private final long elapsedMs;

    public ModelRunResult(String status, String modelName, String message, long elapsedMs) {
        this.status = status == null ? "" : status;
        this.modelName = modelName == null ? "" : modelName;
        this.message = message == null ? "" : message;
        this.elapsedMs = elapsedMs;
    }

    public static ModelRunResult success(String modelName, long elapsedMs) {
        return new ModelRunResult(SUCCESS, modelName, "", elapsedMs);
    }

    public static ModelRunResult skip(String modelName, String reason, long elapsedMs) {
        return new ModelRunResult(SKIP, modelName, reason, elapsedMs);
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getModelName() {
        return modelName;
    }

    public String getMessage() {
        return message;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return status + " " + modelName + (message.isEmpty() ? "" : " (" + message + ")");
    }
}
