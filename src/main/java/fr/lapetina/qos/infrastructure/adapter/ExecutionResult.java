package fr.lapetina.qos.infrastructure.adapter;

/**
 * Outcome reported by a {@link CommandExecutor}.
 *
 * @param output device output, possibly empty
 * @param error  failure description, null on success
 */
public record ExecutionResult(boolean success, String output, String error) {

    public ExecutionResult {
        output = output != null ? output : "";
    }

    public static ExecutionResult success(String output) {
        return new ExecutionResult(true, output, null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, "", error);
    }

    /**
     * Text describing a failure: the error when the executor gave one, else the device output.
     */
    public String failureReason() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return output.isBlank() ? "device reported a failure without output" : output;
    }
}
