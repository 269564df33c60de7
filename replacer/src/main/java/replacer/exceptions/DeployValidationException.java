package replacer.exceptions;

import java.util.List;

/**
 * Thrown when the remote platform rejects a deploy.
 *
 * <p>Carries the per-component diagnostics returned by the platform so the
 * run summary can show operators why the batch failed.
 */
public class DeployValidationException extends ConnectorException {

    private final String deployId;
    private final List<String> diagnostics;

    /**
     * Creates a new deploy validation exception.
     *
     * @param message a description of the failure
     * @param deployId the remote deploy id (may be null if the deploy never started)
     * @param diagnostics remote diagnostic lines, one per failing component
     */
    public DeployValidationException(String message, String deployId, List<String> diagnostics) {
        super(message, "deploy", null, null);
        this.deployId = deployId;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /** Returns the remote deploy id, or null. */
    public String getDeployId() {
        return deployId;
    }

    /** Returns the remote diagnostics (never null). */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (diagnostics.isEmpty()) return base;
        return base + ": " + String.join("; ", diagnostics);
    }
}
