package replacer.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a remote deploy.
 *
 * @param deployId the remote deploy id
 * @param status current status
 * @param componentFailures one diagnostic line per failing component (empty on success)
 */
public record DeployResult(String deployId, DeployStatus status, List<String> componentFailures) {

    public DeployResult {
        Objects.requireNonNull(deployId, "deployId");
        Objects.requireNonNull(status, "status");
        componentFailures = componentFailures == null ? List.of() : List.copyOf(componentFailures);
    }

    public static DeployResult succeeded(String deployId) {
        return new DeployResult(deployId, DeployStatus.SUCCEEDED, List.of());
    }

    public static DeployResult inProgress(String deployId) {
        return new DeployResult(deployId, DeployStatus.IN_PROGRESS, List.of());
    }

    public static DeployResult failed(String deployId, List<String> failures) {
        return new DeployResult(deployId, DeployStatus.FAILED, failures);
    }

    /** True only when the deploy finished and every component succeeded. */
    public boolean isSuccess() {
        return status == DeployStatus.SUCCEEDED && componentFailures.isEmpty();
    }
}
