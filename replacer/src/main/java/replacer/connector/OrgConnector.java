package replacer.connector;

import replacer.exceptions.ConnectorException;
import replacer.exceptions.DeployValidationException;
import replacer.exceptions.MetadataNotFoundException;
import replacer.exceptions.OrgAuthException;
import replacer.exceptions.RateLimitException;
import replacer.model.DeployResult;
import replacer.model.FieldReference;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;

import java.util.List;

/**
 * Capability interface to the remote org: search, retrieve, deploy and field lookup.
 *
 * <p>This is the only seam between the engine and the platform. Implementations do not
 * retry; retry and backoff are the orchestrator's business. Each method is a single
 * remote round trip (or a short bounded sequence of them), so the caller can put it under
 * a timeout.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link OrgAuthException} - credentials are missing, expired or rejected</li>
 *   <li>{@link RateLimitException} - the org refused the call for API limits; transient</li>
 *   <li>{@link replacer.exceptions.TransientConnectorException} - any other failure worth retrying</li>
 *   <li>{@link MetadataNotFoundException} - a requested component does not exist</li>
 *   <li>{@link DeployValidationException} - the org rejected a deploy</li>
 * </ul>
 *
 * <p>Implementations must be safe to call from the orchestrator thread; the engine never
 * calls a connector from more than one thread at a time.
 */
public interface OrgConnector {

    /**
     * Checks that the field exists on its object.
     *
     * @throws ConnectorException if the lookup itself fails
     */
    boolean fieldExists(OrgContext ctx, FieldReference field) throws ConnectorException;

    /**
     * Finds the reports that may reference the field.
     *
     * <p>The result may be a superset: a connector that cannot search report content
     * server-side returns every report. The returned descriptors carry identifiers only.
     */
    List<ReportDescriptor> findReportsReferencing(OrgContext ctx, FieldReference field) throws ConnectorException;

    /**
     * Retrieves the definitions of the given reports.
     *
     * @return descriptors with {@code rawDefinition} filled, one per requested report that exists
     * @throws MetadataNotFoundException if none of the requested reports could be found
     */
    List<ReportDescriptor> retrieve(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException;

    /**
     * Starts an asynchronous deploy of the given definitions.
     *
     * @return the remote deploy id, to be polled with {@link #checkDeploy}
     */
    String startDeploy(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException;

    /**
     * Reports the current state of a deploy.
     *
     * @throws DeployValidationException if the org reports the deploy as rejected
     */
    DeployResult checkDeploy(OrgContext ctx, String deployId) throws ConnectorException;
}
