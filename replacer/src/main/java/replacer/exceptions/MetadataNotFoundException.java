package replacer.exceptions;

/**
 * Thrown when a field, object or report does not exist in the org.
 *
 * <p>Raised eagerly by {@link replacer.locate.ReportLocator} before any batching when the
 * field being replaced (or its replacement) is missing from the org schema.
 */
public class MetadataNotFoundException extends ConnectorException {

    public MetadataNotFoundException(String message) {
        super(message);
    }

    public MetadataNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
