package wingman.sf;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * The {@code --json} envelope printed by every {@code sf} command.
 *
 * <pre>
 * {"status": 0, "result": {...}}
 * {"status": 1, "name": "NoOrgFound", "message": "No authorization information found for dev-sandbox."}
 * </pre>
 *
 * @param status 0 on success
 * @param name error name, or null
 * @param message error message, or null
 * @param result the result payload, never null
 */
public record SfResponse(int status, String name, String message, JsonNode result) {

    public SfResponse {
        if (result == null) result = MissingNode.getInstance();
    }

    static SfResponse of(JsonNode root, int exitCode) {
        int status = root.path("status").asInt(exitCode);
        return new SfResponse(status, text(root, "name"), text(root, "message"), root.path("result"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public boolean ok() {
        return status == 0;
    }

    /** The error as one line, e.g. {@code NoOrgFound: No authorization information found}. */
    public String describe() {
        if (name == null) return message != null ? message : "status " + status;
        return message != null ? name + ": " + message : name;
    }
}
