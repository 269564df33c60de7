package replacer.model;

import java.util.Objects;

/**
 * Explicit run context handed to every connector call.
 *
 * @param targetOrg the org alias or username
 * @param apiVersion the metadata API version (e.g. {@code 65.0})
 */
public record OrgContext(String targetOrg, String apiVersion) {

    public static final String DEFAULT_API_VERSION = "65.0";

    public OrgContext {
        Objects.requireNonNull(targetOrg, "targetOrg");
        if (targetOrg.isBlank()) throw new IllegalArgumentException("targetOrg must not be blank");
        if (apiVersion == null || apiVersion.isBlank()) apiVersion = DEFAULT_API_VERSION;
    }

    public static OrgContext of(String targetOrg) {
        return new OrgContext(targetOrg, DEFAULT_API_VERSION);
    }
}
