package replacer.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A field on an object, as it appears inside a report definition ({@code Object.Field}).
 *
 * <p>Structural equality; immutable.
 *
 * @param objectName the object API name (e.g. {@code Account})
 * @param fieldName the field API name (e.g. {@code OldField__c})
 */
public record FieldReference(String objectName, String fieldName) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    public FieldReference {
        Objects.requireNonNull(objectName, "objectName");
        Objects.requireNonNull(fieldName, "fieldName");
        if (!IDENTIFIER.matcher(objectName).matches()) {
            throw new IllegalArgumentException("Invalid object name: '" + objectName + "'");
        }
        if (!IDENTIFIER.matcher(fieldName).matches()) {
            throw new IllegalArgumentException("Invalid field name: '" + fieldName + "'");
        }
    }

    /**
     * Parses a qualified {@code Object.Field} token.
     *
     * @param qualified the qualified name
     * @return the field reference
     * @throws IllegalArgumentException if the token is not exactly two identifier segments
     */
    public static FieldReference parse(String qualified) {
        Objects.requireNonNull(qualified, "qualified");
        String trimmed = qualified.trim();
        int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot != trimmed.lastIndexOf('.') || dot == trimmed.length() - 1) {
            throw new IllegalArgumentException(
                    "Field reference must look like Object.Field, got '" + qualified + "'");
        }
        return new FieldReference(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    /** Returns {@code objectName + "." + fieldName}. */
    public String qualifiedName() {
        return objectName + "." + fieldName;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
