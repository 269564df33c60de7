package replacer.config;

/**
 * Thrown when replacer configuration cannot be loaded.
 *
 * <p>Unchecked, so configuration loading can sit in startup code without forced handling.
 *
 * @see ReplacerConfigLoader
 */
public class ReplacerConfigException extends RuntimeException {

    public ReplacerConfigException(String message) {
        super(message);
    }

    public ReplacerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
