package replacer.rewrite;

/**
 * Outcome of rewriting one report definition.
 *
 * @param newContent the rewritten definition; the same string instance when nothing matched
 * @param referencesFound token-exact occurrences of the old field in character data
 * @param referencesReplaced occurrences substituted
 */
public record RewriteResult(String newContent, int referencesFound, int referencesReplaced) {

    public boolean changed() {
        return referencesReplaced > 0;
    }
}
