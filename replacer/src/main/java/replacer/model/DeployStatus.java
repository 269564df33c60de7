package replacer.model;

/**
 * Remote deploy status as reported while polling.
 */
public enum DeployStatus {
    QUEUED,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }
}
