package replacer.config;

import replacer.model.OrgContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for replacement runs.
 *
 * <p>Groups batching, retry, timeout and workspace settings:
 * <ul>
 *   <li>Batch size and rewrite worker count</li>
 *   <li>Retry attempts and exponential backoff parameters</li>
 *   <li>Connector call timeout and deploy polling</li>
 *   <li>Failure policy, workspace location, API version and alert level</li>
 * </ul>
 *
 * <p>Loaded from {@code replacer.properties} or {@code replacer.yml} by
 * {@link ReplacerConfigLoader}, or built directly in code and tests.
 *
 * @see ReplacerConfigLoader
 */
public final class ReplacerConfig {

    public static final ReplacerConfig DEFAULTS = builder().build();

    private final int batchSize;
    private final int rewriteWorkers;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final double backoffJitter;
    private final Duration connectorTimeout;
    private final Duration deployPollInterval;
    private final Duration deployMaxWait;
    private final boolean continueOnError;
    private final Path workspaceDir;
    private final String apiVersion;
    private final AlertLevel alertLevel;

    private ReplacerConfig(Builder b) {
        this.batchSize = b.batchSize;
        this.rewriteWorkers = b.rewriteWorkers;
        this.maxAttempts = b.maxAttempts;
        this.backoffBase = b.backoffBase;
        this.backoffMax = b.backoffMax;
        this.backoffJitter = b.backoffJitter;
        this.connectorTimeout = b.connectorTimeout;
        this.deployPollInterval = b.deployPollInterval;
        this.deployMaxWait = b.deployMaxWait;
        this.continueOnError = b.continueOnError;
        this.workspaceDir = b.workspaceDir;
        this.apiVersion = b.apiVersion;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .batchSize(batchSize)
                .rewriteWorkers(rewriteWorkers)
                .maxAttempts(maxAttempts)
                .backoffBase(backoffBase)
                .backoffMax(backoffMax)
                .backoffJitter(backoffJitter)
                .connectorTimeout(connectorTimeout)
                .deployPollInterval(deployPollInterval)
                .deployMaxWait(deployMaxWait)
                .continueOnError(continueOnError)
                .workspaceDir(workspaceDir)
                .apiVersion(apiVersion)
                .alertLevel(alertLevel);
    }

    /** Default number of reports per batch. */
    public int batchSize() { return batchSize; }

    /** Size of the per-batch rewrite worker pool. */
    public int rewriteWorkers() { return rewriteWorkers; }

    /** Attempts per connector call before the batch fails; 1 disables retry. */
    public int maxAttempts() { return maxAttempts; }

    public Duration backoffBase() { return backoffBase; }

    public Duration backoffMax() { return backoffMax; }

    /** Jitter as a fraction of the computed delay, in [0, 1]. */
    public double backoffJitter() { return backoffJitter; }

    /** Timeout for a single connector call, or zero when disabled. */
    public Duration connectorTimeout() { return connectorTimeout; }

    public Duration deployPollInterval() { return deployPollInterval; }

    public Duration deployMaxWait() { return deployMaxWait; }

    /** Whether a failed batch lets the run proceed to the next one. */
    public boolean continueOnError() { return continueOnError; }

    /** Root of the persisted run layout. */
    public Path workspaceDir() { return workspaceDir; }

    public String apiVersion() { return apiVersion; }

    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the org context for the given target org with this configuration's API version. */
    public OrgContext orgContext(String targetOrg) {
        return new OrgContext(targetOrg, apiVersion);
    }

    @Override
    public String toString() {
        return "ReplacerConfig{" +
                "batchSize=" + batchSize +
                ", rewriteWorkers=" + rewriteWorkers +
                ", maxAttempts=" + maxAttempts +
                ", backoffBase=" + backoffBase.toMillis() + "ms" +
                ", backoffMax=" + backoffMax.toMillis() + "ms" +
                ", connectorTimeout=" + connectorTimeout.toSeconds() + "s" +
                ", deployMaxWait=" + deployMaxWait.toSeconds() + "s" +
                ", continueOnError=" + continueOnError +
                ", workspaceDir=" + workspaceDir +
                ", apiVersion=" + apiVersion +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for {@link ReplacerConfig}.
     */
    public static final class Builder {
        private int batchSize = 100;
        private int rewriteWorkers = 4;
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(30);
        private double backoffJitter = 0.1;
        private Duration connectorTimeout = Duration.ZERO;
        private Duration deployPollInterval = Duration.ofSeconds(5);
        private Duration deployMaxWait = Duration.ofMinutes(30);
        private boolean continueOnError = false;
        private Path workspaceDir = Path.of("report-migration");
        private String apiVersion = OrgContext.DEFAULT_API_VERSION;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder batchSize(int size) {
            if (size <= 0) throw new IllegalArgumentException("batchSize must be positive");
            this.batchSize = size;
            return this;
        }

        public Builder rewriteWorkers(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("rewriteWorkers must be positive");
            this.rewriteWorkers = workers;
            return this;
        }

        public Builder maxAttempts(int attempts) {
            if (attempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
            this.maxAttempts = attempts;
            return this;
        }

        public Builder backoffBase(Duration base) {
            this.backoffBase = Objects.requireNonNull(base, "backoffBase");
            return this;
        }

        public Builder backoffBaseMillis(long millis) {
            return backoffBase(Duration.ofMillis(Math.max(0, millis)));
        }

        public Builder backoffMax(Duration max) {
            this.backoffMax = Objects.requireNonNull(max, "backoffMax");
            return this;
        }

        public Builder backoffMaxMillis(long millis) {
            return backoffMax(Duration.ofMillis(Math.max(0, millis)));
        }

        public Builder backoffJitter(double jitter) {
            if (jitter < 0 || jitter > 1) {
                throw new IllegalArgumentException("backoffJitter must be within [0, 1]");
            }
            this.backoffJitter = jitter;
            return this;
        }

        public Builder connectorTimeout(Duration timeout) {
            this.connectorTimeout = timeout != null ? timeout : Duration.ZERO;
            return this;
        }

        public Builder connectorTimeoutSeconds(long seconds) {
            return connectorTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder deployPollInterval(Duration interval) {
            this.deployPollInterval = Objects.requireNonNull(interval, "deployPollInterval");
            return this;
        }

        public Builder deployPollIntervalSeconds(long seconds) {
            return deployPollInterval(Duration.ofSeconds(Math.max(0, seconds)));
        }

        public Builder deployMaxWait(Duration maxWait) {
            this.deployMaxWait = Objects.requireNonNull(maxWait, "deployMaxWait");
            return this;
        }

        public Builder deployMaxWaitSeconds(long seconds) {
            return deployMaxWait(Duration.ofSeconds(Math.max(0, seconds)));
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder workspaceDir(Path dir) {
            this.workspaceDir = Objects.requireNonNull(dir, "workspaceDir");
            return this;
        }

        public Builder apiVersion(String version) {
            this.apiVersion = Objects.requireNonNull(version, "apiVersion");
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public ReplacerConfig build() {
            if (backoffMax.compareTo(backoffBase) < 0) {
                throw new IllegalArgumentException("backoffMax (" + backoffMax
                        + ") must not be shorter than backoffBase (" + backoffBase + ")");
            }
            return new ReplacerConfig(this);
        }
    }
}
