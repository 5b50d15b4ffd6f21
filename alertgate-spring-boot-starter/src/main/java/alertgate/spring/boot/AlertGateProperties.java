package alertgate.spring.boot;

import alertgate.dispatch.ChunkedDispatcher;
import alertgate.model.AlertKind;
import alertgate.suppression.SuppressionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for alert suppression and dispatch.
 *
 * @see AlertGateAutoConfiguration
 */
@ConfigurationProperties(prefix = "alertgate")
public class AlertGateProperties {

    /**
     * Maximum alert ids per remote operation call.
     */
    private int chunkSize = ChunkedDispatcher.DEFAULT_CHUNK_SIZE;

    /**
     * Number of chunks dispatched concurrently. 1 dispatches sequentially.
     */
    private int parallelism = 1;

    /**
     * Whether only the latest pending alert per identity key is notified.
     */
    private boolean deduplicate = true;

    private final Suppression suppression = new Suppression();
    private final Tables tables = new Tables();
    private final Queries queries = new Queries();
    private final Executor executor = new Executor();
    private final Metrics metrics = new Metrics();

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isDeduplicate() {
        return deduplicate;
    }

    public void setDeduplicate(boolean deduplicate) {
        this.deduplicate = deduplicate;
    }

    public Suppression getSuppression() {
        return suppression;
    }

    public Tables getTables() {
        return tables;
    }

    public Queries getQueries() {
        return queries;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum ExecutorType {
        JDBC,
        RUN_OPERATION
    }

    public static class Suppression {
        private SuppressionPolicy.Mode policy = SuppressionPolicy.Mode.SENT_AT_OR_AFTER_DETECTION;

        /**
         * Window used by the WITHIN_INTERVAL policy when an alert carries no interval of its own.
         */
        private Duration defaultInterval = Duration.ofHours(24);

        public SuppressionPolicy.Mode getPolicy() {
            return policy;
        }

        public void setPolicy(SuppressionPolicy.Mode policy) {
            this.policy = policy;
        }

        public Duration getDefaultInterval() {
            return defaultInterval;
        }

        public void setDefaultInterval(Duration defaultInterval) {
            this.defaultInterval = defaultInterval;
        }
    }

    public static class Tables {
        private String test = AlertKind.TEST.defaultTableName();
        private String model = AlertKind.MODEL.defaultTableName();

        public String getTest() {
            return test;
        }

        public void setTest(String test) {
            this.test = test;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        String forKind(AlertKind kind) {
            return kind == AlertKind.TEST ? test : model;
        }
    }

    public static class Queries {
        /**
         * Only read alerts detected within this many days. Unbounded when unset.
         */
        private Integer daysBack;

        public Integer getDaysBack() {
            return daysBack;
        }

        public void setDaysBack(Integer daysBack) {
            this.daysBack = daysBack;
        }
    }

    public static class Executor {
        private ExecutorType type = ExecutorType.JDBC;
        private String binary = "dbt";
        private String projectDir;
        private String profilesDir;
        private String target;
        private Duration timeout = Duration.ofMinutes(10);

        public ExecutorType getType() {
            return type;
        }

        public void setType(ExecutorType type) {
            this.type = type;
        }

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public String getProjectDir() {
            return projectDir;
        }

        public void setProjectDir(String projectDir) {
            this.projectDir = projectDir;
        }

        public String getProfilesDir() {
            return profilesDir;
        }

        public void setProfilesDir(String profilesDir) {
            this.profilesDir = profilesDir;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "alertgate";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
