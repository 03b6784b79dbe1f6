package com.sentinel.core.config;

import com.sentinel.core.model.CascadeMode;
import com.sentinel.core.model.LineCountMode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Configuration for the Integration Sentinel.
 * <p>
 * Binds {@code sentinel.*} from application.yml / environment variables.
 * The object is handed to the injector and runner constructors, so tests can
 * build alternate configurations side by side in one JVM.
 *
 * <pre>
 * sentinel:
 *   enabled: true
 *   mode: auto            # or human-gated
 *   max-files: 3
 *   max-lines: 150
 *   allow-interface: false
 *   tiers:
 *     local:
 *       base-url: http://localhost:1234
 *     cloud:
 *       budget-usd: 2.0
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private static final Logger log = LoggerFactory.getLogger(SentinelProperties.class);

    private boolean enabled = false;
    private String mode = "auto";
    private int maxFiles = 3;
    private int maxLines = 150;
    private boolean allowInterface = false;
    private String lineCountMode = "gross";
    private String projectRoot = ".";
    private String auditDir = ".sentinel/runs";
    private String taskList = "tasks.md";
    private Validation validation = new Validation();
    private Tiers tiers = new Tiers();

    @PostConstruct
    void validate() {
        if (maxFiles < 0 || maxLines < 0) {
            throw new IllegalStateException(
                    "sentinel.max-files and sentinel.max-lines must be >= 0 (got %d, %d)"
                            .formatted(maxFiles, maxLines));
        }
        requirePositive("local", tiers.local);
        requirePositive("cloud", tiers.cloud);
        if (tiers.cloud.budgetUsd <= 0) {
            throw new IllegalStateException("sentinel.tiers.cloud.budget-usd must be > 0");
        }
        // fail fast on typos rather than on the first violation
        cascadeMode();
        lineCounting();
        if (enabled) {
            log.info("Sentinel enabled: mode={}, max-files={}, max-lines={}, allow-interface={}",
                    mode, maxFiles, maxLines, allowInterface);
        } else {
            log.info("Sentinel disabled");
        }
    }

    private static void requirePositive(String name, Tier tier) {
        if (tier.maxIterations <= 0 || tier.timeoutSeconds <= 0) {
            throw new IllegalStateException(
                    "sentinel.tiers.%s needs max-iterations > 0 and timeout-seconds > 0".formatted(name));
        }
    }

    public CascadeMode cascadeMode() {
        return CascadeMode.fromString(mode);
    }

    public LineCountMode lineCounting() {
        return LineCountMode.valueOf(lineCountMode.trim().toUpperCase());
    }

    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    public Path auditDirPath() {
        return projectRootPath().resolve(auditDir).normalize();
    }

    public Path taskListPath() {
        return projectRootPath().resolve(taskList).normalize();
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public int getMaxFiles() { return maxFiles; }
    public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }
    public int getMaxLines() { return maxLines; }
    public void setMaxLines(int maxLines) { this.maxLines = maxLines; }
    public boolean isAllowInterface() { return allowInterface; }
    public void setAllowInterface(boolean allowInterface) { this.allowInterface = allowInterface; }
    public String getLineCountMode() { return lineCountMode; }
    public void setLineCountMode(String lineCountMode) { this.lineCountMode = lineCountMode; }
    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getAuditDir() { return auditDir; }
    public void setAuditDir(String auditDir) { this.auditDir = auditDir; }
    public String getTaskList() { return taskList; }
    public void setTaskList(String taskList) { this.taskList = taskList; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public Tiers getTiers() { return tiers; }
    public void setTiers(Tiers tiers) { this.tiers = tiers; }

    public static class Validation {
        private String command = "mvn -B -q test";
        private int timeoutSeconds = 600;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Tiers {
        private Tier local = Tier.local();
        private Tier cloud = Tier.cloud();

        public Tier getLocal() { return local; }
        public void setLocal(Tier local) { this.local = local; }
        public Tier getCloud() { return cloud; }
        public void setCloud(Tier cloud) { this.cloud = cloud; }
    }

    /**
     * Endpoint and budget of one model tier. The local tier has no monetary
     * budget; its cost rates stay at zero.
     */
    public static class Tier {
        private String baseUrl = "";
        private String probePath = "/v1/models";
        private String apiKey = "";
        private String model = "";
        private int maxIterations;
        private int timeoutSeconds;
        private double budgetUsd;
        private double inputCostPer1k;
        private double outputCostPer1k;

        static Tier local() {
            var tier = new Tier();
            tier.baseUrl = "http://localhost:1234";
            tier.apiKey = "lm-studio";
            tier.model = "qwen2.5-coder-7b-instruct";
            tier.maxIterations = 5;
            tier.timeoutSeconds = 300;
            tier.budgetUsd = 0.0;
            return tier;
        }

        static Tier cloud() {
            var tier = new Tier();
            tier.baseUrl = "https://api.openai.com";
            tier.model = "gpt-4o";
            tier.maxIterations = 10;
            tier.timeoutSeconds = 600;
            tier.budgetUsd = 2.0;
            tier.inputCostPer1k = 0.0025;
            tier.outputCostPer1k = 0.01;
            return tier;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getProbePath() { return probePath; }
        public void setProbePath(String probePath) { this.probePath = probePath; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public double getBudgetUsd() { return budgetUsd; }
        public void setBudgetUsd(double budgetUsd) { this.budgetUsd = budgetUsd; }
        public double getInputCostPer1k() { return inputCostPer1k; }
        public void setInputCostPer1k(double inputCostPer1k) { this.inputCostPer1k = inputCostPer1k; }
        public double getOutputCostPer1k() { return outputCostPer1k; }
        public void setOutputCostPer1k(double outputCostPer1k) { this.outputCostPer1k = outputCostPer1k; }
    }
}
