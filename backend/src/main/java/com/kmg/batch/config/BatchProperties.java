package com.kmg.batch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "batch")
public class BatchProperties {
    @Valid
    @NotNull
    private Output output = new Output();
    @Valid
    @NotNull
    private Provider provider = new Provider();
    @Valid
    @NotNull
    private Orchestrator orchestrator = new Orchestrator();
    @Valid
    @NotNull
    private Encoder encoder = new Encoder();
    @Valid
    @NotNull
    private Planner planner = new Planner();
    @Valid
    @NotNull
    private Costs costs = new Costs();

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Encoder getEncoder() {
        return encoder;
    }

    public void setEncoder(Encoder encoder) {
        this.encoder = encoder;
    }

    public Planner getPlanner() {
        return planner;
    }

    public void setPlanner(Planner planner) {
        this.planner = planner;
    }

    public Costs getCosts() {
        return costs;
    }

    public void setCosts(Costs costs) {
        this.costs = costs;
    }

    public Path outputDirPath() {
        return Path.of(output.getDir());
    }

    public static class Output {
        @NotBlank
        private String dir = "batch_results";
        @NotBlank
        private String ledgerFile = "batch_status.json";
        @NotBlank
        private String costDbFile = "batch_costs.db";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getLedgerFile() {
            return ledgerFile;
        }

        public void setLedgerFile(String ledgerFile) {
            this.ledgerFile = ledgerFile;
        }

        public String getCostDbFile() {
            return costDbFile;
        }

        public void setCostDbFile(String costDbFile) {
            this.costDbFile = costDbFile;
        }
    }

    public static class Provider {
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        @NotBlank
        private String endpoint = "/v1/chat/completions";
        @NotBlank
        private String completionWindow = "24h";
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(30);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration readTimeout = Duration.ofMinutes(5);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getCompletionWindow() {
            return completionWindow;
        }

        public void setCompletionWindow(String completionWindow) {
            this.completionWindow = completionWindow;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Orchestrator {
        @Min(1)
        private int batchSize = 20;
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration jobTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration delayAfterSuccess = Duration.ofSeconds(30);
        @NotNull
        private Duration delayAfterFailure = Duration.ofSeconds(60);
        @NotNull
        private Duration delayBetweenRetries = Duration.ofSeconds(60);
        private boolean autoRetry = false;
        @NotNull
        private VerificationMode verification = VerificationMode.EXACT;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
        }

        public Duration getDelayAfterSuccess() {
            return delayAfterSuccess;
        }

        public void setDelayAfterSuccess(Duration delayAfterSuccess) {
            this.delayAfterSuccess = delayAfterSuccess;
        }

        public Duration getDelayAfterFailure() {
            return delayAfterFailure;
        }

        public void setDelayAfterFailure(Duration delayAfterFailure) {
            this.delayAfterFailure = delayAfterFailure;
        }

        public Duration getDelayBetweenRetries() {
            return delayBetweenRetries;
        }

        public void setDelayBetweenRetries(Duration delayBetweenRetries) {
            this.delayBetweenRetries = delayBetweenRetries;
        }

        public boolean isAutoRetry() {
            return autoRetry;
        }

        public void setAutoRetry(boolean autoRetry) {
            this.autoRetry = autoRetry;
        }

        public VerificationMode getVerification() {
            return verification;
        }

        public void setVerification(VerificationMode verification) {
            this.verification = verification;
        }
    }

    public static class Encoder {
        @NotBlank
        private String model = "gpt-4o-mini";
        @Min(1)
        private long maxImageBytes = 20L * 1024 * 1024;
        @Min(1)
        private long maxEncodedBytes = 20L * 1024 * 1024;
        @Min(1)
        private int maxPromptChars = 4000;
        @Min(1)
        private int maxTokens = 1000;
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;
        @NotBlank
        private String imageColumn = "Image Path";
        @NotBlank
        private String promptColumn = "Content of P*";

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getMaxImageBytes() {
            return maxImageBytes;
        }

        public void setMaxImageBytes(long maxImageBytes) {
            this.maxImageBytes = maxImageBytes;
        }

        public long getMaxEncodedBytes() {
            return maxEncodedBytes;
        }

        public void setMaxEncodedBytes(long maxEncodedBytes) {
            this.maxEncodedBytes = maxEncodedBytes;
        }

        public int getMaxPromptChars() {
            return maxPromptChars;
        }

        public void setMaxPromptChars(int maxPromptChars) {
            this.maxPromptChars = maxPromptChars;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public String getImageColumn() {
            return imageColumn;
        }

        public void setImageColumn(String imageColumn) {
            this.imageColumn = imageColumn;
        }

        public String getPromptColumn() {
            return promptColumn;
        }

        public void setPromptColumn(String promptColumn) {
            this.promptColumn = promptColumn;
        }
    }

    public static class Planner {
        @Min(1)
        private int maxGap = 5;

        public int getMaxGap() {
            return maxGap;
        }

        public void setMaxGap(int maxGap) {
            this.maxGap = maxGap;
        }
    }

    public static class Costs {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double batchDiscount = 0.5;
        @Min(0)
        private int avgInputTokens = 1200;
        @Min(0)
        private int avgOutputTokens = 200;
        @NotBlank
        private String fallbackModel = "gpt-4o-mini";
        @NotNull
        private Map<String, Pricing> pricing = new LinkedHashMap<>();

        public double getBatchDiscount() {
            return batchDiscount;
        }

        public void setBatchDiscount(double batchDiscount) {
            this.batchDiscount = batchDiscount;
        }

        public int getAvgInputTokens() {
            return avgInputTokens;
        }

        public void setAvgInputTokens(int avgInputTokens) {
            this.avgInputTokens = avgInputTokens;
        }

        public int getAvgOutputTokens() {
            return avgOutputTokens;
        }

        public void setAvgOutputTokens(int avgOutputTokens) {
            this.avgOutputTokens = avgOutputTokens;
        }

        public String getFallbackModel() {
            return fallbackModel;
        }

        public void setFallbackModel(String fallbackModel) {
            this.fallbackModel = fallbackModel;
        }

        public Map<String, Pricing> getPricing() {
            return pricing;
        }

        public void setPricing(Map<String, Pricing> pricing) {
            this.pricing = pricing;
        }
    }

    /**
     * USD per one million tokens.
     */
    public static class Pricing {
        private double input;
        private double output;

        public Pricing() {
        }

        public Pricing(double input, double output) {
            this.input = input;
            this.output = output;
        }

        public double getInput() {
            return input;
        }

        public void setInput(double input) {
            this.input = input;
        }

        public double getOutput() {
            return output;
        }

        public void setOutput(double output) {
            this.output = output;
        }
    }

    public enum VerificationMode {
        EXACT,
        ANY
    }
}
