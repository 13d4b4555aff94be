package enricher.config;

import enricher.pipeline.PipelineOptions;
import enricher.progress.CostModel;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for an enrichment run.
 * All settings have sensible defaults; see {@link ConfigLoader} for the
 * ini file and environment layers.
 */
public final class EnrichConfig {

    public static final String ENV_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_BASE_URL = "OPENAI_BASE_URL";
    public static final String ENV_MODEL = "ENRICHER_MODEL";
    public static final String ENV_WORKERS = "ENRICHER_WORKERS";
    public static final String ENV_BATCH_SIZE = "ENRICHER_BATCH_SIZE";

    // OpenAI settings
    private String apiKey = null;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private double temperature = 0.3;
    private int maxTokens = 500;
    private Duration requestTimeout = Duration.ofSeconds(60);

    // Pipeline settings
    private int workerCount = PipelineOptions.DEFAULT_WORKERS;
    private int batchSize = PipelineOptions.DEFAULT_BATCH_SIZE;
    private Duration checkpointInterval = PipelineOptions.DEFAULT_CHECKPOINT_INTERVAL;
    private int sampleSize = 5;

    // Cost settings, USD per million tokens
    private double inputPrice = CostModel.GPT_4O_MINI.inputPricePerMillion();
    private double outputPrice = CostModel.GPT_4O_MINI.outputPricePerMillion();

    private EnrichConfig() {
    }

    public static EnrichConfig defaults() {
        return new EnrichConfig();
    }

    public static EnrichConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Override settings from environment-style variables. Blank values are ignored.
     *
     * @throws IllegalArgumentException if a numeric variable is not a number
     */
    public EnrichConfig applyEnv(Map<String, String> env) {
        String key = env.get(ENV_API_KEY);
        if (key != null && !key.isBlank()) {
            apiKey = key.trim();
        }

        String url = env.get(ENV_BASE_URL);
        if (url != null && !url.isBlank()) {
            baseUrl = url.trim();
        }

        String m = env.get(ENV_MODEL);
        if (m != null && !m.isBlank()) {
            model = m.trim();
        }

        String workers = env.get(ENV_WORKERS);
        if (workers != null && !workers.isBlank()) {
            workerCount = parseInt(ENV_WORKERS, workers);
        }

        String batch = env.get(ENV_BATCH_SIZE);
        if (batch != null && !batch.isBlank()) {
            batchSize = parseInt(ENV_BATCH_SIZE, batch);
        }

        return this;
    }

    /**
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public EnrichConfig validate() {
        if (workerCount < 1)
            throw new IllegalArgumentException("workers must be >= 1");
        if (batchSize < 1)
            throw new IllegalArgumentException("batch size must be >= 1");
        if (sampleSize < 0)
            throw new IllegalArgumentException("sample size must be >= 0");
        if (maxTokens < 1)
            throw new IllegalArgumentException("max tokens must be >= 1");
        if (temperature < 0 || temperature > 2)
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        if (requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("request timeout must be positive");
        if (checkpointInterval.isNegative() || checkpointInterval.isZero())
            throw new IllegalArgumentException("checkpoint interval must be positive");
        return this;
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }

    static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value);
        }
    }

    // Getters
    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String model() {
        return model;
    }

    public double temperature() {
        return temperature;
    }

    public int maxTokens() {
        return maxTokens;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int workerCount() {
        return workerCount;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration checkpointInterval() {
        return checkpointInterval;
    }

    public int sampleSize() {
        return sampleSize;
    }

    public double inputPrice() {
        return inputPrice;
    }

    public double outputPrice() {
        return outputPrice;
    }

    public PipelineOptions pipelineOptions() {
        return new PipelineOptions(workerCount, batchSize, checkpointInterval);
    }

    public CostModel costModel() {
        return new CostModel(inputPrice, outputPrice);
    }

    // Fluent setters
    public EnrichConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public EnrichConfig withBaseUrl(String url) {
        this.baseUrl = url;
        return this;
    }

    public EnrichConfig withModel(String model) {
        this.model = model;
        return this;
    }

    public EnrichConfig withTemperature(double temperature) {
        this.temperature = temperature;
        return this;
    }

    public EnrichConfig withMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
        return this;
    }

    public EnrichConfig withRequestTimeout(Duration timeout) {
        this.requestTimeout = timeout;
        return this;
    }

    public EnrichConfig withWorkers(int workers) {
        this.workerCount = workers;
        return this;
    }

    public EnrichConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public EnrichConfig withCheckpointInterval(Duration interval) {
        this.checkpointInterval = interval;
        return this;
    }

    public EnrichConfig withSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
        return this;
    }

    public EnrichConfig withPrices(double inputPerMillion, double outputPerMillion) {
        this.inputPrice = inputPerMillion;
        this.outputPrice = outputPerMillion;
        return this;
    }

    @Override
    public String toString() {
        return "EnrichConfig{" +
                "baseUrl='" + baseUrl + '\'' +
                ", model='" + model + '\'' +
                ", workers=" + workerCount +
                ", batchSize=" + batchSize +
                ", checkpointInterval=" + checkpointInterval +
                ", sample=" + sampleSize +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
