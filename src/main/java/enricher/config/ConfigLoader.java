package enricher.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layers configuration: defaults, then an optional ini file, then the
 * environment (a {@code .env} file in the working directory, overridden by
 * real environment variables).
 *
 * <p>Ini sections: {@code [OPENAI]} (api_key, base_url, model, temperature,
 * max_tokens, timeout_seconds), {@code [PIPELINE]} (workers, batch_size,
 * checkpoint_seconds, sample), {@code [COST]} (input_per_million,
 * output_per_million). Every key is optional.</p>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * @param iniFile optional ini file, may be null
     * @param dotEnv  optional {@code .env} file, ignored when missing
     * @param env     process environment
     */
    public static EnrichConfig load(File iniFile, Path dotEnv, Map<String, String> env) throws IOException {
        EnrichConfig config = iniFile != null ? fromIni(iniFile) : EnrichConfig.defaults();

        Map<String, String> merged = new HashMap<>();
        if (dotEnv != null && Files.isRegularFile(dotEnv)) {
            merged.putAll(readDotEnv(dotEnv));
            log.debug("Loaded {}", dotEnv);
        }
        merged.putAll(env);
        return config.applyEnv(merged);
    }

    /**
     * Read an ini file on top of the defaults.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a value is malformed
     */
    public static EnrichConfig fromIni(File file) throws IOException {
        if (!file.isFile()) {
            throw new IOException("Config file not found: " + file);
        }
        Ini ini = new Ini(file);
        EnrichConfig cfg = EnrichConfig.defaults();

        Profile.Section openai = ini.get("OPENAI");
        Profile.Section pipeline = ini.get("PIPELINE");
        Profile.Section cost = ini.get("COST");

        // OPENAI
        String apiKey = opt(openai, "api_key");
        if (apiKey != null) cfg.withApiKey(apiKey);
        String baseUrl = opt(openai, "base_url");
        if (baseUrl != null) cfg.withBaseUrl(baseUrl);
        String model = opt(openai, "model");
        if (model != null) cfg.withModel(model);
        String temperature = opt(openai, "temperature");
        if (temperature != null) cfg.withTemperature(EnrichConfig.parseDouble("temperature", temperature));
        String maxTokens = opt(openai, "max_tokens");
        if (maxTokens != null) cfg.withMaxTokens(EnrichConfig.parseInt("max_tokens", maxTokens));
        String timeout = opt(openai, "timeout_seconds");
        if (timeout != null) cfg.withRequestTimeout(Duration.ofSeconds(EnrichConfig.parseInt("timeout_seconds", timeout)));

        // PIPELINE
        String workers = opt(pipeline, "workers");
        if (workers != null) cfg.withWorkers(EnrichConfig.parseInt("workers", workers));
        String batch = opt(pipeline, "batch_size");
        if (batch != null) cfg.withBatchSize(EnrichConfig.parseInt("batch_size", batch));
        String interval = opt(pipeline, "checkpoint_seconds");
        if (interval != null) cfg.withCheckpointInterval(Duration.ofSeconds(EnrichConfig.parseInt("checkpoint_seconds", interval)));
        String sample = opt(pipeline, "sample");
        if (sample != null) cfg.withSampleSize(EnrichConfig.parseInt("sample", sample));

        // COST
        double in = cfg.inputPrice();
        double out = cfg.outputPrice();
        String inPrice = opt(cost, "input_per_million");
        if (inPrice != null) in = EnrichConfig.parseDouble("input_per_million", inPrice);
        String outPrice = opt(cost, "output_per_million");
        if (outPrice != null) out = EnrichConfig.parseDouble("output_per_million", outPrice);
        cfg.withPrices(in, out);

        log.info("Loaded config from {}", file);
        return cfg;
    }

    /**
     * Read the variables declared in a {@code .env} file. A missing file yields
     * an empty map; malformed lines are skipped.
     */
    public static Map<String, String> readDotEnv(Path file) {
        Path dir = file.toAbsolutePath().getParent();
        Dotenv dotenv = Dotenv.configure()
                .directory(dir == null ? "." : dir.toString())
                .filename(file.getFileName().toString())
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, String> vars = new LinkedHashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            vars.put(entry.getKey(), entry.getValue());
        }
        return vars;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null)
            return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
