package enricher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import enricher.service.EnrichmentService;
import enricher.simulation.SimulatedRowTransform;
import enricher.transform.OpenAiRowTransform;
import enricher.transform.RowTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;

/**
 * Manual dependency injection container for the enrich command.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(config, false)) {
 *     deps.enrichmentService().enrich(...);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    /** Simulated mode: latency range and cost per call. */
    static final int SIM_DELAY_MIN_MS = 50;
    static final int SIM_DELAY_MAX_MS = 250;
    static final long SIM_COST_PER_CALL = 150;

    private final EnrichConfig config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final RowTransform transform;
    private final EnrichmentService enrichmentService;

    private Dependencies(EnrichConfig config, boolean simulate) {
        this.config = config;

        log.info("Initializing dependencies with config: {} (simulate={})", config, simulate);

        this.objectMapper = new ObjectMapper();
        if (simulate) {
            this.httpClient = null;
            this.transform = new SimulatedRowTransform(SIM_DELAY_MIN_MS, SIM_DELAY_MAX_MS, 0.0, SIM_COST_PER_CALL);
        } else {
            this.httpClient = HttpClient.newBuilder()
                    .connectTimeout(config.requestTimeout())
                    .build();
            this.transform = new OpenAiRowTransform(httpClient, objectMapper, config);
        }
        this.enrichmentService = new EnrichmentService(transform, config.pipelineOptions());

        log.info("Dependencies initialized successfully");
    }

    /**
     * @param simulate use the offline transform instead of the API
     * @throws IllegalStateException if the API key is missing and {@code simulate} is off
     */
    public static Dependencies create(EnrichConfig config, boolean simulate) {
        return new Dependencies(config, simulate);
    }

    // Getters
    public EnrichConfig config() {
        return config;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public RowTransform transform() {
        return transform;
    }

    public EnrichmentService enrichmentService() {
        return enrichmentService;
    }

    public boolean isSimulated() {
        return httpClient == null;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; its threads are daemons
        log.info("Dependencies closed");
    }
}
