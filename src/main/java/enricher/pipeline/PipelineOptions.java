package enricher.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of one pipeline run.
 *
 * @param workerCount        number of concurrent workers
 * @param batchSize          checkpoint after every this many results
 * @param checkpointInterval checkpoint at least this often regardless of throughput
 */
public record PipelineOptions(int workerCount, int batchSize, Duration checkpointInterval) {

    public static final int DEFAULT_WORKERS = 10;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_CHECKPOINT_INTERVAL = Duration.ofSeconds(30);

    public PipelineOptions {
        Objects.requireNonNull(checkpointInterval, "checkpointInterval is required");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (checkpointInterval.isNegative() || checkpointInterval.isZero()) {
            throw new IllegalArgumentException("checkpointInterval must be positive");
        }
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(DEFAULT_WORKERS, DEFAULT_BATCH_SIZE, DEFAULT_CHECKPOINT_INTERVAL);
    }

    /** Capacity of both the task queue and the result queue. */
    public int queueCapacity() {
        return workerCount * 2;
    }
}
