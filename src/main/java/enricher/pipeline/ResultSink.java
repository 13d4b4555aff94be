package enricher.pipeline;

import enricher.checkpoint.CheckpointWriter;
import enricher.core.ShutdownSignal;
import enricher.model.OutputTable;
import enricher.model.RowResult;
import enricher.model.RowTask;
import enricher.model.RunStatistics;
import enricher.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer of worker results and sole writer of the output table.
 *
 * <p>Checkpoints are taken every {@code batchSize} results, whenever the
 * checkpoint interval elapses, once when cancellation is first seen, and once
 * when the result stream ends. After cancellation the sink keeps draining until
 * the workers close the stream, so every dispatched task is accounted for.</p>
 */
final class ResultSink {

    private static final Logger log = LoggerFactory.getLogger(ResultSink.class);

    /** Offered by the cancel listener so a waiting poll returns early. */
    static final RowResult WAKE_UP = RowResult.success(new RowTask(-1, null), Map.of(), 0);

    private final BlockingQueue<RowResult> results;
    private final OutputTable table;
    private final RunStatistics stats;
    private final CheckpointWriter checkpoints;
    private final ProgressListener progress;
    private final ShutdownSignal signal;
    private final int batchSize;
    private final long intervalNanos;

    private int applied;
    private int checkpointFailures;

    ResultSink(BlockingQueue<RowResult> results,
            OutputTable table,
            RunStatistics stats,
            CheckpointWriter checkpoints,
            ProgressListener progress,
            ShutdownSignal signal,
            int batchSize,
            Duration checkpointInterval) {
        this.results = results;
        this.table = table;
        this.stats = stats;
        this.checkpoints = checkpoints;
        this.progress = progress;
        this.signal = signal;
        this.batchSize = batchSize;
        this.intervalNanos = checkpointInterval.toNanos();
    }

    /**
     * Drain results until the worker pool closes the stream.
     *
     * @return number of results applied
     */
    int drain() {
        boolean cancelSeen = false;
        boolean interrupted = false;
        long nextCheckpoint = System.nanoTime() + intervalNanos;

        try (ShutdownSignal.Registration wake = signal.onCancel(() -> results.offer(WAKE_UP))) {
            while (true) {
                long wait = nextCheckpoint - System.nanoTime();
                if (wait <= 0) {
                    checkpoint("interval");
                    nextCheckpoint = System.nanoTime() + intervalNanos;
                    continue;
                }

                RowResult result;
                try {
                    result = results.poll(wait, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                    signal.cancel("interrupted");
                    continue;
                }

                if (result == null) {
                    continue;
                }
                if (result == WorkerPool.END_OF_RESULTS) {
                    break;
                }
                if (result != WAKE_UP) {
                    apply(result);
                    if (applied % batchSize == 0) {
                        checkpoint("batch");
                    }
                }
                if (!cancelSeen && signal.isCancelled()) {
                    cancelSeen = true;
                    checkpoint("shutdown");
                }
            }
        }

        checkpoint("final");
        if (checkpointFailures > 0) {
            log.warn("{} checkpoint(s) failed during the run", checkpointFailures);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return applied;
    }

    private void apply(RowResult result) {
        table.apply(result.rowIndex(), result.values());
        if (result.isFailure()) {
            stats.recordFailure(result.costUnits());
        } else {
            stats.recordSuccess(result.costUnits());
        }
        applied++;
        progress.onProgress(stats.snapshot());
    }

    private void checkpoint(String trigger) {
        try {
            checkpoints.checkpoint(table);
            log.debug("Checkpoint ({}) after {} results", trigger, applied);
        } catch (IOException e) {
            checkpointFailures++;
            log.warn("Checkpoint ({}) failed, continuing: {}", trigger, e.getMessage());
        }
    }
}
