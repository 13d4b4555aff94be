package enricher.pipeline;

import enricher.checkpoint.CheckpointWriter;
import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.OutputTable;
import enricher.model.RowResult;
import enricher.model.RowTask;
import enricher.model.RunOutcome;
import enricher.model.RunStatistics;
import enricher.model.StatsSnapshot;
import enricher.model.Table;
import enricher.progress.ProgressListener;
import enricher.transform.RowTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Drives one enrichment run: task source thread, worker pool, and the result
 * sink on the calling thread.
 *
 * <pre>
 * TaskSource -> [tasks] -> WorkerPool (N) -> [results] -> ResultSink -> OutputTable
 *                                                          +-> CheckpointWriter / ProgressListener
 * </pre>
 *
 * Returns when every dispatched task has a result applied and the final
 * checkpoint has been attempted. Producing the final artifact is up to the caller
 * ({@link CheckpointWriter#commit}).
 */
public final class EnrichmentPipeline {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipeline.class);

    private final RowTransform transform;
    private final PipelineOptions options;

    public EnrichmentPipeline(RowTransform transform, PipelineOptions options) {
        this.transform = transform;
        this.options = options;
    }

    /**
     * @throws IllegalArgumentException if the targets are empty or clash with input columns
     */
    public PipelineResult run(Table input,
            List<ColumnSpec> targets,
            String instruction,
            CheckpointWriter checkpoints,
            ProgressListener progress,
            ShutdownSignal signal) {
        OutputTable table = OutputTable.widen(input, targets);
        RunStatistics stats = RunStatistics.start(input.rowCount());

        BlockingQueue<RowTask> tasks = new ArrayBlockingQueue<>(options.queueCapacity());
        BlockingQueue<RowResult> results = new ArrayBlockingQueue<>(options.queueCapacity());

        TaskSource source = new TaskSource(input, tasks, signal);
        WorkerPool pool = new WorkerPool(options.workerCount(), transform, targets, instruction,
                tasks, results, signal);
        ResultSink sink = new ResultSink(results, table, stats, checkpoints, progress, signal,
                options.batchSize(), options.checkpointInterval());

        Thread producer = new Thread(source, "task-source");
        producer.setDaemon(true);

        log.info("Run started: {} rows, {} target columns, {} workers, batch {}",
                input.rowCount(), targets.size(), options.workerCount(), options.batchSize());

        try (ShutdownSignal.Registration stopProducer = signal.onCancel(producer::interrupt)) {
            pool.start();
            producer.start();
            sink.drain();
        } catch (RuntimeException e) {
            signal.cancel("pipeline failure");
            pool.abort();
            throw e;
        } finally {
            pool.shutdown();
            joinQuietly(producer);
        }

        StatsSnapshot snapshot = stats.snapshot();
        RunOutcome outcome = signal.isCancelled() && !snapshot.isComplete()
                ? RunOutcome.CANCELLED
                : RunOutcome.COMPLETED;
        log.info("Run {}: {} completed, {} failed, {} dispatched, {} withdrawn, {} cost units",
                outcome, snapshot.completed(), snapshot.failed(), pool.dispatched(),
                source.withdrawn(), snapshot.costUnits());
        return new PipelineResult(table, snapshot, outcome, pool.dispatched());
    }

    public PipelineOptions options() {
        return options;
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
