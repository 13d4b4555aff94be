package enricher.pipeline;

import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.RowResult;
import enricher.model.RowTask;
import enricher.transform.RowTransform;
import enricher.transform.TransformException;
import enricher.transform.TransformOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers. Each one pulls a task, runs the row transform and
 * emits exactly one result before pulling the next.
 *
 * <p>Workers never touch the output table. Cancellation is checked between
 * tasks; a task already pulled is always finished. The last worker to exit
 * puts {@link #END_OF_RESULTS} on the result queue.</p>
 */
final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    /** End-of-stream marker, compared by identity. */
    static final RowResult END_OF_RESULTS = RowResult.success(new RowTask(-1, null), Map.of(), 0);

    private final int workerCount;
    private final RowTransform transform;
    private final List<ColumnSpec> targets;
    private final String instruction;
    private final BlockingQueue<RowTask> tasks;
    private final BlockingQueue<RowResult> results;
    private final ShutdownSignal signal;

    private final AtomicInteger dispatched = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private ExecutorService executor;

    WorkerPool(int workerCount,
            RowTransform transform,
            List<ColumnSpec> targets,
            String instruction,
            BlockingQueue<RowTask> tasks,
            BlockingQueue<RowResult> results,
            ShutdownSignal signal) {
        this.workerCount = workerCount;
        this.transform = transform;
        this.targets = List.copyOf(targets);
        this.instruction = instruction;
        this.tasks = tasks;
        this.results = results;
        this.signal = signal;
    }

    void start() {
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "row-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running.set(workerCount);
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::workLoop);
        }
        log.info("Started {} workers", workerCount);
    }

    /**
     * Wait for the workers to exit. They exit on their own once the task
     * stream ends, so this only bounds the wait.
     */
    void shutdown() {
        if (executor == null)
            return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Interrupt all workers. Only used when the run is being abandoned. */
    void abort() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Tasks pulled by a worker so far. */
    int dispatched() {
        return dispatched.get();
    }

    private void workLoop() {
        int done = 0;
        try {
            while (!signal.isCancelled()) {
                RowTask task = tasks.take();
                if (task == TaskSource.END_OF_TASKS) {
                    tasks.offer(task);
                    break;
                }
                dispatched.incrementAndGet();
                results.put(process(task));
                done++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.debug("{} exiting after {} tasks", Thread.currentThread().getName(), done);
            if (running.decrementAndGet() == 0) {
                closeResults();
            }
        }
    }

    RowResult process(RowTask task) {
        try {
            TransformOutcome outcome = transform.transform(task.row(), targets, instruction, signal);
            List<String> missing = outcome.missing(targets);
            if (!missing.isEmpty()) {
                return RowResult.failure(task, targets, TransformOutcome.missingMessage(missing), outcome.costUnits());
            }
            return RowResult.success(task, outcome.values(), outcome.costUnits());
        } catch (TransformException e) {
            log.debug("Row {} failed: {}", task.rowIndex(), e.getMessage());
            return RowResult.failure(task, targets, e.getMessage(), e.costUnits());
        } catch (RuntimeException e) {
            log.warn("Row {} failed with unexpected error", task.rowIndex(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return RowResult.failure(task, targets, message, 0);
        }
    }

    private void closeResults() {
        try {
            results.put(END_OF_RESULTS);
        } catch (InterruptedException e) {
            // run abandoned, nobody is draining
            log.debug("Result stream not closed: worker interrupted");
            Thread.currentThread().interrupt();
        }
    }
}
