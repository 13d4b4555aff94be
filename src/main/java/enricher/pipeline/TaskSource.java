package enricher.pipeline;

import enricher.core.ShutdownSignal;
import enricher.model.RowTask;
import enricher.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Feeds one task per row, in ascending row order, into the task queue and then
 * closes the stream with {@link #END_OF_TASKS}.
 *
 * <p>Runs on its own thread. The pipeline interrupts that thread when the
 * shutdown signal fires, so a {@code put} blocked on a full queue is abandoned.
 * On cancellation the tasks still waiting in the queue are withdrawn; no worker
 * pulled them, so they were never dispatched.</p>
 */
final class TaskSource implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskSource.class);

    /** End-of-stream marker, compared by identity. */
    static final RowTask END_OF_TASKS = new RowTask(-1, null);

    private final Table table;
    private final BlockingQueue<RowTask> tasks;
    private final ShutdownSignal signal;

    private volatile int queued;
    private volatile int withdrawn;

    TaskSource(Table table, BlockingQueue<RowTask> tasks, ShutdownSignal signal) {
        this.table = table;
        this.tasks = tasks;
        this.signal = signal;
    }

    @Override
    public void run() {
        try {
            for (int i = 0; i < table.rowCount(); i++) {
                if (signal.isCancelled()) {
                    break;
                }
                tasks.put(new RowTask(i, table.rows().get(i)));
                queued++;
            }
        } catch (InterruptedException e) {
            log.debug("Task source interrupted after {} tasks", queued);
        } finally {
            close();
        }
    }

    private void close() {
        Thread.interrupted();
        while (true) {
            if (signal.isCancelled()) {
                List<RowTask> pending = new ArrayList<>();
                tasks.drainTo(pending);
                withdrawn = pending.size();
                tasks.offer(END_OF_TASKS);
                log.info("Task source stopped: {} of {} rows queued, {} withdrawn",
                        queued, table.rowCount(), withdrawn);
                return;
            }
            try {
                tasks.put(END_OF_TASKS);
                log.debug("Task source finished: {} rows queued", queued);
                return;
            } catch (InterruptedException e) {
                // cancellation fired while waiting for room; loop to the withdraw path
            }
        }
    }

    /** Tasks put into the queue, including any later withdrawn. */
    int queued() {
        return queued;
    }

    int withdrawn() {
        return withdrawn;
    }
}
