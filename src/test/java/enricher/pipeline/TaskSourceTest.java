package enricher.pipeline;

import enricher.core.ShutdownSignal;
import enricher.model.RowTask;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

class TaskSourceTest {

    @Test
    @DisplayName("Emits every row in ascending order, then the end marker")
    void emitsAllRowsInOrder() throws InterruptedException {
        BlockingQueue<RowTask> tasks = new ArrayBlockingQueue<>(100);
        TaskSource source = new TaskSource(EnrichmentPipelineTest.table(10), tasks, new ShutdownSignal());

        source.run();

        List<RowTask> drained = new ArrayList<>();
        tasks.drainTo(drained);
        assertEquals(11, drained.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i, drained.get(i).rowIndex());
            assertEquals(String.valueOf(i), drained.get(i).row().get("id"));
        }
        assertSame(TaskSource.END_OF_TASKS, drained.get(10));
        assertEquals(10, source.queued());
    }

    @Test
    @DisplayName("Cancellation abandons a blocked send and withdraws queued tasks")
    void cancellationUnblocksAndWithdraws() throws InterruptedException {
        BlockingQueue<RowTask> tasks = new ArrayBlockingQueue<>(2);
        ShutdownSignal signal = new ShutdownSignal();
        TaskSource source = new TaskSource(EnrichmentPipelineTest.table(50), tasks, signal);
        Thread producer = new Thread(source);
        signal.onCancel(producer::interrupt);
        producer.start();

        long deadline = System.currentTimeMillis() + 2_000;
        while (tasks.remainingCapacity() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        signal.cancel("test");
        producer.join(2_000);

        assertFalse(producer.isAlive());
        assertEquals(2, source.withdrawn());
        assertEquals(1, tasks.size());
        assertSame(TaskSource.END_OF_TASKS, tasks.take());
    }
}
