package enricher.model;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunStatisticsTest {

    @Test
    @DisplayName("Cost accumulates for successes and failures")
    void countsAndCost() {
        RunStatistics stats = new RunStatistics(4, Instant.EPOCH);

        stats.recordSuccess(10);
        stats.recordFailure(5);
        stats.recordSuccess(0);

        StatsSnapshot s = stats.snapshot();
        assertEquals(2, s.completed());
        assertEquals(1, s.failed());
        assertEquals(3, s.processed());
        assertEquals(15, s.costUnits());
        assertEquals(75.0, s.progressPercent(), 1e-9);
        assertFalse(s.isComplete());
        assertEquals(Duration.ofSeconds(90), s.elapsed(Instant.EPOCH.plusSeconds(90)));
    }

    @Test
    @DisplayName("More results than rows is an error")
    void capacity() {
        RunStatistics stats = new RunStatistics(1, Instant.EPOCH);
        stats.recordFailure(0);

        assertThrows(IllegalStateException.class, () -> stats.recordSuccess(1));
        assertTrue(stats.snapshot().isComplete());
    }

    @Test
    void emptyRunIsComplete() {
        StatsSnapshot s = new RunStatistics(0, Instant.EPOCH).snapshot();
        assertEquals(100.0, s.progressPercent());
        assertTrue(s.isComplete());
    }

    @Test
    @DisplayName("Concurrent increments are not lost")
    void concurrentIncrements() throws InterruptedException {
        RunStatistics stats = RunStatistics.start(8_000);
        Thread[] threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            boolean fail = t % 2 == 0;
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 1_000; i++) {
                    if (fail) stats.recordFailure(1);
                    else stats.recordSuccess(2);
                }
            });
            threads[t].start();
        }
        for (Thread t : threads) {
            t.join();
        }

        StatsSnapshot s = stats.snapshot();
        assertEquals(4_000, s.completed());
        assertEquals(4_000, s.failed());
        assertEquals(12_000, s.costUnits());
    }
}
