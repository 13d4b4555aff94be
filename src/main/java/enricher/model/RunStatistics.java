package enricher.model;

import java.time.Instant;

/**
 * Running counters for one pipeline run.
 * Increments and snapshots share one monitor so a snapshot never sees a
 * half-applied result.
 */
public final class RunStatistics {

    private final int totalRows;
    private final Instant startedAt;

    private int completed;
    private int failed;
    private long costUnits;

    public RunStatistics(int totalRows, Instant startedAt) {
        if (totalRows < 0) {
            throw new IllegalArgumentException("totalRows must be >= 0");
        }
        this.totalRows = totalRows;
        this.startedAt = startedAt;
    }

    public static RunStatistics start(int totalRows) {
        return new RunStatistics(totalRows, Instant.now());
    }

    public synchronized void recordSuccess(long cost) {
        checkCapacity();
        completed++;
        costUnits += cost;
    }

    /** Failed calls may still have been billed, so their cost counts too. */
    public synchronized void recordFailure(long cost) {
        checkCapacity();
        failed++;
        costUnits += cost;
    }

    public synchronized StatsSnapshot snapshot() {
        return new StatsSnapshot(totalRows, completed, failed, costUnits, startedAt);
    }

    public int totalRows() {
        return totalRows;
    }

    public Instant startedAt() {
        return startedAt;
    }

    private void checkCapacity() {
        if (completed + failed >= totalRows) {
            throw new IllegalStateException("more results than rows (total=" + totalRows + ")");
        }
    }
}
