package enricher.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of {@link RunStatistics}.
 */
public record StatsSnapshot(int totalRows, int completed, int failed, long costUnits, Instant startedAt) {

    /** Rows with a result applied, successful or not. */
    public int processed() {
        return completed + failed;
    }

    /** Percentage of rows processed, 0..100. An empty table counts as done. */
    public double progressPercent() {
        if (totalRows == 0)
            return 100.0;
        return processed() * 100.0 / totalRows;
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    public boolean isComplete() {
        return processed() >= totalRows;
    }
}
