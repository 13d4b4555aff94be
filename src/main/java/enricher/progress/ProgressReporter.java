package enricher.progress;

import enricher.model.RunOutcome;
import enricher.model.StatsSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders run statistics for humans: a single overwrite-style progress line
 * during the run, and a summary block at the end.
 */
public final class ProgressReporter {

    private final CostModel costModel;
    private final Clock clock;

    public ProgressReporter(CostModel costModel) {
        this(costModel, Clock.systemUTC());
    }

    public ProgressReporter(CostModel costModel, Clock clock) {
        this.costModel = costModel;
        this.clock = clock;
    }

    /**
     * e.g. {@code Progress: 120/1000 (12.0%) | Failed: 3 | Tokens: 45210 | Cost: $0.0170 | Elapsed: 1m05s}
     */
    public String line(StatsSnapshot s) {
        return String.format(Locale.ROOT,
                "Progress: %d/%d (%.1f%%) | Failed: %d | Tokens: %d | Cost: $%.4f | Elapsed: %s",
                s.processed(), s.totalRows(), s.progressPercent(), s.failed(), s.costUnits(),
                costModel.estimate(s.costUnits()), formatDuration(s.elapsed(now())));
    }

    /** Multi-line end-of-run report. */
    public String summary(StatsSnapshot s, RunOutcome outcome) {
        Duration elapsed = s.elapsed(now());
        StringBuilder sb = new StringBuilder();
        sb.append("=== FINAL STATISTICS ===\n");
        sb.append("Outcome: ").append(outcome).append('\n');
        sb.append("Total rows processed: ").append(s.processed()).append(" of ").append(s.totalRows()).append('\n');
        sb.append("Successful: ").append(s.completed()).append('\n');
        sb.append("Failed: ").append(s.failed()).append('\n');
        sb.append("Total tokens used: ").append(s.costUnits()).append('\n');
        sb.append(String.format(Locale.ROOT, "Estimated cost: $%.4f%n", costModel.estimate(s.costUnits())));
        sb.append("Total time: ").append(formatDuration(elapsed)).append('\n');
        if (s.completed() > 0) {
            long avgMs = elapsed.toMillis() / s.completed();
            sb.append("Average time per row: ").append(avgMs).append("ms\n");
        }
        return sb.toString();
    }

    public CostModel costModel() {
        return costModel;
    }

    private Instant now() {
        return clock.instant();
    }

    /** Rounded to whole seconds: {@code 42s}, {@code 3m07s}, {@code 1h02m00s}. */
    static String formatDuration(Duration d) {
        long seconds = Math.max(0, Math.round(d.toMillis() / 1000.0));
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long sec = seconds % 60;
        if (h > 0)
            return String.format(Locale.ROOT, "%dh%02dm%02ds", h, m, sec);
        if (m > 0)
            return String.format(Locale.ROOT, "%dm%02ds", m, sec);
        return sec + "s";
    }
}
