package enricher.simulation;

import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.Row;
import enricher.transform.RowTransform;
import enricher.transform.TransformException;
import enricher.transform.TransformOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Offline stand-in for the model: sleeps a random delay, then either fails or
 * answers {@code <column>-<n>} for every target, where {@code n} is the call's
 * sequence number. Each call costs a fixed number of units.
 *
 * <p>Stops waiting as soon as the shutdown signal fires and reports the row as
 * cancelled.</p>
 */
public final class SimulatedRowTransform implements RowTransform {

    private static final Logger log = LoggerFactory.getLogger(SimulatedRowTransform.class);

    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;
    private final long costPerCall;
    private final Predicate<Row> failWhen;
    private final AtomicLong calls = new AtomicLong();

    public SimulatedRowTransform(int delayMinMs, int delayMaxMs, double failRate, long costPerCall) {
        this(delayMinMs, delayMaxMs, failRate, costPerCall, row -> false);
    }

    /**
     * @param failWhen rows matching this predicate always fail, on top of {@code failRate}
     */
    public SimulatedRowTransform(int delayMinMs, int delayMaxMs, double failRate, long costPerCall,
            Predicate<Row> failWhen) {
        if (delayMinMs < 0 || delayMaxMs < delayMinMs) {
            throw new IllegalArgumentException("invalid delay range: " + delayMinMs + ".." + delayMaxMs);
        }
        if (failRate < 0 || failRate > 1) {
            throw new IllegalArgumentException("failRate must be within 0..1");
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
        this.costPerCall = costPerCall;
        this.failWhen = failWhen;
    }

    /** Instant answers, never fails, 10 units per call. */
    public static SimulatedRowTransform instant() {
        return new SimulatedRowTransform(0, 0, 0.0, 10);
    }

    @Override
    public TransformOutcome transform(Row row, List<ColumnSpec> targets, String instruction, ShutdownSignal signal)
            throws TransformException {
        long n = calls.incrementAndGet();

        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs + 1);
        if (delay > 0) {
            try {
                if (signal.await(delay, TimeUnit.MILLISECONDS)) {
                    throw new TransformException("cancelled", costPerCall, null);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransformException("interrupted", costPerCall, e);
            }
        }

        boolean shouldFail = failWhen.test(row)
                || failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
        if (shouldFail) {
            log.debug("Simulated failure on call {}", n);
            throw new TransformException("Simulated failure", costPerCall, null);
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (ColumnSpec spec : targets) {
            values.put(spec.name(), spec.name() + "-" + n);
        }
        return new TransformOutcome(values, costPerCall);
    }

    /** Number of transform calls made so far. */
    public long calls() {
        return calls.get();
    }
}
