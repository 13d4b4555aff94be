package enricher.pipeline;

import enricher.core.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;

/**
 * Turns SIGINT / SIGTERM into a cooperative stop.
 *
 * <p>The JVM shutdown hook fires the run's {@link ShutdownSignal} and then blocks
 * until {@link #complete()} is called, so the final checkpoint and save finish
 * before the process exits. Call {@link #close()} after the run; it releases the
 * hook and removes it when the JVM is not already shutting down.</p>
 */
public final class ShutdownOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final ShutdownSignal signal;
    private final PrintStream console;
    private final CountDownLatch done = new CountDownLatch(1);
    private final Thread hook;
    private volatile boolean installed;

    public ShutdownOrchestrator(ShutdownSignal signal, PrintStream console) {
        this.signal = signal;
        this.console = console;
        this.hook = new Thread(this::handleInterrupt, "shutdown-orchestrator");
    }

    public ShutdownOrchestrator install() {
        Runtime.getRuntime().addShutdownHook(hook);
        installed = true;
        log.debug("Shutdown hook installed");
        return this;
    }

    /** Hook body: fire the signal once and wait for the run to finish saving. */
    void handleInterrupt() {
        if (signal.cancel("interrupt")) {
            console.println();
            console.println("Interrupt received. Saving progress...");
        }
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** The run has finished, including the final save. */
    public void complete() {
        done.countDown();
    }

    public boolean isCompleted() {
        return done.getCount() == 0;
    }

    @Override
    public void close() {
        complete();
        if (!installed)
            return;
        installed = false;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
