package enricher.progress;

import enricher.model.StatsSnapshot;

import java.io.PrintStream;

/**
 * Rewrites one console line in place ({@code \r}) on every update.
 * Shorter lines are padded so no stale characters remain.
 */
public final class ConsoleProgress implements ProgressListener {

    private final PrintStream out;
    private final ProgressReporter reporter;
    private int lastLength;

    public ConsoleProgress(PrintStream out, ProgressReporter reporter) {
        this.out = out;
        this.reporter = reporter;
    }

    @Override
    public void onProgress(StatsSnapshot snapshot) {
        String line = reporter.line(snapshot);
        int pad = Math.max(0, lastLength - line.length());
        out.print("\r" + line + " ".repeat(pad));
        out.flush();
        lastLength = line.length();
    }

    /** End the progress line so following output starts on a fresh line. */
    public void finish() {
        if (lastLength > 0) {
            out.println();
            lastLength = 0;
        }
    }
}
