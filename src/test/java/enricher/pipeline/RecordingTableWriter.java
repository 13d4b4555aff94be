package enricher.pipeline;

import enricher.table.TableWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps every written snapshot in memory instead of touching the disk.
 */
final class RecordingTableWriter implements TableWriter {

    final List<List<List<String>>> snapshots = new ArrayList<>();
    final AtomicInteger attempts = new AtomicInteger();
    private final boolean failing;

    RecordingTableWriter() {
        this(false);
    }

    RecordingTableWriter(boolean failing) {
        this.failing = failing;
    }

    @Override
    public synchronized void write(Path path, List<String> headers, List<List<String>> rows) throws IOException {
        attempts.incrementAndGet();
        if (failing) {
            throw new IOException("disk full");
        }
        snapshots.add(rows);
    }

    synchronized List<List<String>> last() {
        return snapshots.get(snapshots.size() - 1);
    }

    synchronized int count() {
        return snapshots.size();
    }
}
