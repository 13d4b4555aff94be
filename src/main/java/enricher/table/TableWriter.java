package enricher.table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes headers plus rows to a durable artifact, replacing any existing file.
 * Text formats produce identical bytes for identical content; workbooks carry
 * their own timestamps.
 */
public interface TableWriter {

    void write(Path path, List<String> headers, List<List<String>> rows) throws IOException;
}
