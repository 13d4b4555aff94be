package enricher.table;

import enricher.model.Table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a source artifact into headers plus rows.
 */
public interface TableLoader {

    /**
     * @throws IOException if the file cannot be read or has no header row
     */
    Table load(Path path) throws IOException;
}
