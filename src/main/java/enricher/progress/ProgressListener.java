package enricher.progress;

import enricher.model.StatsSnapshot;

/**
 * Receives a statistics snapshot after every applied result.
 * Called on the result sink thread, so implementations must be quick.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = snapshot -> {
    };

    void onProgress(StatsSnapshot snapshot);
}
