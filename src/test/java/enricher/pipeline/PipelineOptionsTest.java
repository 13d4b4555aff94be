package enricher.pipeline;

import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOptionsTest {

    @Test
    void defaults() {
        PipelineOptions options = PipelineOptions.defaults();
        assertEquals(10, options.workerCount());
        assertEquals(100, options.batchSize());
        assertEquals(Duration.ofSeconds(30), options.checkpointInterval());
        assertEquals(20, options.queueCapacity());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new PipelineOptions(0, 10, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new PipelineOptions(1, 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new PipelineOptions(1, 1, Duration.ZERO));
    }
}
