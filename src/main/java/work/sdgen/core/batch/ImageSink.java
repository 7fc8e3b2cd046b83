package work.sdgen.core.batch;

import java.io.IOException;
import java.util.Map;

/**
 * Destination of successful job results.
 */
public interface ImageSink {
    void store(String filename, Map<String, Object> result) throws IOException;

    static ImageSink discard() {
        return (filename, result) -> {
        };
    }
}
