package work.sdgen.core.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes base64 {@code images} of a result into the session directory. Extra images get a {@code _N} suffix.
 */
public final class FileImageSink implements ImageSink {
    private static final Logger log = LoggerFactory.getLogger(FileImageSink.class);

    private final Path directory;

    public FileImageSink(Path directory) {
        this.directory = directory;
    }

    @Override
    public void store(String filename, Map<String, Object> result) throws IOException {
        if (!(result.get("images") instanceof List<?> images) || images.isEmpty()) {
            log.debug("Result for {} carries no image data", filename);
            return;
        }
        Files.createDirectories(directory);
        for (int i = 0; i < images.size(); i++) {
            String encoded = String.valueOf(images.get(i));
            int comma = encoded.startsWith("data:") ? encoded.indexOf(',') : -1;
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(encoded.substring(comma + 1).trim());
            } catch (IllegalArgumentException ex) {
                throw new IOException("Image " + i + " of " + filename + " is not valid base64", ex);
            }
            Files.write(directory.resolve(i == 0 ? filename : suffixed(filename, i)), bytes);
        }
    }

    static String suffixed(String filename, int index) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return filename + "_" + index;
        }
        return filename.substring(0, dot) + "_" + index + filename.substring(dot);
    }
}
