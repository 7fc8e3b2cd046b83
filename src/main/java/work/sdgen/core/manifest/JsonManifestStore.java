package work.sdgen.core.manifest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Writes the manifest as pretty JSON, replacing the previous file atomically.
 */
public final class JsonManifestStore implements ManifestStore {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path path;

    public JsonManifestStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public void save(Manifest manifest) throws IOException {
        Files.createDirectories(path.getParent());
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        WRITER.writeValue(temp.toFile(), manifest.toSerializableMap());
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static Map<String, Object> read(Path path) throws IOException {
        return JSON.readValue(path.toFile(), MAP_TYPE);
    }
}
