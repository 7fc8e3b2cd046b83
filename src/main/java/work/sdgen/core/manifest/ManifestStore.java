package work.sdgen.core.manifest;

import java.io.IOException;

/**
 * Persistence of manifest snapshots.
 */
public interface ManifestStore {
    void save(Manifest manifest) throws IOException;
}
