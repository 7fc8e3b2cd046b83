package work.sdgen.core.manifest;

import java.util.Locale;

/**
 * Manifest lifecycle. {@code ONGOING} is the only initial state; the two others are final.
 */
public enum ManifestStatus {
    ONGOING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this != ONGOING;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
