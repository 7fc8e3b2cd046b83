package work.sdgen.core.orchestrator;

/**
 * The ordered phases of one run.
 */
public enum Phase {
    CONFIGURATION(1, "configuration"),
    VALIDATION(2, "validation"),
    API_CONNECTION(3, "api_connection"),
    RESOLUTION(4, "loading_resolution"),
    PROMPT_GENERATION(5, "prompt_generation"),
    MANIFEST_PREPARATION(6, "manifest_preparation"),
    IMAGE_GENERATION(7, "image_generation"),
    FINALIZATION(8, "finalization");

    private final int number;
    private final String label;

    Phase(int number, String label) {
        this.number = number;
        this.label = label;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    /** Phases that run once a manifest may exist; failures there must leave the manifest terminal. */
    public boolean ownsManifest() {
        return number >= MANIFEST_PREPARATION.number;
    }

    /** Dry runs neither contact the backend nor write a manifest. */
    public boolean runsDry() {
        return this == CONFIGURATION || this == VALIDATION || this == RESOLUTION || this == PROMPT_GENERATION;
    }
}
