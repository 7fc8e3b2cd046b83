package work.sdgen.core.variation;

/**
 * Provenance of a chunk field value, lowest precedence first.
 */
public enum FieldSource {
    TEMPLATE_DEFAULT,
    CHUNK,
    OVERRIDE;

    public boolean outranks(FieldSource other) {
        return compareTo(other) > 0;
    }
}
