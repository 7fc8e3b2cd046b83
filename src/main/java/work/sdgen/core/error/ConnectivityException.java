package work.sdgen.core.error;

/**
 * The image backend could not be reached during the connection probe.
 */
public final class ConnectivityException extends SdgenException {
    public ConnectivityException(String endpoint, String message, Throwable cause) {
        super("connectivity.unreachable", message, detailsOf("endpoint", endpoint), cause);
    }
}
