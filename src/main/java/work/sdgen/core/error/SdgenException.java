package work.sdgen.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception carrying a stable error code and structured details (document, field, index...).
 */
public class SdgenException extends RuntimeException {
    private final String code;
    private final Map<String, Object> details;

    public SdgenException(String code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public SdgenException(String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    static Map<String, Object> detailsOf(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
