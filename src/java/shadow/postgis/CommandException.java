package shadow.postgis;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure while talking to the server on behalf of a codec (eg. resolving a type OID).
 * <p/>
 * errorData holds the fields of a postgres ErrorResponse keyed by their field code, if there was one.
 */
public class CommandException extends IOException {
    // field code -> label, in the order they are printed
    private static final Map<String, String> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("S", "Severity");
        FIELDS.put("C", "Code");
        FIELDS.put("M", "Message");
        FIELDS.put("D", "Detail");
        FIELDS.put("H", "Hint");
    }

    private final Map<String, String> errorData;

    public CommandException(String message) {
        super(message);
        this.errorData = Collections.emptyMap();
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
        this.errorData = Collections.emptyMap();
    }

    public CommandException(String message, Map<String, String> errorData) {
        super(makeErrorMessage(message, errorData));
        this.errorData = Collections.unmodifiableMap(errorData);
    }

    public Map<String, String> getErrorData() {
        return errorData;
    }

    /**
     * @return SQLSTATE of the server error, null if this did not come from the server
     */
    public String getSqlState() {
        return errorData.get("C");
    }

    private static String makeErrorMessage(String message, Map<String, String> errorData) {
        final StringBuilder sb = new StringBuilder(message);

        for (Map.Entry<String, String> field : FIELDS.entrySet()) {
            String v = errorData.get(field.getKey());
            if (v != null) {
                sb.append("\n").append(field.getValue()).append(": ").append(v);
            }
        }

        return sb.toString();
    }
}
