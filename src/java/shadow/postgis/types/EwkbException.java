package shadow.postgis.types;

import java.io.IOException;

/**
 * EWKB could not be written or read.
 */
public class EwkbException extends IOException {
    public EwkbException(String message) {
        super(message);
    }

    public EwkbException(String message, Throwable cause) {
        super(message, cause);
    }
}
