package shadow.postgis;

import java.io.IOException;

/**
 * Encodes one parameter value in the format the plan was selected for.
 */
public interface EncodePlan {
    /**
     * append the encoded value to out
     * <p/>
     * implementations must not leave partial output behind if they throw
     *
     * @param value never null, NULL is handled by the TypeMap
     * @param out
     */
    void encode(Object value, WireBuffer out) throws IOException;
}
