package shadow.postgis;

import java.io.IOException;

/**
 * Decodes one column value into a caller supplied target.
 */
public interface ScanPlan {
    /**
     * @param src raw column bytes, null or empty means SQL NULL
     * @param target usually a {@link Ref}
     */
    void scan(byte[] src, Object target) throws IOException;
}
