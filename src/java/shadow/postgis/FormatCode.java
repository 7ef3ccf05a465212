package shadow.postgis;

/**
 * postgres wire format codes, used for parameters and result columns
 * <p/>
 * anything that is not TEXT or BINARY is not a format and must be rejected, never defaulted
 */
public final class FormatCode {
    public static final short TEXT = 0;
    public static final short BINARY = 1;

    private FormatCode() {
    }

    public static String nameOf(short format) {
        switch (format) {
            case TEXT:
                return "text";
            case BINARY:
                return "binary";
            default:
                return String.format("unknown(%d)", format);
        }
    }
}
