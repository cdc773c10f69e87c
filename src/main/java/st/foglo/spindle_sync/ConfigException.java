package st.foglo.spindle_sync;

/**
 * Signals an invalid configuration: slice bounds, anchor sentinels,
 * mismatched anchor arrays, search intervals or window sizes. Raised
 * before any numeric work is done.
 */
public final class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String format, Object... args) {
        super(String.format(format, args));
    }
}
