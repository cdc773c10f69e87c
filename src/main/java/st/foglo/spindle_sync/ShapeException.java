package st.foglo.spindle_sync;

/**
 * An array or matrix does not have the shape that the grid requires.
 */
public final class ShapeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ShapeException(String message) {
        super(message);
    }

    public ShapeException(String format, Object... args) {
        super(String.format(format, args));
    }
}
