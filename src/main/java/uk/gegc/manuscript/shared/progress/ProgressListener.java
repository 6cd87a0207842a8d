package uk.gegc.manuscript.shared.progress;

/**
 * Receives coarse progress updates from long-running import, export and compile operations.
 * Fractions are monotonic within one operation and lie in [0, 1].
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (fraction, message) -> { };

    void onProgress(double fraction, String message);

    /**
     * Returns a listener that maps this operation's [0, 1] range onto [offset, offset + scale]
     * of the outer operation.
     */
    default ProgressListener scaled(double offset, double scale) {
        return (fraction, message) -> onProgress(offset + fraction * scale, message);
    }

    static ProgressListener nullSafe(ProgressListener listener) {
        return listener != null ? listener : NONE;
    }
}
