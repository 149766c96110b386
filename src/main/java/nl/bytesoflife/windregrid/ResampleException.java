package nl.bytesoflife.windregrid;

/**
 * Failure raised while resampling a channel onto the target area.
 */
public class ResampleException extends RegridException {

    public ResampleException(String message) {
        super(message);
    }

    public ResampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
