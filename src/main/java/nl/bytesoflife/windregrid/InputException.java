package nl.bytesoflife.windregrid;

/**
 * Missing, unreadable or mismatched input raster.
 */
public class InputException extends RegridException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
