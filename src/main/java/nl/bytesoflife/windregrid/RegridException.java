package nl.bytesoflife.windregrid;

/**
 * Base class for failures that abort a regrid run.
 */
public class RegridException extends RuntimeException {

    public RegridException(String message) {
        super(message);
    }

    public RegridException(String message, Throwable cause) {
        super(message, cause);
    }
}
