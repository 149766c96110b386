package nl.bytesoflife.windregrid;

/**
 * Invalid run configuration: units, shapes, rescale ratio, worker count,
 * encoding or projection.
 */
public class ConfigurationException extends RegridException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
