package nl.bytesoflife.windregrid.model;

import java.util.Locale;

/**
 * Signed displacement (east, north) of the target centroid from the source centroid.
 */
public record Offset(double dx, double dy) {

    public static final Offset ZERO = new Offset(0, 0);

    public Offset {
        if (!Double.isFinite(dx) || !Double.isFinite(dy)) {
            throw new IllegalArgumentException(String.format(Locale.US,
                    "Offset must be finite, got (%s, %s)", dx, dy));
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.3f, %.3f)", dx, dy);
    }
}
