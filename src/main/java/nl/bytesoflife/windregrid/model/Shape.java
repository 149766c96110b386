package nl.bytesoflife.windregrid.model;

import java.util.Locale;

/**
 * Extent of an area as (longitude width, latitude height) in a given unit domain.
 */
public record Shape(double width, double height) {

    public Shape {
        if (!(width > 0) || !(height > 0) || Double.isInfinite(width) || Double.isInfinite(height)) {
            throw new IllegalArgumentException(String.format(Locale.US,
                    "Area shape must be positive, got %s x %s", width, height));
        }
    }

    public double halfWidth() {
        return width / 2;
    }

    public double halfHeight() {
        return height / 2;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%.3f x %.3f", width, height);
    }
}
