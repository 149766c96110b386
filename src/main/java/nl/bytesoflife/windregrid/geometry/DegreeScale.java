package nl.bytesoflife.windregrid.geometry;

/**
 * Linear scale used to turn degree-valued shapes and offsets into metres.
 * The same factor is applied to both axes regardless of latitude; swap in a
 * different instance to change the approximation.
 *
 * @param metersPerDegree metres represented by one degree
 */
public record DegreeScale(double metersPerDegree) {

    /** 500 m per 0.005 degrees, i.e. 100 km per degree. */
    public static final DegreeScale DEFAULT = new DegreeScale(500.0 / 0.005);

    public DegreeScale {
        if (!(metersPerDegree > 0) || Double.isInfinite(metersPerDegree)) {
            throw new IllegalArgumentException("Metres per degree must be positive, got " + metersPerDegree);
        }
    }
}
