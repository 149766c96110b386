package nl.bytesoflife.windregrid.compute;

/**
 * Wind speed encoding of the u/v rasters.
 *
 * <p>A component in [-{@value #MAX_WIND_SPEED}, {@value #MAX_WIND_SPEED}] m/s is
 * stored as {@code round(127 * v / 25 + 128)}, i.e. in [1, 255]; 0 marks no data.
 * Magnitudes in [0, 25] m/s are stored as {@code round(255 * m / 25)}.
 * Values beyond the range are clipped.
 */
public class WindComponentCodec implements SampleCodec {

    public static final String NAME = "wind";

    /** Largest encodable wind speed, m/s. */
    public static final double MAX_WIND_SPEED = 25.0;

    public static final int NO_DATA = 0;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double decode(int sample) {
        if (sample == NO_DATA) return Double.NaN;
        return MAX_WIND_SPEED * (sample - 128.0) / 127.0;
    }

    public int encodeComponent(double metersPerSecond) {
        if (Double.isNaN(metersPerSecond)) return NO_DATA;
        double scaled = Math.max(-1, Math.min(1, metersPerSecond / MAX_WIND_SPEED));
        return (int) Math.rint(127 * scaled + 128);
    }

    @Override
    public int encodeMagnitude(double magnitude) {
        if (Double.isNaN(magnitude)) return 0;
        double scaled = Math.max(0, Math.min(1, magnitude / MAX_WIND_SPEED));
        return SampleCodec.toByte(255 * scaled);
    }
}
