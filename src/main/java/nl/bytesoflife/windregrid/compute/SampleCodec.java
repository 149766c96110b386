package nl.bytesoflife.windregrid.compute;

import java.util.Locale;

/**
 * Interprets 8-bit samples as physical values and encodes derived magnitudes
 * back into 8-bit samples.
 */
public interface SampleCodec {

    /**
     * @return the physical value of a sample, or NaN for a no-data sample
     */
    double decode(int sample);

    /**
     * @return the 8-bit sample for a non-negative magnitude; NaN encodes as 0
     */
    int encodeMagnitude(double magnitude);

    String getName();

    static SampleCodec forName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case WindComponentCodec.NAME -> new WindComponentCodec();
            case RawIntensityCodec.NAME -> new RawIntensityCodec();
            default -> throw new IllegalArgumentException(
                    "Unknown encoding: '" + name + "', expected '" + WindComponentCodec.NAME
                            + "' or '" + RawIntensityCodec.NAME + "'");
        };
    }

    /**
     * Round half to even and clamp into [0, 255].
     */
    static int toByte(double value) {
        if (Double.isNaN(value)) return 0;
        double clamped = Math.max(0, Math.min(255, value));
        return (int) Math.rint(clamped);
    }
}
