package nl.bytesoflife.windregrid.compute;

/**
 * Samples are plain intensities: decoding is the identity and magnitudes are
 * rounded and clipped to [0, 255].
 */
public class RawIntensityCodec implements SampleCodec {

    public static final String NAME = "raw";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double decode(int sample) {
        return sample;
    }

    @Override
    public int encodeMagnitude(double magnitude) {
        return SampleCodec.toByte(magnitude);
    }
}
