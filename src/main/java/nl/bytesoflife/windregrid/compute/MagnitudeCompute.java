package nl.bytesoflife.windregrid.compute;

import nl.bytesoflife.windregrid.model.SampleGrid;

/**
 * Elementwise Euclidean magnitude of two co-registered component grids.
 */
public class MagnitudeCompute {

    private final SampleCodec codec;

    public MagnitudeCompute(SampleCodec codec) {
        this.codec = codec;
    }

    public SampleCodec getCodec() {
        return codec;
    }

    public static double magnitude(double u, double v) {
        if (Double.isNaN(u) || Double.isNaN(v)) return Double.NaN;
        return Math.hypot(u, v);
    }

    public SampleGrid compute(SampleGrid u, SampleGrid v) {
        if (!u.hasSameShape(v)) {
            throw new IllegalArgumentException("Component grids differ in shape: " + u + " vs " + v);
        }
        int width = u.getWidth();
        int height = u.getHeight();
        int[] out = new int[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double m = magnitude(codec.decode(u.get(row, col)), codec.decode(v.get(row, col)));
                out[row * width + col] = codec.encodeMagnitude(m);
            }
        }
        return new SampleGrid(width, height, out);
    }
}
