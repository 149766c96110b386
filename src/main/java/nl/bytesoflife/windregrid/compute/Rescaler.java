package nl.bytesoflife.windregrid.compute;

import nl.bytesoflife.windregrid.model.SampleGrid;
import nl.bytesoflife.windregrid.raster.AreaAveragingScaler;

/**
 * Uniform downscale of the output grid by a ratio in (0, 1].
 */
public class Rescaler {

    public static final double NO_RESCALE = 1.0;

    private final double ratio;
    private final AreaAveragingScaler scaler = new AreaAveragingScaler();

    public Rescaler(double ratio) {
        if (!isValidRatio(ratio)) {
            throw new IllegalArgumentException("Rescale ratio must be in (0, 1], got " + ratio);
        }
        this.ratio = ratio;
    }

    public static boolean isValidRatio(double ratio) {
        return ratio > 0 && ratio <= 1.0;
    }

    public double getRatio() {
        return ratio;
    }

    public int scaledWidth(SampleGrid grid) {
        return scaledDimension(grid.getWidth());
    }

    public int scaledHeight(SampleGrid grid) {
        return scaledDimension(grid.getHeight());
    }

    public SampleGrid rescale(SampleGrid grid) {
        if (ratio == NO_RESCALE) {
            return grid;
        }
        return scaler.scale(grid, scaledWidth(grid), scaledHeight(grid));
    }

    private int scaledDimension(int size) {
        return (int) Math.max(1, Math.round(size * ratio));
    }
}
