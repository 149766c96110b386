package nl.bytesoflife.windregrid.raster;

import nl.bytesoflife.windregrid.ResampleException;
import nl.bytesoflife.windregrid.model.SampleGrid;

import java.awt.image.AreaAveragingScaleFilter;
import java.awt.image.FilteredImageSource;
import java.awt.image.ImageProducer;
import java.awt.image.MemoryImageSource;
import java.awt.image.PixelGrabber;

/**
 * Downscales a grid with AWT's {@link AreaAveragingScaleFilter}: every output
 * pixel is the overlap-weighted mean of the input pixels under its footprint,
 * rounded half up.
 *
 * <p>Samples travel through the filter as opaque RGB pixels with equal red,
 * green and blue components, so no colour space conversion touches them.
 */
public class AreaAveragingScaler {

    private static final int OPAQUE = 0xFF000000;

    public SampleGrid scale(SampleGrid grid, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Scaled dimensions must be positive, got " + width + "x" + height);
        }
        if (width > grid.getWidth() || height > grid.getHeight()) {
            throw new IllegalArgumentException("Area averaging only downscales: "
                    + grid.getWidth() + "x" + grid.getHeight() + " -> " + width + "x" + height);
        }
        if (width == grid.getWidth() && height == grid.getHeight()) {
            return grid;
        }

        int[] samples = grid.toArray();
        int[] rgb = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            int v = samples[i];
            rgb[i] = OPAQUE | v << 16 | v << 8 | v;
        }

        ImageProducer source = new MemoryImageSource(grid.getWidth(), grid.getHeight(), rgb, 0, grid.getWidth());
        ImageProducer scaled = new FilteredImageSource(source, new AreaAveragingScaleFilter(width, height));

        int[] pixels = new int[width * height];
        PixelGrabber grabber = new PixelGrabber(scaled, 0, 0, width, height, pixels, 0, width);
        try {
            if (!grabber.grabPixels()) {
                throw new ResampleException("Rescaling " + grid + " to " + width + "x" + height
                        + " failed (status " + grabber.getStatus() + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResampleException("Rescaling interrupted", e);
        }

        int[] out = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            out[i] = pixels[i] & 0xFF;
        }
        return new SampleGrid(width, height, out);
    }
}
