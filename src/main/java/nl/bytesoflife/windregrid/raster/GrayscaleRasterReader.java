package nl.bytesoflife.windregrid.raster;

import nl.bytesoflife.windregrid.model.SampleGrid;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads a single-band 8-bit grayscale image (PNG or any format ImageIO
 * decodes) into a {@link SampleGrid}.
 */
public class GrayscaleRasterReader {

    public SampleGrid read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }

        BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException(path + ": not a supported image format");
        }
        return toGrid(image, path.toString());
    }

    SampleGrid toGrid(BufferedImage image, String source) throws IOException {
        Raster raster = image.getRaster();
        if (raster.getNumBands() != 1 || image.getColorModel() instanceof IndexColorModel) {
            throw new IOException(source + ": expected a single-band grayscale image, found "
                    + raster.getNumBands() + " band(s)");
        }
        if (raster.getSampleModel().getSampleSize(0) != 8) {
            throw new IOException(source + ": expected 8-bit samples, found "
                    + raster.getSampleModel().getSampleSize(0) + "-bit");
        }

        int width = raster.getWidth();
        int height = raster.getHeight();
        int[] samples = raster.getSamples(0, 0, width, height, 0, (int[]) null);
        return new SampleGrid(width, height, samples);
    }
}
