package nl.bytesoflife.windregrid.raster;

import nl.bytesoflife.windregrid.model.SampleGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a {@link SampleGrid} as an 8-bit grayscale PNG. The image is written
 * to a temporary file next to the destination and moved into place, so the
 * destination is either complete or untouched.
 */
public class GrayscaleRasterWriter {

    private static final Logger log = LoggerFactory.getLogger(GrayscaleRasterWriter.class);

    public static final String FORMAT = "png";

    public Path write(SampleGrid grid, Path destination) throws IOException {
        Path target = destination.toAbsolutePath();
        Path dir = target.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                if (!ImageIO.write(toImage(grid), FORMAT, out)) {
                    throw new IOException("No ImageIO writer for " + FORMAT);
                }
            }
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return target;
    }

    BufferedImage toImage(SampleGrid grid) {
        BufferedImage image = new BufferedImage(grid.getWidth(), grid.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSamples(0, 0, grid.getWidth(), grid.getHeight(), 0, grid.toArray());
        return image;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
