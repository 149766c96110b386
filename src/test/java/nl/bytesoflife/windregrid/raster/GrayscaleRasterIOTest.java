package nl.bytesoflife.windregrid.raster;

import nl.bytesoflife.windregrid.model.SampleGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class GrayscaleRasterIOTest {

    @TempDir
    Path dir;

    private final GrayscaleRasterReader reader = new GrayscaleRasterReader();
    private final GrayscaleRasterWriter writer = new GrayscaleRasterWriter();

    @Test
    void writtenPngReadsBackIdentically() throws IOException {
        int[] samples = new int[6 * 4];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (i * 37) % 256;
        }
        SampleGrid grid = new SampleGrid(6, 4, samples);

        Path out = writer.write(grid, dir.resolve("grid.png"));

        assertEquals(grid, reader.read(out));
    }

    @Test
    void writeLeavesNoTemporaryFiles() throws IOException {
        writer.write(SampleGrid.filled(3, 3, 7), dir.resolve("out.png"));
        writer.write(SampleGrid.filled(2, 2, 9), dir.resolve("out.png"));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(dir.resolve("out.png")), files.toList());
        }
        assertEquals(SampleGrid.filled(2, 2, 9), reader.read(dir.resolve("out.png")));
    }

    @Test
    void createsMissingOutputDirectories() throws IOException {
        Path out = writer.write(SampleGrid.filled(1, 1, 1), dir.resolve("a/b/out.png"));
        assertTrue(Files.isRegularFile(out));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(NoSuchFileException.class, () -> reader.read(dir.resolve("absent.png")));
    }

    @Test
    void colorImageIsRejected() throws IOException {
        Path rgb = dir.resolve("rgb.png");
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", rgb.toFile());

        IOException e = assertThrows(IOException.class, () -> reader.read(rgb));
        assertTrue(e.getMessage().contains("grayscale"));
    }

    @Test
    void nonImageIsRejected() throws IOException {
        Path text = dir.resolve("notes.png");
        Files.writeString(text, "not an image");

        assertThrows(IOException.class, () -> reader.read(text));
    }
}
