package nl.bytesoflife.windregrid.resample;

import nl.bytesoflife.windregrid.ResampleException;
import nl.bytesoflife.windregrid.geometry.ProjectionAdapter;
import nl.bytesoflife.windregrid.model.AreaDefinition;
import nl.bytesoflife.windregrid.model.SampleGrid;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QuickNearestNeighbourResamplerTest {

    private final ProjectionAdapter utm = new ProjectionAdapter();
    private final QuickNearestNeighbourResampler resampler = new QuickNearestNeighbourResampler();

    private final AreaDefinition source = utm.bind("source", null, new Envelope(-250, 250, -250, 250), 4, 4);

    /** value = 10 * row + col + 1 */
    private final SampleGrid grid = indexed(4, 4);

    @Test
    void identicalAreasReproduceSource() {
        SampleGrid out = resampler.resample(grid, source, source, 1);
        assertEquals(grid, out);
        assertNotSame(grid, out);
    }

    @Test
    void centralTargetPicksCentralBlock() {
        AreaDefinition target = utm.bind("target", null, new Envelope(-125, 125, -125, 125), 4, 4);

        SampleGrid out = resampler.resample(grid, source, target, 1);

        int[] expected = {
                12, 12, 13, 13,
                12, 12, 13, 13,
                22, 22, 23, 23,
                22, 22, 23, 23,
        };
        assertArrayEquals(expected, out.toArray());
    }

    @Test
    void topRightTargetPicksTopRightQuadrant() {
        AreaDefinition target = utm.bind("target", null, new Envelope(0, 250, 0, 250), 4, 4);

        SampleGrid out = resampler.resample(grid, source, target, 1);

        int[] expected = {
                3, 3, 4, 4,
                3, 3, 4, 4,
                13, 13, 14, 14,
                13, 13, 14, 14,
        };
        assertArrayEquals(expected, out.toArray());
    }

    @Test
    void upperLeftTargetPicksUpperLeftQuadrant() {
        AreaDefinition target = utm.bind("target", null, new Envelope(-250, 0, 0, 250), 2, 2);

        SampleGrid out = resampler.resample(grid, source, target, 1);

        assertArrayEquals(new int[]{1, 2, 11, 12}, out.toArray());
    }

    @Test
    void pixelsOutsideSourceCoverageGetFillValue() {
        AreaDefinition target = utm.bind("target", null, new Envelope(-400, 400, -400, 400), 4, 4);

        SampleGrid out = resampler.resample(grid, source, target, 1);

        int[] expected = {
                0, 0, 0, 0,
                0, 12, 13, 0,
                0, 22, 23, 0,
                0, 0, 0, 0,
        };
        assertArrayEquals(expected, out.toArray());
    }

    @Test
    void customFillValue() {
        AreaDefinition target = utm.bind("target", null, new Envelope(1000, 1100, 1000, 1100), 2, 2);

        SampleGrid out = new QuickNearestNeighbourResampler(255).resample(grid, source, target, 1);

        assertArrayEquals(new int[]{255, 255, 255, 255}, out.toArray());
    }

    @Test
    void parallelBandsMatchSingleThreadedResult() {
        SampleGrid random = random(37, 23, 42);
        AreaDefinition src = utm.bind("source", null, new Envelope(-370, 370, -230, 230), 37, 23);
        AreaDefinition target = utm.bind("target", null, new Envelope(-300, 100, -50, 230), 41, 29);

        SampleGrid single = resampler.resample(random, src, target, 1);
        SampleGrid parallel = resampler.resample(random, src, target, 4);
        SampleGrid moreWorkersThanRows = resampler.resample(random, src, target, 64);

        assertEquals(single, parallel);
        assertEquals(single, moreWorkersThanRows);
        assertEquals(41, single.getWidth());
        assertEquals(29, single.getHeight());
    }

    @Test
    void equivalentProjectionsGoThroughTransform() {
        ProjectionAdapter explicit = new ProjectionAdapter("+proj=utm +zone=13 +ellps=WGS84 +units=m +x_0=500000");
        assertNotEquals(utm.getProjection(), explicit.getProjection());
        AreaDefinition target = explicit.bind("target", null, new Envelope(-125, 125, -125, 125), 4, 4);
        AreaDefinition sameProjection = utm.bind("target", null, new Envelope(-125, 125, -125, 125), 4, 4);

        assertEquals(resampler.resample(grid, source, sameProjection, 1),
                resampler.resample(grid, source, target, 2));
    }

    @Test
    void rejectsGridThatDoesNotMatchSourceArea() {
        SampleGrid wrong = indexed(3, 4);
        assertThrows(ResampleException.class, () -> resampler.resample(wrong, source, source, 1));
    }

    @Test
    void rejectsDegenerateTargetArea() {
        AreaDefinition empty = utm.bind("target", null, new Envelope(0, 0, -10, 10), 4, 4);
        assertThrows(ResampleException.class, () -> resampler.resample(grid, source, empty, 1));
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThrows(ResampleException.class, () -> resampler.resample(grid, source, source, 0));
    }

    private static SampleGrid indexed(int width, int height) {
        int[] samples = new int[width * height];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                samples[r * width + c] = 10 * r + c + 1;
            }
        }
        return new SampleGrid(width, height, samples);
    }

    private static SampleGrid random(int width, int height, long seed) {
        Random rnd = new Random(seed);
        int[] samples = new int[width * height];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = 1 + rnd.nextInt(255);
        }
        return new SampleGrid(width, height, samples);
    }
}
