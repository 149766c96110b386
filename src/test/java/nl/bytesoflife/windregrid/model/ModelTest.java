package nl.bytesoflife.windregrid.model;

import nl.bytesoflife.windregrid.geometry.ProjectionAdapter;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    void unitsFromName() {
        assertEquals(Units.METERS, Units.fromName("m"));
        assertEquals(Units.DEGREES, Units.fromName("d"));
        assertEquals(Units.DEGREES, Units.fromName("Degrees"));
        assertThrows(IllegalArgumentException.class, () -> Units.fromName("km"));
    }

    @Test
    void unitsFromNameIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(Units.METERS, Units.fromName("METRES"));
            assertEquals(Units.DEGREES, Units.fromName(" DEG "));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void shapeRejectsNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new Shape(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new Shape(10, -1));
        assertThrows(IllegalArgumentException.class, () -> new Shape(Double.NaN, 10));
        assertThrows(IllegalArgumentException.class, () -> new Shape(Double.POSITIVE_INFINITY, 10));
    }

    @Test
    void offsetAllowsNegativeButNotNaN() {
        Offset offset = new Offset(-125, 125);
        assertEquals(-125, offset.dx());
        assertThrows(IllegalArgumentException.class, () -> new Offset(Double.NaN, 0));
    }

    @Test
    void areaDefinitionPixelGeometry() {
        AreaDefinition area = new ProjectionAdapter()
                .bind("a", "test", new Envelope(-250, 250, -250, 250), 4, 4);

        assertEquals(125.0, area.getPixelWidth(), 1e-9);
        assertEquals(new Coordinate(-250, 250), area.getUpperLeftCorner());
        assertEquals(new Coordinate(0, 0), area.getCentroid());

        Coordinate ul = area.pixelCentre(0, 0);
        assertEquals(-187.5, ul.x, 1e-9);
        assertEquals(187.5, ul.y, 1e-9);

        Coordinate lr = area.pixelCentre(3, 3);
        assertEquals(3, area.nearestRow(lr.y));
        assertEquals(3, area.nearestColumn(lr.x));
        assertEquals(-1, area.nearestColumn(-300));
        assertFalse(area.containsPixel(-1, 0));
        assertFalse(area.containsPixel(0, 4));
        assertFalse(area.isDegenerate());
    }

    @Test
    void areaDefinitionWithoutPixelsIsDegenerate() {
        ProjectionAdapter adapter = new ProjectionAdapter();
        assertTrue(adapter.bind("a", null, new Envelope(0, 10, 0, 10), 0, 4).isDegenerate());
        assertTrue(adapter.bind("a", null, new Envelope(0, 0, 0, 10), 4, 4).isDegenerate());
    }

    @Test
    void areaDefinitionExtentIsCopied() {
        Envelope extent = new Envelope(0, 10, 0, 10);
        AreaDefinition area = new ProjectionAdapter().bind("a", null, extent, 2, 2);
        extent.expandToInclude(100, 100);
        area.getExtent().expandToInclude(-100, -100);
        assertEquals(new Envelope(0, 10, 0, 10), area.getExtent());
    }

    @Test
    void sampleGridValidatesRangeAndShape() {
        assertThrows(IllegalArgumentException.class, () -> new SampleGrid(2, 2, new int[]{0, 1, 2}));
        assertThrows(IllegalArgumentException.class, () -> new SampleGrid(1, 1, new int[]{256}));
        assertThrows(IllegalArgumentException.class, () -> new SampleGrid(0, 1, new int[0]));

        int[] samples = {1, 2, 3, 4, 5, 6};
        SampleGrid grid = new SampleGrid(3, 2, samples);
        samples[0] = 99;
        assertEquals(1, grid.get(0, 0));
        assertEquals(6, grid.get(1, 2));
        assertEquals(grid, new SampleGrid(3, 2, new int[]{1, 2, 3, 4, 5, 6}));
    }
}
