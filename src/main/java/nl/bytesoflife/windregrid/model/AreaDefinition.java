package nl.bytesoflife.windregrid.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;
import java.util.Objects;

/**
 * A geo-referenced rectangular pixel grid: projection, grid dimensions and
 * extent in projected metres. Row 0 is the northern edge, column 0 the western edge.
 */
public final class AreaDefinition {

    private final String areaId;
    private final String description;
    private final ProjectionDefinition projection;
    private final int columns;
    private final int rows;
    private final Envelope extent;

    public AreaDefinition(String areaId, String description, ProjectionDefinition projection,
                          int columns, int rows, Envelope extent) {
        this.areaId = Objects.requireNonNull(areaId, "areaId");
        this.description = description;
        this.projection = Objects.requireNonNull(projection, "projection");
        this.columns = columns;
        this.rows = rows;
        this.extent = new Envelope(Objects.requireNonNull(extent, "extent"));
    }

    public String getAreaId() { return areaId; }
    public String getDescription() { return description; }
    public ProjectionDefinition getProjection() { return projection; }
    public int getColumns() { return columns; }
    public int getRows() { return rows; }

    public Envelope getExtent() {
        return new Envelope(extent);
    }

    /**
     * True when the grid has no pixels or the extent has no area, in which
     * case no pixel size can be derived.
     */
    public boolean isDegenerate() {
        return columns <= 0 || rows <= 0 || !(extent.getWidth() > 0) || !(extent.getHeight() > 0);
    }

    public double getPixelWidth() {
        return extent.getWidth() / columns;
    }

    public double getPixelHeight() {
        return extent.getHeight() / rows;
    }

    public Coordinate getCentroid() {
        return extent.centre();
    }

    public Coordinate getUpperLeftCorner() {
        return new Coordinate(extent.getMinX(), extent.getMaxY());
    }

    /**
     * Projected coordinate of the centre of pixel (row, col).
     */
    public Coordinate pixelCentre(int row, int col) {
        return new Coordinate(
                extent.getMinX() + (col + 0.5) * getPixelWidth(),
                extent.getMaxY() - (row + 0.5) * getPixelHeight());
    }

    /**
     * Column index of the pixel whose centre is nearest to projected x.
     * May fall outside [0, columns).
     */
    public long nearestColumn(double x) {
        double upperLeftCentreX = extent.getMinX() + getPixelWidth() / 2;
        return Math.round((x - upperLeftCentreX) / getPixelWidth());
    }

    /**
     * Row index of the pixel whose centre is nearest to projected y.
     * May fall outside [0, rows).
     */
    public long nearestRow(double y) {
        double upperLeftCentreY = extent.getMaxY() - getPixelHeight() / 2;
        return Math.round((upperLeftCentreY - y) / getPixelHeight());
    }

    public boolean containsPixel(long row, long col) {
        return row >= 0 && row < rows && col >= 0 && col < columns;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s [%dx%d px, extent (%.3f, %.3f, %.3f, %.3f), %s]",
                areaId, columns, rows,
                extent.getMinX(), extent.getMinY(), extent.getMaxX(), extent.getMaxY(),
                projection);
    }
}
