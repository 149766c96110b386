package nl.bytesoflife.windregrid;

import nl.bytesoflife.windregrid.compute.Rescaler;
import nl.bytesoflife.windregrid.compute.SampleCodec;
import nl.bytesoflife.windregrid.compute.WindComponentCodec;
import nl.bytesoflife.windregrid.geometry.AreaGeometryResolver;
import nl.bytesoflife.windregrid.geometry.DegreeScale;
import nl.bytesoflife.windregrid.geometry.ProjectionAdapter;
import nl.bytesoflife.windregrid.model.Offset;
import nl.bytesoflife.windregrid.model.Shape;
import nl.bytesoflife.windregrid.model.Units;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one regrid run. Unset values fall back to the defaults below.
 *
 * <pre>
 * RegridRequest request = new RegridRequest(uFile, vFile, outFile)
 *     .withSourceShape(500, 500)
 *     .withTargetShape(250, 250)
 *     .withRescale(0.25);
 * </pre>
 */
public class RegridRequest {

    public static final Shape DEFAULT_SOURCE_SHAPE = AreaGeometryResolver.DEFAULT_SOURCE_SHAPE;
    public static final Units DEFAULT_UNITS = Units.METERS;
    public static final String DEFAULT_PROJECTION = ProjectionAdapter.DEFAULT_PROJECTION;
    public static final double DEFAULT_RESCALE = Rescaler.NO_RESCALE;
    public static final String DEFAULT_ENCODING = WindComponentCodec.NAME;

    private final Path uFile;
    private final Path vFile;
    private final Path outputFile;

    private Shape sourceShape;
    private Shape targetShape;
    private Offset targetOffset;
    private Units units = DEFAULT_UNITS;
    private DegreeScale degreeScale = DegreeScale.DEFAULT;
    private String projection = DEFAULT_PROJECTION;
    private double rescale = DEFAULT_RESCALE;
    private int workers = defaultWorkers();
    private String encoding = DEFAULT_ENCODING;

    public RegridRequest(Path uFile, Path vFile, Path outputFile) {
        this.uFile = Objects.requireNonNull(uFile, "uFile");
        this.vFile = Objects.requireNonNull(vFile, "vFile");
        this.outputFile = Objects.requireNonNull(outputFile, "outputFile");
    }

    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    public RegridRequest withSourceShape(double width, double height) {
        return withSourceShape(shape("source", width, height));
    }

    /**
     * @param shape source shape in the request's units, or null for
     *              {@link #DEFAULT_SOURCE_SHAPE} in metres
     */
    public RegridRequest withSourceShape(Shape shape) {
        this.sourceShape = shape;
        return this;
    }

    public RegridRequest withTargetShape(double width, double height) {
        return withTargetShape(shape("target", width, height));
    }

    /**
     * @param shape target shape, or null to reuse the source shape
     */
    public RegridRequest withTargetShape(Shape shape) {
        this.targetShape = shape;
        return this;
    }

    public RegridRequest withTargetOffset(double dx, double dy) {
        try {
            return withTargetOffset(new Offset(dx, dy));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid target offset: " + e.getMessage(), e);
        }
    }

    /**
     * @param offset explicit offset, or null for the default placement
     */
    public RegridRequest withTargetOffset(Offset offset) {
        this.targetOffset = offset;
        return this;
    }

    public RegridRequest withUnits(String name) {
        try {
            return withUnits(Units.fromName(name));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public RegridRequest withUnits(Units units) {
        this.units = Objects.requireNonNull(units, "units");
        return this;
    }

    public RegridRequest withDegreeScale(DegreeScale degreeScale) {
        this.degreeScale = Objects.requireNonNull(degreeScale, "degreeScale");
        return this;
    }

    public RegridRequest withProjection(String projection) {
        this.projection = projection;
        return this;
    }

    public RegridRequest withRescale(double rescale) {
        this.rescale = rescale;
        return this;
    }

    public RegridRequest withWorkers(int workers) {
        this.workers = workers;
        return this;
    }

    public RegridRequest withEncoding(String encoding) {
        this.encoding = encoding;
        return this;
    }

    /**
     * Checks every value that can be checked without touching the rasters.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public void validate() {
        if (!Rescaler.isValidRatio(rescale)) {
            throw new ConfigurationException("Rescale ratio must be in (0, 1], got " + rescale);
        }
        if (workers < 1) {
            throw new ConfigurationException("Number of workers must be at least 1, got " + workers);
        }
        codec();
        new ProjectionAdapter(projection);
    }

    public SampleCodec codec() {
        if (encoding == null) {
            throw new ConfigurationException("Encoding is not set");
        }
        try {
            return SampleCodec.forName(encoding);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static Shape shape(String which, double width, double height) {
        try {
            return new Shape(width, height);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + which + " area: " + e.getMessage(), e);
        }
    }

    public Path getUFile() { return uFile; }
    public Path getVFile() { return vFile; }
    public Path getOutputFile() { return outputFile; }
    public Shape getSourceShape() { return sourceShape; }
    public Shape getTargetShape() { return targetShape; }
    public Offset getTargetOffset() { return targetOffset; }
    public Units getUnits() { return units; }
    public DegreeScale getDegreeScale() { return degreeScale; }
    public String getProjection() { return projection; }
    public double getRescale() { return rescale; }
    public int getWorkers() { return workers; }
    public String getEncoding() { return encoding; }
}
