package nl.bytesoflife.windregrid.geometry;

import nl.bytesoflife.windregrid.model.Offset;
import nl.bytesoflife.windregrid.model.Shape;
import nl.bytesoflife.windregrid.model.Units;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns user shapes, offset and units into the source and target extents in
 * projected metres.
 *
 * <p>The source extent is centred on the reference origin (the projection's
 * natural origin by default). The target extent is centred on the source
 * centroid plus an effective offset, chosen as follows:
 * <ul>
 *     <li>an explicit offset is converted to metres and used as given;</li>
 *     <li>without an offset, a target shape different from the source shape is
 *     placed so that both upper-left corners coincide;</li>
 *     <li>otherwise the offset is zero.</li>
 * </ul>
 *
 * <pre>
 * ResolvedGeometry geometry = new AreaGeometryResolver()
 *     .resolve(new Shape(500, 500), new Shape(250, 250), null, Units.METERS);
 * </pre>
 */
public class AreaGeometryResolver {

    private static final Logger log = LoggerFactory.getLogger(AreaGeometryResolver.class);

    /** Source shape in metres when none is given, whatever the units of the other values. */
    public static final Shape DEFAULT_SOURCE_SHAPE = new Shape(500, 500);

    private final UnitConverter converter;
    private final Coordinate origin;

    public AreaGeometryResolver() {
        this(new UnitConverter());
    }

    public AreaGeometryResolver(UnitConverter converter) {
        this(converter, new Coordinate(0, 0));
    }

    public AreaGeometryResolver(UnitConverter converter, Coordinate origin) {
        this.converter = converter;
        this.origin = new Coordinate(origin);
    }

    /**
     * @param sourceShape source shape, {@link #DEFAULT_SOURCE_SHAPE} when null
     * @param targetShape target shape, the source shape when null
     * @param targetOffset explicit target offset, or null to apply the default rule
     * @param units unit domain of the given shapes and offset
     * @throws IllegalArgumentException when a value overflows on conversion to metres
     */
    public ResolvedGeometry resolve(Shape sourceShape, Shape targetShape, Offset targetOffset, Units units) {
        Shape source = sourceShape != null ? converter.toMeters(sourceShape, units) : DEFAULT_SOURCE_SHAPE;
        Shape target = targetShape != null ? converter.toMeters(targetShape, units) : source;

        Offset offset;
        ResolvedGeometry.OffsetMode mode;
        if (targetOffset != null) {
            offset = converter.toMeters(targetOffset, units);
            mode = ResolvedGeometry.OffsetMode.EXPLICIT;
        } else if (!target.equals(source)) {
            offset = upperLeftAlignedOffset(source, target);
            mode = ResolvedGeometry.OffsetMode.UPPER_LEFT_ALIGNED;
        } else {
            offset = Offset.ZERO;
            mode = ResolvedGeometry.OffsetMode.NONE;
        }

        Envelope sourceExtent = centredExtent(source, origin.x, origin.y);
        Envelope targetExtent = centredExtent(target, origin.x + offset.dx(), origin.y + offset.dy());

        log.debug("Source {} m -> {}", source, sourceExtent);
        log.debug("Target {} m, offset {} ({}) -> {}", target, offset, mode, targetExtent);

        return new ResolvedGeometry(source, target, offset, mode, sourceExtent, targetExtent);
    }

    /**
     * Offset (east, north) that moves a target centred on the source centroid
     * until its upper-left corner meets the source upper-left corner.
     *
     * <p>Half of the width difference goes west (negative x) and half of the
     * height difference goes north (positive y). Read from the target centroid
     * towards the source centroid, in raster order where rows grow southwards,
     * the same displacement is {@code ((sw - tw) / 2, -(sh - th) / 2)}.
     */
    static Offset upperLeftAlignedOffset(Shape source, Shape target) {
        double dx = -(source.width() - target.width()) / 2;
        double dy = (source.height() - target.height()) / 2;
        return new Offset(dx, dy);
    }

    private static Envelope centredExtent(Shape shape, double cx, double cy) {
        double minX = cx - shape.halfWidth();
        double maxX = cx + shape.halfWidth();
        double minY = cy - shape.halfHeight();
        double maxY = cy + shape.halfHeight();
        if (!Double.isFinite(minX) || !Double.isFinite(maxX) || !Double.isFinite(minY) || !Double.isFinite(maxY)) {
            throw new IllegalArgumentException("Extent of " + shape + " m around (" + cx + ", " + cy
                    + ") overflows");
        }
        return new Envelope(minX, maxX, minY, maxY);
    }
}
