package nl.bytesoflife.windregrid.geometry;

import nl.bytesoflife.windregrid.model.Offset;
import nl.bytesoflife.windregrid.model.Shape;
import org.locationtech.jts.geom.Envelope;

/**
 * Source and target extents in projected metres, with the shapes and
 * offset they were derived from (all in metres).
 */
public record ResolvedGeometry(Shape sourceShape,
                               Shape targetShape,
                               Offset effectiveOffset,
                               OffsetMode offsetMode,
                               Envelope sourceExtent,
                               Envelope targetExtent) {

    public enum OffsetMode {
        /** Offset given by the caller. */
        EXPLICIT,
        /** Offset inferred so the upper-left corners coincide. */
        UPPER_LEFT_ALIGNED,
        /** Target shares the source shape and centroid. */
        NONE
    }

    public ResolvedGeometry {
        sourceExtent = new Envelope(sourceExtent);
        targetExtent = new Envelope(targetExtent);
    }

    @Override
    public Envelope sourceExtent() {
        return new Envelope(sourceExtent);
    }

    @Override
    public Envelope targetExtent() {
        return new Envelope(targetExtent);
    }

    /**
     * Fraction of the target extent covered by the source extent, in [0, 1].
     */
    public double targetCoverage() {
        Envelope overlap = sourceExtent.intersection(targetExtent);
        if (overlap.isNull() || targetExtent.getArea() == 0) return 0;
        return overlap.getArea() / targetExtent.getArea();
    }
}
