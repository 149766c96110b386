package nl.bytesoflife.windregrid.geometry;

import nl.bytesoflife.windregrid.model.Offset;
import nl.bytesoflife.windregrid.model.Shape;
import nl.bytesoflife.windregrid.model.Units;

/**
 * Normalizes shape and offset values to metres.
 */
public class UnitConverter {

    private final DegreeScale scale;

    public UnitConverter() {
        this(DegreeScale.DEFAULT);
    }

    public UnitConverter(DegreeScale scale) {
        this.scale = scale;
    }

    public DegreeScale getScale() {
        return scale;
    }

    public double toMeters(double value, Units units) {
        return switch (units) {
            case METERS -> value;
            case DEGREES -> value * scale.metersPerDegree();
        };
    }

    public Shape toMeters(Shape shape, Units units) {
        if (units == Units.METERS) return shape;
        return new Shape(toMeters(shape.width(), units), toMeters(shape.height(), units));
    }

    public Offset toMeters(Offset offset, Units units) {
        if (units == Units.METERS) return offset;
        return new Offset(toMeters(offset.dx(), units), toMeters(offset.dy(), units));
    }
}
