package nl.bytesoflife.windregrid.resample;

import nl.bytesoflife.windregrid.ResampleException;
import nl.bytesoflife.windregrid.model.ProjectionDefinition;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Maps projected coordinates of the target projection into the source
 * projection. Instances are not thread-safe; create one per worker.
 */
abstract class CoordinateMapper {

    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    abstract Coordinate map(Coordinate target);

    static CoordinateMapper between(ProjectionDefinition target, ProjectionDefinition source) {
        if (target.equals(source)) {
            return new Identity();
        }
        return new Projected(transformFactory.createTransform(target.getCrs(), source.getCrs()));
    }

    static final class Identity extends CoordinateMapper {
        @Override
        Coordinate map(Coordinate target) {
            return target;
        }
    }

    static final class Projected extends CoordinateMapper {
        private final CoordinateTransform transform;
        private final ProjCoordinate in = new ProjCoordinate();
        private final ProjCoordinate out = new ProjCoordinate();

        Projected(CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        Coordinate map(Coordinate target) {
            in.x = target.x;
            in.y = target.y;
            try {
                transform.transform(in, out);
            } catch (Proj4jException e) {
                throw new ResampleException("Cannot transform " + target + " between projections", e);
            }
            return new Coordinate(out.x, out.y);
        }
    }
}
