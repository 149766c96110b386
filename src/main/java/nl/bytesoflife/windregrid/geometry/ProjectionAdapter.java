package nl.bytesoflife.windregrid.geometry;

import nl.bytesoflife.windregrid.ConfigurationException;
import nl.bytesoflife.windregrid.model.AreaDefinition;
import nl.bytesoflife.windregrid.model.ProjectionDefinition;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.proj.LongLatProjection;
import org.locationtech.proj4j.proj.Projection;
import org.locationtech.proj4j.units.Unit;
import org.locationtech.proj4j.units.Units;

/**
 * Binds a projection to the resolved source and target extents, producing the
 * area definitions handed to the resampler. Only metre-based projections are
 * accepted because every extent has been normalized to metres.
 */
public class ProjectionAdapter {

    public static final String DEFAULT_PROJECTION = "+proj=utm +zone=13 +ellps=WGS84 +units=m";

    static final String SOURCE_AREA_ID = "source";
    static final String TARGET_AREA_ID = "target";

    private static final CRSFactory crsFactory = new CRSFactory();

    private final ProjectionDefinition projection;

    public ProjectionAdapter() {
        this(DEFAULT_PROJECTION);
    }

    /**
     * @throws ConfigurationException if the projection engine rejects the
     *         string or the projection does not use metres
     */
    public ProjectionAdapter(String parameters) {
        this.projection = createProjection(parameters);
    }

    public ProjectionDefinition getProjection() {
        return projection;
    }

    public AreaDefinition sourceArea(ResolvedGeometry geometry, int columns, int rows) {
        return bind(SOURCE_AREA_ID, "Source area", geometry.sourceExtent(), columns, rows);
    }

    public AreaDefinition targetArea(ResolvedGeometry geometry, int columns, int rows) {
        return bind(TARGET_AREA_ID, "Target area", geometry.targetExtent(), columns, rows);
    }

    public AreaDefinition bind(String areaId, String description, Envelope extent, int columns, int rows) {
        return new AreaDefinition(areaId, description, projection, columns, rows, extent);
    }

    static ProjectionDefinition createProjection(String parameters) {
        if (parameters == null || parameters.isBlank()) {
            throw new ConfigurationException("Projection string is empty");
        }

        CoordinateReferenceSystem crs;
        try {
            crs = crsFactory.createFromParameters("wind-regrid", parameters);
        } catch (RuntimeException e) {
            // proj4j reports unknown projections and parameters with a mix of
            // Proj4jException subclasses and plain runtime exceptions
            throw new ConfigurationException("Unsupported projection '" + parameters + "': " + e.getMessage(), e);
        }
        if (crs == null || crs.getProjection() == null) {
            throw new ConfigurationException("Unsupported projection '" + parameters + "'");
        }

        Projection proj = crs.getProjection();
        if (proj instanceof LongLatProjection) {
            throw new ConfigurationException("Projection '" + parameters
                    + "' is geographic; resampling requires a projection in metres");
        }
        Unit unit = proj.getUnits();
        if (unit != null && unit != Units.METRES) {
            throw new ConfigurationException("Projection '" + parameters + "' uses units '"
                    + unit + "'; resampling requires metres");
        }
        if (proj.getFromMetres() != 1.0) {
            throw new ConfigurationException("Projection '" + parameters + "' scales metres by "
                    + proj.getFromMetres() + "; resampling requires metres");
        }

        return new ProjectionDefinition(parameters, crs);
    }
}
