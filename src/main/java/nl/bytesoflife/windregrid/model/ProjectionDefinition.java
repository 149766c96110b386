package nl.bytesoflife.windregrid.model;

import org.locationtech.proj4j.CoordinateReferenceSystem;

import java.util.Objects;

/**
 * A PROJ.4 style projection string bound to the coordinate reference system
 * the projection engine built from it. Two definitions are equal when their
 * normalized parameter strings are equal.
 */
public final class ProjectionDefinition {

    private final String parameters;
    private final CoordinateReferenceSystem crs;

    public ProjectionDefinition(String parameters, CoordinateReferenceSystem crs) {
        this.parameters = normalize(Objects.requireNonNull(parameters, "parameters"));
        this.crs = Objects.requireNonNull(crs, "crs");
    }

    public String getParameters() {
        return parameters;
    }

    public CoordinateReferenceSystem getCrs() {
        return crs;
    }

    static String normalize(String parameters) {
        return String.join(" ", parameters.trim().split("\\s+"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionDefinition other)) return false;
        return parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return parameters.hashCode();
    }

    @Override
    public String toString() {
        return parameters;
    }
}
