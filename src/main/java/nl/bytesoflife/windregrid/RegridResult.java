package nl.bytesoflife.windregrid;

import nl.bytesoflife.windregrid.geometry.ResolvedGeometry;
import nl.bytesoflife.windregrid.model.AreaDefinition;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Outcome of a completed regrid run.
 */
public record RegridResult(Path outputFile,
                           int width,
                           int height,
                           ResolvedGeometry geometry,
                           AreaDefinition sourceArea,
                           AreaDefinition targetArea,
                           int workers) {

    @Override
    public String toString() {
        return String.format(Locale.US, "%s: %dx%d px, target %s m at offset %s (%s), %d worker(s)",
                outputFile, width, height, geometry.targetShape(), geometry.effectiveOffset(),
                geometry.offsetMode(), workers);
    }
}
