package nl.bytesoflife.windregrid.resample;

import nl.bytesoflife.windregrid.model.AreaDefinition;
import nl.bytesoflife.windregrid.model.SampleGrid;

/**
 * Regrids one channel from a source area onto a target area.
 *
 * <p>Implementations must not modify the source grid and must return a freshly
 * allocated grid with the target area's pixel dimensions. Pixels outside the
 * source coverage receive the implementation's fill value.
 */
public interface ResampleEngine {

    /**
     * @param workers maximum number of threads the implementation may use
     * @throws nl.bytesoflife.windregrid.ResampleException if the areas are
     *         degenerate, the grid does not match the source area, or a
     *         coordinate transform fails
     */
    SampleGrid resample(SampleGrid source, AreaDefinition sourceArea, AreaDefinition targetArea, int workers);

    String getName();
}
