package nl.bytesoflife.windregrid.resample;

import nl.bytesoflife.windregrid.RegridException;
import nl.bytesoflife.windregrid.ResampleException;
import nl.bytesoflife.windregrid.model.AreaDefinition;
import nl.bytesoflife.windregrid.model.SampleGrid;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Approximate nearest-neighbour resampling by line sampling: each target pixel
 * centre is projected into the source grid and takes the value of the source
 * pixel whose centre is closest along each axis. Target pixels that land
 * outside the source grid get the fill value.
 *
 * <p>Target rows are split into contiguous bands, one per worker.
 */
public class QuickNearestNeighbourResampler implements ResampleEngine {

    private static final Logger log = LoggerFactory.getLogger(QuickNearestNeighbourResampler.class);

    /** No-data value for target pixels without source coverage. */
    public static final int DEFAULT_FILL_VALUE = 0;

    private final int fillValue;

    public QuickNearestNeighbourResampler() {
        this(DEFAULT_FILL_VALUE);
    }

    public QuickNearestNeighbourResampler(int fillValue) {
        if (fillValue < SampleGrid.MIN_VALUE || fillValue > SampleGrid.MAX_VALUE) {
            throw new IllegalArgumentException("Fill value out of 8-bit range: " + fillValue);
        }
        this.fillValue = fillValue;
    }

    @Override
    public String getName() {
        return "nearest (quick)";
    }

    public int getFillValue() {
        return fillValue;
    }

    @Override
    public SampleGrid resample(SampleGrid source, AreaDefinition sourceArea, AreaDefinition targetArea, int workers) {
        validate(source, sourceArea, targetArea, workers);

        int rows = targetArea.getRows();
        int[] out = new int[rows * targetArea.getColumns()];
        int bands = Math.min(workers, rows);

        long start = System.currentTimeMillis();
        if (bands == 1) {
            new RowBand(source, sourceArea, targetArea, out, 0, rows).run();
        } else {
            runParallel(source, sourceArea, targetArea, out, bands);
        }
        log.debug("Resampled {}x{} -> {}x{} with {} band(s) in {}ms",
                source.getWidth(), source.getHeight(), targetArea.getColumns(), rows,
                bands, System.currentTimeMillis() - start);

        return new SampleGrid(targetArea.getColumns(), rows, out);
    }

    private void runParallel(SampleGrid source, AreaDefinition sourceArea, AreaDefinition targetArea,
                             int[] out, int bands) {
        int rows = targetArea.getRows();
        ExecutorService pool = Executors.newFixedThreadPool(bands);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int b = 0; b < bands; b++) {
                int startRow = (int) ((long) rows * b / bands);
                int endRow = (int) ((long) rows * (b + 1) / bands);
                futures.add(pool.submit(new RowBand(source, sourceArea, targetArea, out, startRow, endRow)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResampleException("Resampling interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RegridException regridException) {
                throw regridException;
            }
            throw new ResampleException("Resampling worker failed: " + cause, cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static void validate(SampleGrid source, AreaDefinition sourceArea, AreaDefinition targetArea, int workers) {
        if (workers < 1) {
            throw new ResampleException("Worker count must be at least 1, got " + workers);
        }
        if (sourceArea.isDegenerate()) {
            throw new ResampleException("Degenerate source area: " + sourceArea);
        }
        if (targetArea.isDegenerate()) {
            throw new ResampleException("Degenerate target area: " + targetArea);
        }
        if (source.getWidth() != sourceArea.getColumns() || source.getHeight() != sourceArea.getRows()) {
            throw new ResampleException("Source grid " + source.getWidth() + "x" + source.getHeight()
                    + " does not match source area " + sourceArea);
        }
    }

    /**
     * Fills target rows [startRow, endRow). Bands write disjoint slices of the output.
     */
    private final class RowBand implements Runnable {
        private final SampleGrid source;
        private final AreaDefinition sourceArea;
        private final AreaDefinition targetArea;
        private final int[] out;
        private final int startRow;
        private final int endRow;

        RowBand(SampleGrid source, AreaDefinition sourceArea, AreaDefinition targetArea,
                int[] out, int startRow, int endRow) {
            this.source = source;
            this.sourceArea = sourceArea;
            this.targetArea = targetArea;
            this.out = out;
            this.startRow = startRow;
            this.endRow = endRow;
        }

        @Override
        public void run() {
            CoordinateMapper mapper = CoordinateMapper.between(targetArea.getProjection(), sourceArea.getProjection());
            int columns = targetArea.getColumns();
            for (int row = startRow; row < endRow; row++) {
                for (int col = 0; col < columns; col++) {
                    Coordinate p = mapper.map(targetArea.pixelCentre(row, col));
                    out[row * columns + col] = sampleAt(p);
                }
            }
        }

        private int sampleAt(Coordinate p) {
            if (!Double.isFinite(p.x) || !Double.isFinite(p.y)) {
                return fillValue;
            }
            long srcRow = sourceArea.nearestRow(p.y);
            long srcCol = sourceArea.nearestColumn(p.x);
            if (!sourceArea.containsPixel(srcRow, srcCol)) {
                return fillValue;
            }
            return source.get((int) srcRow, (int) srcCol);
        }
    }
}
