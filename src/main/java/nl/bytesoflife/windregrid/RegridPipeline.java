package nl.bytesoflife.windregrid;

import nl.bytesoflife.windregrid.compute.MagnitudeCompute;
import nl.bytesoflife.windregrid.compute.Rescaler;
import nl.bytesoflife.windregrid.compute.SampleCodec;
import nl.bytesoflife.windregrid.geometry.AreaGeometryResolver;
import nl.bytesoflife.windregrid.geometry.ProjectionAdapter;
import nl.bytesoflife.windregrid.geometry.ResolvedGeometry;
import nl.bytesoflife.windregrid.geometry.UnitConverter;
import nl.bytesoflife.windregrid.model.AreaDefinition;
import nl.bytesoflife.windregrid.model.SampleGrid;
import nl.bytesoflife.windregrid.raster.GrayscaleRasterReader;
import nl.bytesoflife.windregrid.raster.GrayscaleRasterWriter;
import nl.bytesoflife.windregrid.resample.QuickNearestNeighbourResampler;
import nl.bytesoflife.windregrid.resample.ResampleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Runs a regrid end to end: validate, resolve geometry, read both channels,
 * resample each onto the target area, compute the magnitude, rescale and write.
 * Each stage completes before the next starts and any failure aborts the run
 * without leaving an output file behind.
 */
public class RegridPipeline {

    private static final Logger log = LoggerFactory.getLogger(RegridPipeline.class);

    private final ResampleEngine resampler;
    private final GrayscaleRasterReader reader;
    private final GrayscaleRasterWriter writer;

    public RegridPipeline() {
        this(new QuickNearestNeighbourResampler());
    }

    public RegridPipeline(ResampleEngine resampler) {
        this(resampler, new GrayscaleRasterReader(), new GrayscaleRasterWriter());
    }

    public RegridPipeline(ResampleEngine resampler, GrayscaleRasterReader reader, GrayscaleRasterWriter writer) {
        this.resampler = resampler;
        this.reader = reader;
        this.writer = writer;
    }

    public RegridResult run(RegridRequest request) {
        long start = System.currentTimeMillis();

        request.validate();
        SampleCodec codec = request.codec();
        ProjectionAdapter projection = new ProjectionAdapter(request.getProjection());
        Rescaler rescaler = new Rescaler(request.getRescale());
        int workers = effectiveWorkers(request.getWorkers());

        ResolvedGeometry geometry = resolveGeometry(request);
        double coverage = geometry.targetCoverage();
        if (coverage < 1.0) {
            log.warn("Target area is only {}% covered by the source area; uncovered pixels are written as 0",
                    String.format("%.1f", coverage * 100));
        }

        SampleGrid u = readChannel("u", request.getUFile());
        SampleGrid v = readChannel("v", request.getVFile());
        if (!u.hasSameShape(v)) {
            throw new InputException("u and v rasters differ in size: "
                    + u.getWidth() + "x" + u.getHeight() + " vs " + v.getWidth() + "x" + v.getHeight());
        }

        AreaDefinition sourceArea = projection.sourceArea(geometry, u.getWidth(), u.getHeight());
        AreaDefinition targetArea = projection.targetArea(geometry, u.getWidth(), u.getHeight());
        log.debug("Source area: {}", sourceArea);
        log.debug("Target area: {}", targetArea);

        log.info("Resampling u and v with {} using {} worker(s)", resampler.getName(), workers);
        SampleGrid uResampled = resample(u, sourceArea, targetArea, workers);
        SampleGrid vResampled = resample(v, sourceArea, targetArea, workers);

        SampleGrid magnitude = new MagnitudeCompute(codec).compute(uResampled, vResampled);
        SampleGrid output = rescaler.rescale(magnitude);
        if (output != magnitude) {
            log.info("Rescaled {}x{} -> {}x{} (ratio {})", magnitude.getWidth(), magnitude.getHeight(),
                    output.getWidth(), output.getHeight(), rescaler.getRatio());
        }

        Path written;
        try {
            written = writer.write(output, request.getOutputFile());
        } catch (IOException e) {
            throw new RegridException("Cannot write " + request.getOutputFile() + ": " + e.getMessage(), e);
        }

        RegridResult result = new RegridResult(written, output.getWidth(), output.getHeight(),
                geometry, sourceArea, targetArea, workers);
        log.info("Wrote {} in {}ms", result, System.currentTimeMillis() - start);
        return result;
    }

    private static ResolvedGeometry resolveGeometry(RegridRequest request) {
        try {
            return new AreaGeometryResolver(new UnitConverter(request.getDegreeScale()))
                    .resolve(request.getSourceShape(), request.getTargetShape(), request.getTargetOffset(),
                            request.getUnits());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid area geometry: " + e.getMessage(), e);
        }
    }

    static int effectiveWorkers(int requested) {
        int available = RegridRequest.defaultWorkers();
        if (requested > available) {
            log.warn("Requested {} workers but only {} processors are available; using {}",
                    requested, available, available);
            return available;
        }
        return requested;
    }

    private SampleGrid readChannel(String channel, Path path) {
        try {
            SampleGrid grid = reader.read(path);
            log.debug("Read {} component {}: {}x{}", channel, path, grid.getWidth(), grid.getHeight());
            return grid;
        } catch (NoSuchFileException e) {
            throw new InputException(channel + " component file not found: " + path, e);
        } catch (IOException e) {
            throw new InputException("Cannot read " + channel + " component " + path + ": " + e.getMessage(), e);
        }
    }

    private SampleGrid resample(SampleGrid grid, AreaDefinition sourceArea, AreaDefinition targetArea, int workers) {
        try {
            return resampler.resample(grid, sourceArea, targetArea, workers);
        } catch (RegridException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResampleException("Resampling failed: " + e.getMessage(), e);
        }
    }
}
