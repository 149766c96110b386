package nl.bytesoflife.windregrid.cli;

import nl.bytesoflife.windregrid.RegridRequest;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

/**
 * Command line options of {@link WindRegridCommand}.
 */
final class CommandLineOptions {

    static final String SOURCE_AREA = "s";
    static final String TARGET_AREA = "t";
    static final String TARGET_OFFSET = "o";
    static final String UNITS = "u";
    static final String PROJECTION = "p";
    static final String RESCALE = "r";
    static final String ENCODING = "e";
    static final String NPROCS = "nprocs";
    static final String VERSION = "v";
    static final String HELP = "h";

    private CommandLineOptions() {
    }

    static Options create() {
        Options options = new Options();
        options.addOption(Option.builder(SOURCE_AREA).longOpt("sArea").numberOfArgs(2).argName("W H")
                .desc("source area shape in the given units, as longitude and latitude extent (default 500 500)")
                .build());
        options.addOption(Option.builder(TARGET_AREA).longOpt("tArea").numberOfArgs(2).argName("W H")
                .desc("target area shape in the given units (default: source area shape)")
                .build());
        options.addOption(Option.builder(TARGET_OFFSET).longOpt("tOffset").numberOfArgs(2).argName("DX DY")
                .desc("target area offset from the source centroid, as longitude and latitude offset")
                .build());
        options.addOption(Option.builder(UNITS).longOpt("units").hasArg().argName("m|d")
                .desc("units of area shapes and offset, 'm' (meters) or 'd' (degrees) (default m)")
                .build());
        options.addOption(Option.builder(PROJECTION).longOpt("projection").hasArg().argName("PROJ")
                .desc("projection applied to source and target areas (default '"
                        + RegridRequest.DEFAULT_PROJECTION + "')")
                .build());
        options.addOption(Option.builder(RESCALE).longOpt("rescale").hasArg().argName("RATIO")
                .desc("scale factor in (0, 1] applied to the output image (default 1.0)")
                .build());
        options.addOption(Option.builder(ENCODING).longOpt("encoding").hasArg().argName("wind|raw")
                .desc("sample encoding of the input and output images (default wind)")
                .build());
        options.addOption(Option.builder().longOpt(NPROCS).hasArg().argName("N")
                .desc("number of workers used for resampling (default: available processors)")
                .build());
        options.addOption(Option.builder(VERSION).longOpt("version").desc("print version and exit").build());
        options.addOption(Option.builder(HELP).longOpt("help").desc("print this help and exit").build());
        return options;
    }
}
