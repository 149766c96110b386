package nl.bytesoflife.windregrid.cli;

import nl.bytesoflife.windregrid.ConfigurationException;
import nl.bytesoflife.windregrid.RegridException;
import nl.bytesoflife.windregrid.RegridPipeline;
import nl.bytesoflife.windregrid.RegridRequest;
import nl.bytesoflife.windregrid.RegridResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * wind-regrid [options] uFile vFile oFile
 * </pre>
 *
 * Exit status: 0 on success, 1 when the run fails, 2 on a usage or configuration error.
 */
public class WindRegridCommand {

    private static final Logger log = LoggerFactory.getLogger(WindRegridCommand.class);

    static final String PROGRAM = "wind-regrid";
    static final String FALLBACK_VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final RegridPipeline pipeline;

    public WindRegridCommand() {
        this(new RegridPipeline());
    }

    public WindRegridCommand(RegridPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static void main(String[] args) {
        System.exit(new WindRegridCommand().run(args, System.out, System.err));
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        Options options = CommandLineOptions.create();
        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            return usageError(options, err, e.getMessage());
        }

        if (cmd.hasOption(CommandLineOptions.HELP)) {
            printUsage(options, out);
            return EXIT_OK;
        }
        if (cmd.hasOption(CommandLineOptions.VERSION)) {
            out.println(PROGRAM + " " + version());
            return EXIT_OK;
        }

        RegridRequest request;
        try {
            request = toRequest(cmd);
        } catch (IllegalArgumentException e) {
            return usageError(options, err, e.getMessage());
        } catch (ConfigurationException e) {
            err.println(PROGRAM + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            RegridResult result = pipeline.run(request);
            log.debug("Completed: {}", result);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println(PROGRAM + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (RegridException e) {
            log.error("Regrid failed: {}", e.getMessage());
            log.debug("Failure details", e);
            err.println(PROGRAM + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static RegridRequest toRequest(CommandLine cmd) {
        List<String> files = cmd.getArgList();
        if (files.size() != 3) {
            throw new IllegalArgumentException("expected uFile vFile oFile, got " + files.size() + " file argument(s)");
        }

        RegridRequest request = new RegridRequest(Path.of(files.get(0)), Path.of(files.get(1)), Path.of(files.get(2)));

        if (cmd.hasOption(CommandLineOptions.UNITS)) {
            request.withUnits(cmd.getOptionValue(CommandLineOptions.UNITS));
        }
        if (cmd.hasOption(CommandLineOptions.SOURCE_AREA)) {
            double[] wh = pair(cmd, CommandLineOptions.SOURCE_AREA);
            request.withSourceShape(wh[0], wh[1]);
        }
        if (cmd.hasOption(CommandLineOptions.TARGET_AREA)) {
            double[] wh = pair(cmd, CommandLineOptions.TARGET_AREA);
            request.withTargetShape(wh[0], wh[1]);
        }
        if (cmd.hasOption(CommandLineOptions.TARGET_OFFSET)) {
            double[] d = pair(cmd, CommandLineOptions.TARGET_OFFSET);
            request.withTargetOffset(d[0], d[1]);
        }
        if (cmd.hasOption(CommandLineOptions.PROJECTION)) {
            request.withProjection(cmd.getOptionValue(CommandLineOptions.PROJECTION));
        }
        if (cmd.hasOption(CommandLineOptions.RESCALE)) {
            request.withRescale(number(cmd.getOptionValue(CommandLineOptions.RESCALE), "rescale"));
        }
        if (cmd.hasOption(CommandLineOptions.ENCODING)) {
            request.withEncoding(cmd.getOptionValue(CommandLineOptions.ENCODING));
        }
        if (cmd.hasOption(CommandLineOptions.NPROCS)) {
            String value = cmd.getOptionValue(CommandLineOptions.NPROCS);
            try {
                request.withWorkers(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--nprocs: '" + value + "' is not an integer");
            }
        }
        return request;
    }

    private static double[] pair(CommandLine cmd, String option) {
        String[] values = cmd.getOptionValues(option);
        if (values == null || values.length != 2) {
            throw new IllegalArgumentException("-" + option + " expects two values");
        }
        return new double[]{number(values[0], option), number(values[1], option)};
    }

    private static double number(String value, String option) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("-" + option + ": '" + value + "' is not a number");
        }
    }

    private static int usageError(Options options, PrintStream err, String message) {
        err.println(PROGRAM + ": " + message);
        printUsage(options, err);
        return EXIT_USAGE;
    }

    private static void printUsage(Options options, PrintStream stream) {
        PrintWriter pw = new PrintWriter(stream);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH,
                PROGRAM + " [options] uFile vFile oFile",
                "Regrid u/v wind component images and write the wind speed magnitude.", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        pw.flush();
    }

    static String version() {
        String version = WindRegridCommand.class.getPackage().getImplementationVersion();
        return version != null ? version : FALLBACK_VERSION;
    }
}
