package com.splayrope;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * The main application class of the rope driver. It reads an initial text and
 * a list of cut-and-paste operations, applies them to a {@link Rope}, and
 * writes the resulting text.
 */
public class RopeDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(RopeDriver.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_ABORTED = 2;

    private final InputFormat format;
    private final ErrorPolicy errorPolicy;
    private final int maxLength;
    private final ObjectMapper objectMapper;

    /**
     * Create a new driver.
     *
     * @param format
     *            The protocol of the input.
     * @param errorPolicy
     *            What to do with operations that are out of range.
     * @param maxLength
     *            The capacity of the rope.
     * @param objectMapper
     *            Mapper used for JSON input.
     */
    public RopeDriver(InputFormat format, ErrorPolicy errorPolicy, int maxLength, ObjectMapper objectMapper) {
        this.format = format;
        this.errorPolicy = errorPolicy;
        this.maxLength = maxLength;
        this.objectMapper = objectMapper;
    }

    /**
     * Read the script from the input, apply it, and write the resulting text
     * followed by a newline. If the run is aborted nothing is written.
     *
     * @param input
     *            The input to read the script from.
     * @param output
     *            The output to write the text to.
     * @return A summary of the run.
     * @throws IOException
     *             If reading or writing fails or the input is malformed.
     * @throws RopeResourceException
     *             If the text does not fit into the rope.
     */
    public RunReport run(Reader input, Writer output) throws IOException {
        long start = System.nanoTime();
        OperationScript script = OperationScript.read(format, input, objectMapper);
        RunReport report = new RunReport();
        report.operations = script.operations.size();
        Rope rope = Rope.build(script.text, maxLength);
        try {
            report.length = rope.length();
            LOGGER.info("Applying {} operations to text of length {}", report.operations, report.length);
            int index = 0;
            for (MoveOperation operation : script.operations) {
                Result<Rope> result = operation.applyTo(rope);
                if (!result.isError()) {
                    report.applied++;
                } else if (errorPolicy == ErrorPolicy.SKIP) {
                    report.rejected++;
                    LOGGER.warn("Skipping operation {} {}: {}", index, operation, result.getError().getMessage());
                } else {
                    report.rejected++;
                    report.aborted = true;
                    LOGGER.error("Aborting at operation {} {}", index, operation, result.getError());
                    break;
                }
                index++;
            }
            if (!report.aborted) {
                output.write(rope.render());
                output.write('\n');
                output.flush();
            }
        } finally {
            rope.dispose();
        }
        report.elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        LOGGER.info("Finished run: {}", report);
        return report;
    }

    /**
     * Parse the command line, run the driver, and return the process exit code.
     *
     * @param args
     *            The command line arguments.
     * @return The exit code.
     */
    static int execute(String[] args) {
        // Parse command line.
        ArgumentParser parser = ArgumentParsers.newFor("RopeDriver").build()
                .description("Apply cut-and-paste operations to a text using a splay tree rope");
        parser.addArgument("--input").metavar("FILE")
                .help("file to read the text and operations from (default: stdin)");
        parser.addArgument("--output").metavar("FILE")
                .help("file to write the resulting text to (default: stdout)");
        parser.addArgument("--format").choices("text", "json").setDefault("text")
                .help("input format");
        parser.addArgument("--on-error").choices("abort", "skip").setDefault("abort")
                .help("what to do with operations that are out of range");
        parser.addArgument("--max-length").metavar("CHARS").type(Integer.class)
                .choices(Arguments.range(0, Rope.UNBOUNDED))
                .setDefault(Rope.UNBOUNDED).help("maximum length of the text");
        parser.addArgument("--report").metavar("FILE")
                .help("write a JSON summary of the run to this file");
        parser.addArgument("--log-level").type(String.class).setDefault("info")
                .help("configures the log level (default: info; values: all|trace|debug|info|warn|error|off");
        Namespace cmd;
        try {
            cmd = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            return EXIT_FAILURE;
        }
        // Read options.
        String inputFile = cmd.getString("input");
        String outputFile = cmd.getString("output");
        InputFormat format = InputFormat.fromString(cmd.getString("format"));
        ErrorPolicy errorPolicy = ErrorPolicy.fromString(cmd.getString("on_error"));
        int maxLength = cmd.getInt("max_length");
        String reportFile = cmd.getString("report");
        String logLevel = cmd.getString("log_level");
        // Configures logging.
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logLevel));
        loggerContext.getLogger("com.splayrope").setLevel(Level.toLevel(logLevel));
        ObjectMapper objectMapper = new ObjectMapper();
        RopeDriver driver = new RopeDriver(format, errorPolicy, maxLength, objectMapper);
        RunReport report;
        try (Reader input = inputFile == null
                ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
                : Files.newBufferedReader(Path.of(inputFile), StandardCharsets.UTF_8);
                Writer output = outputFile == null
                        ? new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8))
                        : Files.newBufferedWriter(Path.of(outputFile), StandardCharsets.UTF_8)) {
            report = driver.run(input, output);
        } catch (IOException e) {
            LOGGER.error("Failed to process input", e);
            return EXIT_FAILURE;
        } catch (RopeResourceException e) {
            LOGGER.error("Failed to build rope", e);
            return EXIT_FAILURE;
        }
        if (reportFile != null) {
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(Path.of(reportFile).toFile(), report);
            } catch (IOException e) {
                LOGGER.error("Failed to write report to '{}'", reportFile, e);
                return EXIT_FAILURE;
            }
        }
        return report.aborted ? EXIT_ABORTED : EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }
}
