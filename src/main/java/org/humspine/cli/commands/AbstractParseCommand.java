package org.humspine.cli.commands;

import com.typesafe.config.ConfigException;
import org.humspine.cli.CommandLineInterface;
import org.humspine.parser.HumdrumFile;
import org.humspine.parser.HumdrumReader;
import org.humspine.parser.api.ParserOptions;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Common options of the commands that read Humdrum input.
 * Exit codes: 0 on success, 1 for invalid input, 2 for configuration errors.
 */
abstract class AbstractParseCommand implements Callable<Integer> {

    static final int EXIT_INVALID = 1;
    static final int EXIT_CONFIG = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--csv", description = "Read the input as CSV instead of tab-separated text.")
    private boolean csv;

    @Option(names = {"-v", "--verbosity"}, defaultValue = "-1",
            description = "Parser trace level, 0 (errors) to 4 (trace). Default: unchanged.")
    private int verbosity;

    @Override
    public final Integer call() {
        final HumdrumReader reader;
        try {
            reader = new HumdrumReader(ParserOptions.fromConfig(parent.getConfig()));
        } catch (ConfigException e) {
            err().println("Failed to load or parse configuration: " + e.getMessage());
            return EXIT_CONFIG;
        }
        reader.setVerbosity(verbosity);
        return run(reader);
    }

    /**
     * @param reader A reader configured from the command line and the configuration.
     * @return The exit code.
     */
    protected abstract int run(HumdrumReader reader);

    /**
     * Reads one input; {@code "-"} reads standard input.
     */
    protected HumdrumFile read(HumdrumReader reader, String input) {
        if (csv) {
            return "-".equals(input)
                    ? reader.readCsv(new InputStreamReader(System.in, StandardCharsets.UTF_8), "<stdin>")
                    : reader.readCsv(Path.of(input));
        }
        return reader.read(input);
    }

    /**
     * Prints the parse error of an invalid file.
     * @return {@code true} if the file is valid.
     */
    protected boolean reportIfInvalid(HumdrumFile file) {
        if (file.isValid()) {
            return true;
        }
        file.getParseErrorDetail().ifPresent(error -> err().println(error));
        return false;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
