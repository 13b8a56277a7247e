package com.spreadsheet.formula.cli;

import com.spreadsheet.formula.config.SpreadsheetProperties;
import com.spreadsheet.formula.exceptions.SpreadsheetException;
import com.spreadsheet.formula.services.SpreadsheetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Batch mode: evaluates the grid in the input file named on the command line
 * and writes the rendered result to the configured output file.
 *
 * Exit codes: 0 on success, 1 when the input cannot be read or evaluation fails,
 * 2 on bad usage. Does nothing when the application was started without arguments.
 */
@Component
public class GridFileRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(GridFileRunner.class);

    static final String PROGRAM_NAME = "formula-grid";

    private final SpreadsheetService spreadsheetService;
    private final SpreadsheetProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public GridFileRunner(SpreadsheetService spreadsheetService, SpreadsheetProperties properties) {
        this(spreadsheetService, properties, System.out, System.err);
    }

    GridFileRunner(SpreadsheetService spreadsheetService, SpreadsheetProperties properties,
                   PrintStream out, PrintStream err) {
        this.spreadsheetService = spreadsheetService;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.getSourceArgs().length == 0) {
            return; // serving HTTP instead
        }
        exitCode = run(args.getNonOptionArgs());
    }

    /**
     * Runs one batch over the given positional arguments and returns the exit code.
     */
    public int run(List<String> positionalArgs) {
        if (positionalArgs.size() != 1) {
            err.println("Usage: " + PROGRAM_NAME + " <input>");
            return 2;
        }

        String inputFilename = positionalArgs.get(0);
        String input;
        try {
            input = Files.readString(Path.of(inputFilename), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("File `" + inputFilename + "` not found");
            return 1;
        } catch (IOException e) {
            logger.error("Failed to read {}", inputFilename, e);
            err.println("Could not read `" + inputFilename + "`: " + e.getMessage());
            return 1;
        }

        String output;
        try {
            output = spreadsheetService.render(input);
        } catch (SpreadsheetException e) {
            logger.warn("Evaluation of {} aborted [{}]", inputFilename, e.getCode());
            err.println(e.getMessage());
            return 1;
        }

        Path outputFile = Path.of(properties.getOutputFile());
        try {
            Files.writeString(outputFile, output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Failed to write {}", outputFile, e);
            err.println("Could not write `" + outputFile + "`: " + e.getMessage());
            return 1;
        }

        out.println("Output saved to: " + properties.getOutputFile());
        return 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
