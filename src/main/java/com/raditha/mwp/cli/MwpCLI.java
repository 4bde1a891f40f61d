package com.raditha.mwp.cli;

import ch.qos.logback.classic.Level;
import com.raditha.mwp.analysis.ProgramAnalyzer;
import com.raditha.mwp.choice.ReductionStrategy;
import com.raditha.mwp.config.AnalysisConfig;
import com.raditha.mwp.config.AnalysisSettings;
import com.raditha.mwp.io.ResultCodec;
import com.raditha.mwp.model.AnalysisReport;
import com.raditha.mwp.model.FunctionResult;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the mwp analyzer.
 * <p>
 * Usage:
 * java -jar mwp-analyzer.jar [options] &lt;file&gt;
 * <p>
 * Configuration priority: CLI arguments > mwp.yml > defaults
 */
@Command(name = "mwp", mixinStandardHelpOptions = true, version = "mwp-analyzer v1.0.0",
        description = "Static mwp-bound analysis of C functions")
@SuppressWarnings("java:S106")
public class MwpCLI implements Callable<Integer> {

    @Parameters(index = "0", description = "C source file to analyze", paramLabel = "<file>")
    private File inputFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--outfile", description = "Report file (default: output/<name>.json)", paramLabel = "<path>")
    private String outFile;

    @Option(names = "--no-save", description = "Do not write the report file")
    private boolean noSave = false;

    @Option(names = "--no-eval", description = "Build relations only; skip choices and bounds")
    private boolean noEval = false;

    @Option(names = "--fin", description = "Stop analysing a function once infinity is unconditional")
    private boolean fin = false;

    @Option(names = "--strategy", description = "Witness reduction: ${COMPLETION-CANDIDATES}", paramLabel = "<name>",
            converter = StrategyConverter.class)
    private ReductionStrategy strategy;

    @Option(names = "--preset", description = "Configuration preset: default, fast or thorough", paramLabel = "<name>")
    private String preset;

    @Option(names = "--max-iterations", description = "Fixpoint iteration limit (default: 10000)", paramLabel = "<n>")
    private int maxIterations = 0; // 0 = use YAML/default

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean jsonOutput = false;

    @Option(names = "--silent", description = "Only log errors")
    private boolean silent = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        if (silent) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.raditha.mwp")).setLevel(Level.ERROR);
        }
        AnalysisConfig config = loadConfiguration();

        ProgramAnalyzer analyzer = new ProgramAnalyzer(config);
        AnalysisReport report = analyzer.run(inputFile.toPath(), outFile != null ? Path.of(outFile) : null);

        if (jsonOutput) {
            System.out.println(ResultCodec.toJson(report));
        } else {
            printTextReport(report);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping: 2 for invalid arguments or
     * configuration, 3 for I/O failures and 1 for anything else.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new MwpCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate the options and build the analysis configuration.
     *
     * @throws IllegalArgumentException if the options are invalid
     * @throws IOException              if the configuration file cannot be read
     */
    AnalysisConfig loadConfiguration() throws IOException {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Max-iterations must be positive, got: " + maxIterations);
        }
        if (inputFile == null || !inputFile.isFile()) {
            throw new IllegalArgumentException("Input file not found: " + inputFile);
        }
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Map<String, Object> yaml = AnalysisSettings.loadSection(configFile != null ? new File(configFile) : null);
        return AnalysisSettings.loadConfig(
                yaml,
                maxIterations,
                strategy != null ? strategy.name() : null,
                preset,
                noEval,
                fin,
                noSave);
    }

    private static void printTextReport(AnalysisReport report) {
        System.out.println("=".repeat(80));
        System.out.println("MWP ANALYSIS REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Program: %s (%d lines)%n", report.program(), report.lines());
        System.out.printf("Functions analysed: %d, infinite: %d%n", report.functions().size(), report.infiniteCount());
        if (!report.skipped().isEmpty()) {
            System.out.println("Skipped: " + String.join(", ", report.skipped()));
        }
        System.out.println();

        for (FunctionResult result : report.functions()) {
            System.out.printf("%s (%d choices, %d ms)%n", result.name(), result.index(), result.durationMillis());
            if (result.infinite()) {
                System.out.println("  infinite");
                for (Map.Entry<String, List<String>> flow : result.flows().entrySet()) {
                    System.out.printf("  %s -> %s%n", flow.getKey(), String.join(", ", flow.getValue()));
                }
            } else if (result.bound() != null) {
                System.out.println("  bound: " + result.bound().show(false));
                System.out.println("  safe choice vectors: " + result.choices().count());
            } else {
                System.out.println("  not evaluated");
            }
            System.out.println();
        }
        System.out.printf("Total time: %d ms%n", report.duration().toMillis());
    }

    /**
     * Custom converter for ReductionStrategy to handle CLI string values.
     */
    public static class StrategyConverter implements ITypeConverter<ReductionStrategy> {
        @Override
        public ReductionStrategy convert(String value) throws Exception {
            return ReductionStrategy.fromString(value);
        }
    }
}
