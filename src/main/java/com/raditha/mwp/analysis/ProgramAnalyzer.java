package com.raditha.mwp.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.mwp.ast.FunctionDef;
import com.raditha.mwp.bound.Bound;
import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.config.AnalysisConfig;
import com.raditha.mwp.frontend.AstReducer;
import com.raditha.mwp.frontend.SourceParser;
import com.raditha.mwp.io.ResultStore;
import com.raditha.mwp.model.AnalysisReport;
import com.raditha.mwp.model.FunctionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for analysing a source file.
 * Coordinates parsing, reduction, per-function analysis, bound calculation and
 * saving the report.
 */
public class ProgramAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ProgramAnalyzer.class);

    private final AnalysisConfig config;
    private final Analyzer analyzer;
    private final ResultStore store;

    /**
     * Create program analyzer with custom configuration.
     */
    public ProgramAnalyzer(AnalysisConfig config) {
        this(config, new Analyzer(config), new ResultStore());
    }

    public ProgramAnalyzer(AnalysisConfig config, Analyzer analyzer, ResultStore store) {
        this.config = config;
        this.analyzer = analyzer;
        this.store = store;
    }

    /**
     * Analyze a file and save the report when saving is enabled.
     *
     * @param source  the C source file
     * @param outFile where to save; null for the default location
     */
    public AnalysisReport run(Path source, Path outFile) throws IOException {
        AnalysisReport report = analyze(source);
        if (config.saveResult()) {
            Path target = outFile != null ? outFile : ResultStore.defaultOutput(config.outputDirectory(), source);
            store.save(report, target);
        }
        return report;
    }

    public AnalysisReport analyze(Path source) throws IOException {
        return analyze(Files.readString(source, StandardCharsets.UTF_8), source.toString());
    }

    /**
     * Analyze every function of a source text.
     *
     * @param source  the source text
     * @param program name recorded in the report
     */
    public AnalysisReport analyze(String source, String program) {
        Instant start = Instant.now();

        // Step 1: Parse
        CompilationUnit cu = SourceParser.parse(source);

        // Step 2: Reduce and analyze each function
        List<FunctionResult> results = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (MethodDeclaration method : SourceParser.functions(cu)) {
            AstReducer reducer = new AstReducer();
            FunctionDef function = reducer.reduce(method);
            reducer.coverage().report(function.name());
            if (!function.hasBody()) {
                logger.warn("{}: nothing to analyze, skipping", function.name());
                skipped.add(function.name());
                continue;
            }
            results.add(analyzeFunction(function));
        }

        // Step 3: Report
        int lines = source.isEmpty() ? 0 : (int) source.lines().count();
        return new AnalysisReport(program, lines, start, Instant.now(), results, skipped);
    }

    /**
     * Analyze one function, deriving its bound or its problematic flows.
     */
    public FunctionResult analyzeFunction(FunctionDef function) {
        logger.info("Analysing {}", function.name());
        long started = System.currentTimeMillis();
        AnalysisResult result = analyzer.analyze(function, 0);

        Bound bound = null;
        Map<String, List<String>> flows = Map.of();
        if (result.infinite()) {
            List<String> definitelyInfinite = result.relation()
                    .variableChoices(Choices.DEFAULT_DOMAIN, result.index(), config.reduction())
                    .entrySet().stream()
                    .filter(e -> e.getValue().infinite())
                    .map(Map.Entry::getKey)
                    .toList();
            flows = result.relation().infinityFlows(definitelyInfinite);
            logger.info("{} is infinite, problematic flows: {}", function.name(), flows);
        } else if (result.evaluated()) {
            bound = Bound.calculate(result.relation(), result.choices().first());
            logger.info("{} is polynomially bounded: {}", function.name(), bound.show(true));
        }
        long duration = System.currentTimeMillis() - started;
        return new FunctionResult(function.name(), function.variables(), result.relation(), result.index(),
                result.choices(), result.infinite(), bound, flows, duration);
    }
}
