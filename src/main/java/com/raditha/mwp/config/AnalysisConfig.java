package com.raditha.mwp.config;

import com.raditha.mwp.choice.ReductionStrategy;

/**
 * Configuration for mwp analysis.
 *
 * @param fixpointIterationLimit Maximum number of matrix powers accumulated when computing a loop fixpoint
 * @param reduction              How infinity witnesses are minimized
 * @param evaluate               Derive safe choices and bounds after building the relation
 * @param stopOnInfinity         Stop analysing a function once infinity becomes unconditional
 * @param saveResult             Write the report to a JSON file
 * @param outputDirectory        Directory for reports when no output file is given
 */
public record AnalysisConfig(
        int fixpointIterationLimit,
        ReductionStrategy reduction,
        boolean evaluate,
        boolean stopOnInfinity,
        boolean saveResult,
        String outputDirectory) {

    public static final int DEFAULT_ITERATION_LIMIT = 10_000;
    public static final String DEFAULT_OUTPUT_DIRECTORY = "output";

    /**
     * Validate configuration.
     */
    public AnalysisConfig {
        if (fixpointIterationLimit < 1) {
            throw new IllegalArgumentException("fixpointIterationLimit must be >= 1");
        }
        if (reduction == null) {
            throw new IllegalArgumentException("reduction cannot be null");
        }
        if (outputDirectory == null || outputDirectory.isBlank()) {
            outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        }
    }

    /**
     * Full analysis with set based witness reduction.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                DEFAULT_ITERATION_LIMIT,
                ReductionStrategy.SET,
                true, // evaluate
                false, // stopOnInfinity
                true, // saveResult
                DEFAULT_OUTPUT_DIRECTORY);
    }

    /**
     * Relation only: skips choice evaluation and stops at the first unconditional infinity.
     */
    public static AnalysisConfig fast() {
        return new AnalysisConfig(
                DEFAULT_ITERATION_LIMIT,
                ReductionStrategy.SET,
                false, // evaluate
                true, // stopOnInfinity
                true, // saveResult
                DEFAULT_OUTPUT_DIRECTORY);
    }

    /**
     * Full analysis using the delta graph reduction.
     */
    public static AnalysisConfig thorough() {
        return new AnalysisConfig(
                DEFAULT_ITERATION_LIMIT,
                ReductionStrategy.GRAPH,
                true, // evaluate
                false, // stopOnInfinity
                true, // saveResult
                DEFAULT_OUTPUT_DIRECTORY);
    }
}
