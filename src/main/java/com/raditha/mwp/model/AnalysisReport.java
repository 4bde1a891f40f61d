package com.raditha.mwp.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Analysis of a whole source file.
 *
 * @param program   path of the analysed file
 * @param lines     number of lines in the file
 * @param start     when analysis started
 * @param end       when analysis finished
 * @param functions results in source order
 * @param skipped   names of functions that had nothing to analyze
 */
public record AnalysisReport(
        String program,
        int lines,
        Instant start,
        Instant end,
        List<FunctionResult> functions,
        List<String> skipped) {

    public AnalysisReport {
        functions = functions == null ? List.of() : List.copyOf(functions);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public Optional<FunctionResult> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public long infiniteCount() {
        return functions.stream().filter(FunctionResult::infinite).count();
    }
}
