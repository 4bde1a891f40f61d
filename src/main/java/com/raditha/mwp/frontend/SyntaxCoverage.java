package com.raditha.mwp.frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constructs of one function that were left out of the analysis, counted by kind.
 */
public class SyntaxCoverage {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxCoverage.class);

    private final Map<String, Integer> omitted = new LinkedHashMap<>();

    public void omit(String kind) {
        omitted.merge(kind, 1, Integer::sum);
    }

    public boolean isFull() {
        return omitted.isEmpty();
    }

    public int count(String kind) {
        return omitted.getOrDefault(kind, 0);
    }

    public Map<String, Integer> omitted() {
        return Map.copyOf(omitted);
    }

    public void report(String function) {
        omitted.forEach((kind, n) -> logger.warn("{}: omitted {} x {}", function, n, kind));
    }
}
