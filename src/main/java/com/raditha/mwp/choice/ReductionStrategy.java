package com.raditha.mwp.choice;

/**
 * How infinity witnesses are minimized.
 */
public enum ReductionStrategy {
    SET,
    GRAPH;

    public WitnessReducer reducer() {
        return this == GRAPH ? new DeltaGraph() : new SetReducer();
    }

    /**
     * Parse a strategy name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ReductionStrategy fromString(String value) {
        for (ReductionStrategy s : values()) {
            if (s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown reduction strategy: " + value + ". Valid values: set, graph");
    }
}
