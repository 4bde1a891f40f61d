package com.raditha.mwp.analysis;

import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.relation.Relation;

/**
 * Result of analysing one function.
 *
 * @param name         function name
 * @param relation     final relation over every variable of the function
 * @param startIndex   first choice index used
 * @param index        next unused choice index
 * @param choices      safe choices, null when evaluation was skipped
 * @param infinite     true when no safe choice exists
 * @param stoppedEarly true when analysis stopped at an unconditional infinity
 */
public record AnalysisResult(
        String name,
        Relation relation,
        int startIndex,
        int index,
        Choices choices,
        boolean infinite,
        boolean stoppedEarly) {

    public boolean evaluated() {
        return choices != null;
    }
}
