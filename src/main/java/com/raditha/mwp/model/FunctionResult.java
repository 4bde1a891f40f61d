package com.raditha.mwp.model;

import com.raditha.mwp.bound.Bound;
import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.relation.Relation;

import java.util.List;
import java.util.Map;

/**
 * Everything reported for one analysed function.
 *
 * @param name           function name
 * @param variables      variables of the function
 * @param relation       the final relation
 * @param index          number of choice indices used
 * @param choices        safe choices, null when not evaluated
 * @param infinite       true when no safe choice exists
 * @param bound          bounds under the first safe choice, null when infinite or not evaluated
 * @param flows          source to target variables with an infinite dependency, empty unless infinite
 * @param durationMillis analysis time
 */
public record FunctionResult(
        String name,
        List<String> variables,
        Relation relation,
        int index,
        Choices choices,
        boolean infinite,
        Bound bound,
        Map<String, List<String>> flows,
        long durationMillis) {

    public FunctionResult {
        variables = variables == null ? List.of() : List.copyOf(variables);
        flows = flows == null ? Map.of() : flows;
    }

    public boolean evaluated() {
        return choices != null;
    }
}
