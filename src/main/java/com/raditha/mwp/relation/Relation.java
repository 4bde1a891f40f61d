package com.raditha.mwp.relation;

import com.raditha.mwp.algebra.Delta;
import com.raditha.mwp.algebra.Polynomial;
import com.raditha.mwp.algebra.Scalar;
import com.raditha.mwp.choice.Choices;
import com.raditha.mwp.choice.ReductionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A square polynomial matrix indexed by an ordered variable list.
 * {@code get(x, y)} is the contribution of the old value of x to the new value of y.
 * <p>
 * Relations over different variable sets are combined after homogenization: the
 * variable lists are united (left operand order first) and every missing variable
 * behaves as the identity.
 */
public final class Relation {

    private static final Logger logger = LoggerFactory.getLogger(Relation.class);

    private static final Relation EMPTY = new Relation(List.of(), Matrix.zero(0));

    private final List<String> variables;
    private final Matrix matrix;

    public Relation(List<String> variables, Matrix matrix) {
        if (variables.size() != matrix.size()) {
            throw new IllegalArgumentException(
                    "Relation has " + variables.size() + " variables but a matrix of size " + matrix.size());
        }
        if (new LinkedHashSet<>(variables).size() != variables.size()) {
            throw new IllegalArgumentException("Duplicate variables in relation: " + variables);
        }
        this.variables = List.copyOf(variables);
        this.matrix = matrix;
    }

    /**
     * The relation over no variables. It is the neutral element of composition.
     */
    public static Relation empty() {
        return EMPTY;
    }

    public static Relation identity(List<String> variables) {
        return new Relation(variables, Matrix.identity(variables.size()));
    }

    /**
     * The relation in which no variable depends on anything.
     */
    public static Relation zero(List<String> variables) {
        return new Relation(variables, Matrix.zero(variables.size()));
    }

    /**
     * The identity relation with the column of {@code target} replaced by
     * {@code vector}, which is aligned with {@code variables}.
     */
    public static Relation replaceColumn(List<String> variables, List<Polynomial> vector, String target) {
        int col = variables.indexOf(target);
        if (col < 0) {
            throw new IllegalArgumentException("Variable " + target + " is not in " + variables);
        }
        if (vector.size() != variables.size()) {
            throw new IllegalArgumentException("Vector length " + vector.size()
                    + " does not match " + variables.size() + " variables");
        }
        Matrix m = Matrix.identity(variables.size());
        for (int row = 0; row < vector.size(); row++) {
            m = m.with(row, col, vector.get(row));
        }
        return new Relation(variables, m);
    }

    public List<String> variables() {
        return variables;
    }

    public Matrix matrix() {
        return matrix;
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public Polynomial get(String from, String to) {
        int row = variables.indexOf(from);
        int col = variables.indexOf(to);
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Unknown variable pair " + from + ", " + to);
        }
        return matrix.get(row, col);
    }

    /**
     * Sequential composition: this relation followed by {@code other}.
     */
    public Relation compose(Relation other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<String> union = union(other);
        return new Relation(union, extendTo(union).matrix.times(other.extendTo(union).matrix));
    }

    /**
     * Nondeterministic choice between this relation and {@code other}.
     */
    public Relation sum(Relation other) {
        if (isEmpty() && other.isEmpty()) {
            return this;
        }
        List<String> union = union(other);
        return new Relation(union, extendTo(union).matrix.plus(other.extendTo(union).matrix));
    }

    public Relation fixpoint(int iterationLimit) {
        if (isEmpty()) {
            return this;
        }
        return new Relation(variables, matrix.fixpoint(iterationLimit));
    }

    public Relation whileCorrection() {
        return new Relation(variables, matrix.whileCorrection());
    }

    public Scalar[][] evaluate(int[] choices) {
        return matrix.evaluate(choices);
    }

    /**
     * Extend this relation to a superset of its variables; the new variables are
     * mapped by the identity.
     */
    public Relation extendTo(List<String> target) {
        if (target.equals(variables)) {
            return this;
        }
        if (!target.containsAll(variables)) {
            throw new IllegalArgumentException("Cannot extend " + variables + " to " + target);
        }
        int n = target.size();
        List<List<Polynomial>> rows = new ArrayList<>(n);
        for (int r = 0; r < n; r++) {
            int oldRow = variables.indexOf(target.get(r));
            List<Polynomial> row = new ArrayList<>(n);
            for (int c = 0; c < n; c++) {
                int oldCol = variables.indexOf(target.get(c));
                if (oldRow >= 0 && oldCol >= 0) {
                    row.add(matrix.get(oldRow, oldCol));
                } else if (oldRow < 0 && oldCol < 0 && r == c) {
                    row.add(Polynomial.UNIT);
                } else {
                    row.add(Polynomial.ZERO);
                }
            }
            rows.add(row);
        }
        logger.debug("Homogenized {} to {}", variables, target);
        return new Relation(target, Matrix.of(rows));
    }

    private List<String> union(Relation other) {
        Set<String> union = new LinkedHashSet<>(variables);
        union.addAll(other.variables);
        return List.copyOf(union);
    }

    public boolean hasInfinity() {
        int n = variables.size();
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (matrix.get(r, c).hasInfinity()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Delta lists of every i-monomial in the matrix.
     */
    public List<List<Delta>> infinityWitnesses() {
        Set<List<Delta>> witnesses = new LinkedHashSet<>();
        int n = variables.size();
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                witnesses.addAll(matrix.get(r, c).infinityWitnesses());
            }
        }
        return new ArrayList<>(witnesses);
    }

    /**
     * Choices of every variable taken on its own: the witnesses of the
     * variable's column only.
     *
     * @param domain   the legal values at every index
     * @param index    the number of choice indices
     * @param strategy the witness minimization to use
     * @return the choices keyed by variable, in variable order
     */
    public Map<String, Choices> variableChoices(List<Integer> domain, int index, ReductionStrategy strategy) {
        Map<String, Choices> choices = new LinkedHashMap<>();
        int n = variables.size();
        for (int c = 0; c < n; c++) {
            Set<List<Delta>> witnesses = new LinkedHashSet<>();
            for (int r = 0; r < n; r++) {
                witnesses.addAll(matrix.get(r, c).infinityWitnesses());
            }
            choices.put(variables.get(c), Choices.generate(domain, index, witnesses, strategy));
        }
        return choices;
    }

    /**
     * For each source variable, the target variables it reaches through a
     * polynomial containing i.
     */
    public Map<String, List<String>> infinityFlows() {
        return infinityFlows(List.of());
    }

    /**
     * Infinity flows restricted to pairs whose source or target is one of
     * {@code including}. An empty collection keeps every pair.
     */
    public Map<String, List<String>> infinityFlows(Collection<String> including) {
        Map<String, List<String>> flows = new LinkedHashMap<>();
        int n = variables.size();
        for (int r = 0; r < n; r++) {
            List<String> targets = new ArrayList<>();
            for (int c = 0; c < n; c++) {
                if (matrix.get(r, c).hasInfinity() && (including.isEmpty()
                        || including.contains(variables.get(r)) || including.contains(variables.get(c)))) {
                    targets.add(variables.get(c));
                }
            }
            if (!targets.isEmpty()) {
                flows.put(variables.get(r), targets);
            }
        }
        return flows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Relation other
                && variables.equals(other.variables)
                && matrix.equals(other.matrix);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + matrix.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.join(", ", variables)).append('\n');
        sb.append(matrix);
        return sb.toString();
    }
}
