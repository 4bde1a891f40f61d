package com.raditha.mwp.relation;

import com.raditha.mwp.algebra.Polynomial;
import com.raditha.mwp.algebra.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable square matrix of polynomials.
 */
public final class Matrix {

    private static final Logger logger = LoggerFactory.getLogger(Matrix.class);

    private final Polynomial[][] cells;

    private Matrix(Polynomial[][] cells) {
        this.cells = cells;
    }

    /**
     * Copy the given rows into a new matrix.
     *
     * @throws IllegalArgumentException if the rows do not form a square matrix
     */
    public static Matrix of(List<List<Polynomial>> rows) {
        int n = rows.size();
        Polynomial[][] cells = new Polynomial[n][n];
        for (int r = 0; r < n; r++) {
            List<Polynomial> row = rows.get(r);
            if (row.size() != n) {
                throw new IllegalArgumentException(
                        "Matrix is not square: row " + r + " has " + row.size() + " cells, expected " + n);
            }
            for (int c = 0; c < n; c++) {
                if (row.get(c) == null) {
                    throw new IllegalArgumentException("Matrix cell (" + r + "," + c + ") is null");
                }
                cells[r][c] = row.get(c);
            }
        }
        return new Matrix(cells);
    }

    public static Matrix zero(int size) {
        Polynomial[][] cells = new Polynomial[size][size];
        for (Polynomial[] row : cells) {
            Arrays.fill(row, Polynomial.ZERO);
        }
        return new Matrix(cells);
    }

    public static Matrix identity(int size) {
        Polynomial[][] cells = zero(size).cells;
        for (int k = 0; k < size; k++) {
            cells[k][k] = Polynomial.UNIT;
        }
        return new Matrix(cells);
    }

    public int size() {
        return cells.length;
    }

    public Polynomial get(int row, int col) {
        return cells[row][col];
    }

    public List<List<Polynomial>> rows() {
        List<List<Polynomial>> rows = new ArrayList<>(cells.length);
        for (Polynomial[] row : cells) {
            rows.add(List.of(row));
        }
        return rows;
    }

    /**
     * Return a copy with one cell replaced.
     */
    public Matrix with(int row, int col, Polynomial value) {
        Polynomial[][] copy = copyCells();
        copy[row][col] = value;
        return new Matrix(copy);
    }

    public Matrix plus(Matrix other) {
        requireSameSize(other);
        int n = size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                result[r][c] = cells[r][c].add(other.cells[r][c]);
            }
        }
        return new Matrix(result);
    }

    public Matrix times(Matrix other) {
        requireSameSize(other);
        int n = size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                Polynomial sum = Polynomial.ZERO;
                for (int k = 0; k < n; k++) {
                    sum = sum.add(cells[r][k].times(other.cells[k][c]));
                }
                result[r][c] = sum;
            }
        }
        return new Matrix(result);
    }

    /**
     * Kleene star I + M + M² + ... computed by accumulating powers until the
     * accumulated sum stops changing.
     *
     * @param iterationLimit maximum number of powers to accumulate
     * @throws IllegalStateException if the sum has not stabilized within the limit
     */
    public Matrix fixpoint(int iterationLimit) {
        Matrix fix = identity(size());
        Matrix power = fix;
        for (int iteration = 1; iteration <= iterationLimit; iteration++) {
            power = power.times(this);
            Matrix next = fix.plus(power);
            if (next.equals(fix)) {
                logger.debug("Fixpoint of {}x{} matrix reached after {} iterations", size(), size(), iteration);
                return fix;
            }
            fix = next;
        }
        throw new IllegalStateException("Fixpoint not reached within " + iterationLimit + " iterations");
    }

    /**
     * Loop correction: p anywhere and w on the diagonal become i.
     */
    public Matrix whileCorrection() {
        int n = size();
        Polynomial[][] result = new Polynomial[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                boolean diagonal = r == c;
                result[r][c] = cells[r][c].mapScalars(
                        s -> s == Scalar.P || (diagonal && s == Scalar.W) ? Scalar.I : s);
            }
        }
        return new Matrix(result);
    }

    public Scalar[][] evaluate(int[] choices) {
        int n = size();
        Scalar[][] result = new Scalar[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                result[r][c] = cells[r][c].evaluate(choices);
            }
        }
        return result;
    }

    private Polynomial[][] copyCells() {
        Polynomial[][] copy = new Polynomial[cells.length][];
        for (int r = 0; r < cells.length; r++) {
            copy[r] = cells[r].clone();
        }
        return copy;
    }

    private void requireSameSize(Matrix other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException(
                    "Matrix dimensions differ: " + size() + " and " + other.size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Matrix other && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Polynomial[] row : cells) {
            sb.append(Arrays.toString(row)).append('\n');
        }
        return sb.toString();
    }
}
