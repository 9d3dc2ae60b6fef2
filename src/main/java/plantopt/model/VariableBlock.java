package plantopt.model;

import plantopt.lp.Variable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class VariableBlock {
    /**
     * Scalar, vector or matrix of variables allocated for one tree node. Matrix elements are stored
     * row-major.
     */
    private final int rows; // 0 for a scalar block.
    private final int cols; // 0 for scalar and vector blocks.
    private final Variable[] vars;

    VariableBlock(int rows, int cols, Variable[] vars) {
        this.rows = rows;
        this.cols = cols;
        this.vars = vars;
    }

    public boolean isScalar() {
        return rows == 0;
    }

    public boolean isMatrix() {
        return cols > 0;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public Variable scalar() {
        if (!isScalar())
            throw new IllegalStateException("block of " + vars.length + " variables is not a scalar");
        return vars[0];
    }

    public Variable get(int i) {
        if (isMatrix())
            throw new IllegalStateException("matrix block needs two indices");
        return vars[isScalar() ? checkIndex(i, 1) : checkIndex(i, rows)];
    }

    public Variable get(int i, int j) {
        if (!isMatrix())
            throw new IllegalStateException("block is not a matrix");
        return vars[checkIndex(i, rows) * cols + checkIndex(j, cols)];
    }

    public List<Variable> getAll() {
        return Collections.unmodifiableList(Arrays.asList(vars));
    }

    public int size() {
        return vars.length;
    }

    private static int checkIndex(int i, int bound) {
        if (i < 0 || i >= bound)
            throw new IndexOutOfBoundsException("index " + i + " outside block of length " + bound);
        return i;
    }
}
