package plantopt.solver;

import plantopt.lp.LinearExpr;
import plantopt.lp.Variable;
import plantopt.utility.Enums;

public class SolveResult {
    /**
     * Outcome of a solver call. Values are indexed by Variable.getIndex() and are only meaningful for
     * OPTIMAL results.
     */
    private final Enums.SolveStatus status;
    private final double objective;
    private final double[] values;

    public SolveResult(Enums.SolveStatus status, double objective, double[] values) {
        this.status = status;
        this.objective = objective;
        this.values = values;
    }

    public static SolveResult failed(Enums.SolveStatus status) {
        return new SolveResult(status, Double.NaN, new double[0]);
    }

    public Enums.SolveStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == Enums.SolveStatus.OPTIMAL;
    }

    public double getObjective() {
        return objective;
    }

    /**
     * @return copy of the values, indexed by Variable.getIndex().
     */
    public double[] getValues() {
        return values.clone();
    }

    public double getValue(Variable var) {
        if (var.getIndex() >= values.length)
            throw new IllegalStateException("no value for " + var.getName() + " in a " + status + " result");
        return values[var.getIndex()];
    }

    public double getValue(LinearExpr expr) {
        return expr.evaluate(values);
    }
}
