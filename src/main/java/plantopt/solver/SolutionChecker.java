package plantopt.solver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.lp.Constraint;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.utility.Constants;
import plantopt.utility.Enums;
import plantopt.utility.OptException;

import java.util.ArrayList;
import java.util.List;

/**
 * SolutionChecker evaluates a point against every row and column bound of a model. It is used to check
 * values returned by a solver before they are reported.
 */
public class SolutionChecker {
    private final static Logger logger = LogManager.getLogger(SolutionChecker.class);
    private final LpModel model;
    private final double tolerance;

    public SolutionChecker(LpModel model) {
        this(model, Constants.EPS);
    }

    public SolutionChecker(LpModel model, double tolerance) {
        this.model = model;
        this.tolerance = tolerance;
    }

    public List<Constraint> getViolatedConstraints(double[] values) throws OptException {
        checkLength(values);
        List<Constraint> violated = new ArrayList<>();
        for (Constraint constraint : model.getConstraints())
            if (!constraint.isSatisfied(values, tolerance))
                violated.add(constraint);
        return violated;
    }

    public List<Variable> getViolatedBounds(double[] values) throws OptException {
        checkLength(values);
        List<Variable> violated = new ArrayList<>();
        for (Variable var : model.getVariables()) {
            final double value = values[var.getIndex()];
            boolean ok = value >= var.getLb() - tolerance && value <= var.getUb() + tolerance;
            if (ok && var.getType() == Enums.VarType.BINARY)
                ok = Math.abs(value - Math.rint(value)) <= tolerance;
            if (!ok)
                violated.add(var);
        }
        return violated;
    }

    public boolean isFeasible(double[] values) throws OptException {
        List<Constraint> rows = getViolatedConstraints(values);
        List<Variable> columns = getViolatedBounds(values);
        for (Constraint row : rows)
            logger.debug("violated row " + row.getName() + " by " + row.violation(values));
        for (Variable column : columns)
            logger.debug("violated bound of " + column.getName() + ": " + values[column.getIndex()]);
        return rows.isEmpty() && columns.isEmpty();
    }

    public double getObjectiveValue(double[] values) throws OptException {
        checkLength(values);
        return model.getObjective().evaluate(values);
    }

    private void checkLength(double[] values) throws OptException {
        if (values.length != model.getNcols())
            throw new OptException("expected " + model.getNcols() + " values, got " + values.length);
    }
}
