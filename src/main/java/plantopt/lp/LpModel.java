package plantopt.lp;

import plantopt.utility.Enums;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LpModel {
    /**
     * Container for the columns, rows and objective of a linear (or mixed-binary) program. It mirrors
     * the calls a model builder makes on a solver's modelling API and is handed to a SolverAdapter or
     * exported with LpFileWriter.
     */
    private final String name;
    private final ArrayList<Variable> variables;
    private final ArrayList<Constraint> constraints;
    private LinearExpr objective;
    private boolean maximize;

    public LpModel(String name) {
        this.name = name;
        variables = new ArrayList<>();
        constraints = new ArrayList<>();
        objective = new LinearExpr();
        maximize = true;
    }

    public Variable numVar(double lb, double ub, String varName) {
        Variable var = new Variable(variables.size(), varName, Enums.VarType.CONTINUOUS, lb, ub);
        variables.add(var);
        return var;
    }

    public Variable freeVar(String varName) {
        return numVar(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, varName);
    }

    public Variable boolVar(String varName) {
        Variable var = new Variable(variables.size(), varName, Enums.VarType.BINARY, 0.0, 1.0);
        variables.add(var);
        return var;
    }

    public LinearExpr linearNumExpr() {
        return new LinearExpr();
    }

    public Constraint add(Constraint constraint) {
        constraints.add(constraint);
        return constraint;
    }

    public Constraint addLe(LinearExpr expr, double rhs, String rowName) {
        return add(new Constraint(rowName, expr, Enums.Sense.LE, rhs));
    }

    public Constraint addGe(LinearExpr expr, double rhs, String rowName) {
        return add(new Constraint(rowName, expr, Enums.Sense.GE, rhs));
    }

    public Constraint addEq(LinearExpr expr, double rhs, String rowName) {
        return add(new Constraint(rowName, expr, Enums.Sense.EQ, rhs));
    }

    /**
     * Adds lhs == rhs for two expressions by moving every term to the left.
     */
    public Constraint addEq(LinearExpr lhs, LinearExpr rhs, String rowName) {
        return addEq(lhs.copy().add(rhs, -1.0), 0.0, rowName);
    }

    public Constraint addLe(LinearExpr lhs, LinearExpr rhs, String rowName) {
        return addLe(lhs.copy().add(rhs, -1.0), 0.0, rowName);
    }

    public Constraint addGe(LinearExpr lhs, LinearExpr rhs, String rowName) {
        return addGe(lhs.copy().add(rhs, -1.0), 0.0, rowName);
    }

    public void addMaximize(LinearExpr expr) {
        objective = expr;
        maximize = true;
    }

    public void addMinimize(LinearExpr expr) {
        objective = expr;
        maximize = false;
    }

    public String getName() {
        return name;
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public LinearExpr getObjective() {
        return objective;
    }

    public boolean isMaximize() {
        return maximize;
    }

    public int getNrows() {
        return constraints.size();
    }

    public int getNcols() {
        return variables.size();
    }

    public int getNNZs() {
        int nnz = 0;
        for (Constraint constraint : constraints)
            nnz += constraint.getExpr().size();
        return nnz;
    }

    public int getNumBinaries() {
        int count = 0;
        for (Variable var : variables)
            if (var.getType() == Enums.VarType.BINARY)
                ++count;
        return count;
    }
}
