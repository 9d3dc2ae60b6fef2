package plantopt.lp;

import plantopt.utility.Enums;

import java.util.Map;

public class Constraint {
    /**
     * A row "expr sense rhs". Constants of the expression are folded into the right hand side when the
     * constraint is created, so getExpr() only holds variable terms.
     */
    private final String name;
    private final LinearExpr expr;
    private final Enums.Sense sense;
    private final double rhs;

    public Constraint(String name, LinearExpr expr, Enums.Sense sense, double rhs) {
        this.name = name;
        this.expr = new LinearExpr();
        for (Map.Entry<Variable, Double> term : expr.getTerms().entrySet())
            this.expr.addTerm(term.getKey(), term.getValue());
        this.sense = sense;
        this.rhs = rhs - expr.getConstant();
    }

    public String getName() {
        return name;
    }

    public LinearExpr getExpr() {
        return expr;
    }

    public Enums.Sense getSense() {
        return sense;
    }

    public double getRhs() {
        return rhs;
    }

    /**
     * @return amount by which the row is violated at the given point, 0 if it holds.
     */
    public double violation(double[] values) {
        final double lhs = expr.evaluate(values);
        switch (sense) {
            case LE:
                return Math.max(0.0, lhs - rhs);
            case GE:
                return Math.max(0.0, rhs - lhs);
            default:
                return Math.abs(lhs - rhs);
        }
    }

    public boolean isSatisfied(double[] values, double tolerance) {
        return violation(values) <= tolerance;
    }

    @Override
    public String toString() {
        final String op = sense == Enums.Sense.LE ? "<=" : sense == Enums.Sense.GE ? ">=" : "=";
        return name + ": " + expr + " " + op + " " + rhs;
    }
}
