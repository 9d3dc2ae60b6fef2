package plantopt.lp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class LinearExpr {
    /**
     * Sum of coefficient * variable terms plus a constant. Terms on the same variable are merged and
     * terms whose coefficient cancels to zero are dropped.
     */
    private final LinkedHashMap<Variable, Double> terms;
    private double constant;

    public LinearExpr() {
        terms = new LinkedHashMap<>();
        constant = 0.0;
    }

    public LinearExpr(Variable var, double coef) {
        this();
        addTerm(var, coef);
    }

    public LinearExpr addTerm(Variable var, double coef) {
        if (coef == 0.0)
            return this;
        double merged = terms.getOrDefault(var, 0.0) + coef;
        if (merged == 0.0)
            terms.remove(var);
        else
            terms.put(var, merged);
        return this;
    }

    public LinearExpr addConstant(double value) {
        constant += value;
        return this;
    }

    /**
     * Adds scale * other to this expression.
     */
    public LinearExpr add(LinearExpr other, double scale) {
        if (scale == 0.0)
            return this;
        for (Map.Entry<Variable, Double> entry : other.terms.entrySet())
            addTerm(entry.getKey(), entry.getValue() * scale);
        constant += other.constant * scale;
        return this;
    }

    public LinearExpr copy() {
        LinearExpr copy = new LinearExpr();
        copy.add(this, 1.0);
        return copy;
    }

    public Map<Variable, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    public double getCoefficient(Variable var) {
        return terms.getOrDefault(var, 0.0);
    }

    public double getConstant() {
        return constant;
    }

    public int size() {
        return terms.size();
    }

    /**
     * @param values solution values indexed by Variable.getIndex().
     * @return value of the expression at the given point.
     */
    public double evaluate(double[] values) {
        double result = constant;
        for (Map.Entry<Variable, Double> entry : terms.entrySet())
            result += entry.getValue() * values[entry.getKey().getIndex()];
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Variable, Double> entry : terms.entrySet()) {
            if (sb.length() > 0)
                sb.append(" + ");
            sb.append(entry.getValue()).append(" ").append(entry.getKey().getName());
        }
        if (constant != 0.0 || sb.length() == 0) {
            if (sb.length() > 0)
                sb.append(" + ");
            sb.append(constant);
        }
        return sb.toString();
    }
}
