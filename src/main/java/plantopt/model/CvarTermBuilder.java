package plantopt.model;

import plantopt.lp.Constraint;
import plantopt.lp.LinearExpr;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CvarTermBuilder {
    /**
     * Linearized conditional value at risk of the scenario losses (negated path values of the leaves).
     * <p>
     * With N equally likely scenarios and tail fraction beta,
     * CVaR = min over t of t + 1/(beta * N) * sum_i max(0, loss_i - t),
     * written with a free threshold t and one excess variable u_i >= max(0, loss_i - t) per scenario. The
     * minimization over t and u is left to the solver, so the term must enter a maximized objective with
     * a non-positive coefficient.
     */
    private final LpModel model;
    private final VariableAllocator allocator;
    private final double beta;

    private Variable threshold;
    private final ArrayList<Variable> excess;
    private final ArrayList<Constraint> excessConstraints;

    CvarTermBuilder(LpModel model, VariableAllocator allocator, double beta) {
        this.model = model;
        this.allocator = allocator;
        this.beta = beta;
        excess = new ArrayList<>();
        excessConstraints = new ArrayList<>();
    }

    /**
     * @param leaves terminal nodes, one per scenario.
     * @param pathValues total value of each scenario, aligned with leaves.
     * @return CVaR expression t + 1/(beta * N) * sum_i u_i.
     */
    LinearExpr build(List<Node> leaves, List<LinearExpr> pathValues) {
        final int n = leaves.size();
        threshold = model.freeVar("cvar_t");

        LinearExpr cvar = model.linearNumExpr();
        cvar.addTerm(threshold, 1.0);
        for (int i = 0; i < n; ++i) {
            Node leaf = leaves.get(i);
            Variable u = allocator.newVar("cvar_u_" + leaf.getId());
            excess.add(u);

            // u_i >= -pathValue_i - t
            LinearExpr expr = model.linearNumExpr();
            expr.addTerm(u, 1.0);
            expr.addTerm(threshold, 1.0);
            expr.add(pathValues.get(i), 1.0);
            excessConstraints.add(model.addGe(expr, 0.0, leaf.getId() + "_cvar_excess"));

            cvar.addTerm(u, 1.0 / (beta * n));
        }
        return cvar;
    }

    public Variable getThreshold() {
        return threshold;
    }

    public List<Variable> getExcess() {
        return Collections.unmodifiableList(excess);
    }

    public List<Constraint> getExcessConstraints() {
        return Collections.unmodifiableList(excessConstraints);
    }
}
