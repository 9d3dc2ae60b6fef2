package plantopt.model;

import plantopt.lp.Constraint;
import plantopt.lp.LinearExpr;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ChanceConstraintBuilder {
    /**
     * Requires at least a given fraction of the scenarios to reach a cutoff total value.
     * <p>
     * Each scenario i gets a binary indicator z_i and a non-negative offset mask m_i with
     * pathValue_i >= m_i, m_i >= cutoff * z_i and sum_i z_i >= fraction * N. No big-M bound is used: with
     * z_i = 0 the mask may drop to 0, which still requires pathValue_i >= 0 for every scenario.
     */
    private final LpModel model;
    private final VariableAllocator allocator;
    private final double cutoff;
    private final double fraction;

    private final ArrayList<Variable> indicators;
    private final ArrayList<Variable> masks;
    private final ArrayList<Constraint> rows;

    ChanceConstraintBuilder(LpModel model, VariableAllocator allocator, double cutoff, double fraction) {
        this.model = model;
        this.allocator = allocator;
        this.cutoff = cutoff;
        this.fraction = fraction;
        indicators = new ArrayList<>();
        masks = new ArrayList<>();
        rows = new ArrayList<>();
    }

    void build(List<Node> leaves, List<LinearExpr> pathValues) {
        LinearExpr countExpr = model.linearNumExpr();
        for (int i = 0; i < leaves.size(); ++i) {
            Node leaf = leaves.get(i);
            Variable z = model.boolVar("chance_z_" + leaf.getId());
            Variable m = allocator.newVar("chance_mask_" + leaf.getId());
            indicators.add(z);
            masks.add(m);

            LinearExpr valueExpr = pathValues.get(i).copy();
            valueExpr.addTerm(m, -1.0);
            rows.add(model.addGe(valueExpr, 0.0, leaf.getId() + "_chance_value"));

            LinearExpr maskExpr = model.linearNumExpr();
            maskExpr.addTerm(m, 1.0);
            maskExpr.addTerm(z, -cutoff);
            rows.add(model.addGe(maskExpr, 0.0, leaf.getId() + "_chance_mask"));

            countExpr.addTerm(z, 1.0);
        }
        rows.add(model.addGe(countExpr, fraction * leaves.size(), "chance_count"));
    }

    public List<Variable> getIndicators() {
        return Collections.unmodifiableList(indicators);
    }

    public List<Variable> getMasks() {
        return Collections.unmodifiableList(masks);
    }

    public List<Constraint> getRows() {
        return Collections.unmodifiableList(rows);
    }
}
