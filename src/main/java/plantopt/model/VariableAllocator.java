package plantopt.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.lp.Constraint;
import plantopt.lp.LinearExpr;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.tree.Node;
import plantopt.tree.ScenarioTree;
import plantopt.utility.Enums;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VariableAllocator {
    /**
     * Allocates decision variables over a scenario tree according to their recourse class. Every
     * allocated variable is non-negative; the matching domain constraints are collected here.
     */
    private final static Logger logger = LogManager.getLogger(VariableAllocator.class);
    private final ScenarioTree tree;
    private final LpModel model;
    private final ArrayList<Constraint> domainConstraints;

    public VariableAllocator(ScenarioTree tree, LpModel model) {
        this.tree = tree;
        this.model = model;
        domainConstraints = new ArrayList<>();
    }

    /**
     * Allocates one block per internal node, root included. Terminal nodes never get a block since no
     * future unfolds from them, so a single-node tree gets none.
     *
     * @param name decision name used for variable labels.
     * @param shape empty for a scalar, {n} for a vector, {rows, cols} for a matrix.
     * @return node bindings of the decision.
     */
    public NodeVariableMap buildNonRecourse(String name, int... shape) {
        NodeVariableMap map = new NodeVariableMap(name, Enums.RecourseClass.NON_RECOURSE, tree.size());
        ArrayDeque<Node> nodesToProcess = new ArrayDeque<>();
        if (!tree.getRoot().isTerminal())
            nodesToProcess.add(tree.getRoot());

        while (!nodesToProcess.isEmpty()) {
            Node node = nodesToProcess.poll();
            map.put(node, newBlock(node.getId() + "_" + name, shape));

            for (int childIndex : node.getChildren()) {
                Node child = tree.getNode(childIndex);
                if (!child.isTerminal())
                    nodesToProcess.add(child);
            }
        }
        logger.debug("allocated non-recourse " + name + " at " + map.size() + " nodes");
        return map;
    }

    /**
     * Allocates one block per non-root node, terminal nodes included.
     *
     * @param name decision name used for variable labels.
     * @param shape empty for a scalar, {n} for a vector, {rows, cols} for a matrix.
     * @return node bindings of the decision.
     */
    public NodeVariableMap buildRecourse(String name, int... shape) {
        NodeVariableMap map = new NodeVariableMap(name, Enums.RecourseClass.RECOURSE, tree.size());
        ArrayDeque<Node> nodesToProcess = new ArrayDeque<>();
        for (int childIndex : tree.getRoot().getChildren())
            nodesToProcess.add(tree.getNode(childIndex));

        while (!nodesToProcess.isEmpty()) {
            Node node = nodesToProcess.poll();
            map.put(node, newBlock(node.getId() + "_" + name, shape));

            for (int childIndex : node.getChildren())
                nodesToProcess.add(tree.getNode(childIndex));
        }
        logger.debug("allocated recourse " + name + " at " + map.size() + " nodes");
        return map;
    }

    private VariableBlock newBlock(String prefix, int[] shape) {
        if (shape.length > 2)
            throw new IllegalArgumentException("blocks have at most two dimensions, got " + shape.length);

        if (shape.length == 0)
            return new VariableBlock(0, 0, new Variable[]{newVar(prefix)});

        if (shape.length == 1) {
            Variable[] vars = new Variable[shape[0]];
            for (int i = 0; i < shape[0]; ++i)
                vars[i] = newVar(prefix + "_" + i);
            return new VariableBlock(shape[0], 0, vars);
        }

        Variable[] vars = new Variable[shape[0] * shape[1]];
        for (int i = 0; i < shape[0]; ++i)
            for (int j = 0; j < shape[1]; ++j)
                vars[i * shape[1] + j] = newVar(prefix + "_" + i + "_" + j);
        return new VariableBlock(shape[0], shape[1], vars);
    }

    /**
     * Creates a non-negative continuous variable and records its domain constraint.
     */
    Variable newVar(String varName) {
        Variable var = model.numVar(0.0, Double.POSITIVE_INFINITY, varName);
        domainConstraints.add(new Constraint("domain_" + varName, new LinearExpr(var, 1.0), Enums.Sense.GE, 0.0));
        return var;
    }

    public List<Constraint> getDomainConstraints() {
        return Collections.unmodifiableList(domainConstraints);
    }
}
