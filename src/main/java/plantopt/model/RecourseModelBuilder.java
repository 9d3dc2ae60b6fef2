package plantopt.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.domain.Plant;
import plantopt.domain.RiskSettings;
import plantopt.lp.Constraint;
import plantopt.lp.LinearExpr;
import plantopt.lp.LpModel;
import plantopt.tree.Node;
import plantopt.tree.ScenarioTree;
import plantopt.tree.TreeValidator;
import plantopt.utility.Enums;
import plantopt.utility.OptException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Builds the multistage recourse model of the refinery over a scenario tree.
 * <p>
 * Crude imports and the intermediates they yield are non-recourse decisions: they are taken at an
 * internal node and shared by all of its children. Routing of intermediates to refining units, outputs
 * and their split into at-price and excess quantities are recourse decisions taken at every non-root
 * node after its prices and demands are observed.
 * <p>
 * All inputs are checked in the constructor, so build() never leaves a partial model behind.
 */
public class RecourseModelBuilder {
    private final static Logger logger = LogManager.getLogger(RecourseModelBuilder.class);

    private final Plant plant;
    private final ScenarioTree tree;
    private final RiskSettings riskSettings;
    private final NodeValueIndex values;
    private final int products;

    private final LpModel model;
    private final VariableAllocator allocator;
    private final EnumMap<Enums.ConstraintFamily, NodeConstraintMap> families;

    private NodeVariableMap lightCrudeImport;
    private NodeVariableMap heavyCrudeImport;
    private NodeVariableMap intermediates; // intermediates[node][k] = quantity of intermediate k.
    private NodeVariableMap intermediateToUnit; // [node][k][o] = intermediate k sent to the unit of output o.
    private NodeVariableMap productOutput;
    private NodeVariableMap prodFullPrice;
    private NodeVariableMap prodExcess;

    private LinearExpr[] contributions; // unscaled value of each non-root node, null at the root.
    private LinearExpr[] pathValues; // cumulative contributions from the root down to each node.
    private LinearExpr expectation;
    private LinearExpr objective;
    private CvarTermBuilder cvarTermBuilder;
    private ChanceConstraintBuilder chanceConstraintBuilder;
    private boolean built;

    public RecourseModelBuilder(Plant plant, ScenarioTree tree, RiskSettings riskSettings) throws OptException {
        TreeValidator.validate(tree);
        this.plant = plant;
        this.tree = tree;
        this.riskSettings = riskSettings;
        this.products = plant.getProducts();
        this.values = new NodeValueIndex(tree, products);

        model = new LpModel("refinery_recourse");
        allocator = new VariableAllocator(tree, model);
        families = new EnumMap<>(Enums.ConstraintFamily.class);
        for (Enums.ConstraintFamily family : Enums.ConstraintFamily.values())
            families.put(family, new NodeConstraintMap(family, tree.size()));
        built = false;
    }

    public LpModel build() {
        if (built)
            throw new IllegalStateException("recourse model already built");

        logger.info("starting recourse model build over " + tree.size() + " nodes...");
        buildVariables();
        addDistillationConstraints();
        addRefiningConstraints();
        addDemandConstraints();
        addInterstageConstraints();
        buildObjective();
        built = true;

        logger.info("completed recourse model build: " + model.getNcols() + " columns, " + model.getNrows()
            + " rows, " + model.getNNZs() + " non-zeros");
        return model;
    }

    private void buildVariables() {
        lightCrudeImport = allocator.buildNonRecourse("light_crude_import");
        heavyCrudeImport = allocator.buildNonRecourse("heavy_crude_import");
        intermediates = allocator.buildNonRecourse("intermediates", products);

        intermediateToUnit = allocator.buildRecourse("intermediate_to_unit", products, products);
        productOutput = allocator.buildRecourse("products", products);
        prodFullPrice = allocator.buildRecourse("prod_full_price", products);
        prodExcess = allocator.buildRecourse("prod_excess", products);
    }

    private void addDistillationConstraints() {
        for (Node node : tree.getNodes()) {
            if (node.isTerminal())
                continue;

            final VariableBlock inter = intermediates.get(node);
            for (int k = 0; k < products; ++k) {
                LinearExpr expr = model.linearNumExpr();
                expr.addTerm(inter.get(k), 1.0);
                expr.addTerm(lightCrudeImport.get(node).scalar(), -plant.getLightCrudeRatio(k));
                expr.addTerm(heavyCrudeImport.get(node).scalar(), -plant.getHeavyCrudeRatio(k));
                add(Enums.ConstraintFamily.distil, node,
                    model.addEq(expr, 0.0, rowName(node, Enums.ConstraintFamily.distil, k)));
            }

            LinearExpr capExpr = model.linearNumExpr();
            capExpr.addTerm(lightCrudeImport.get(node).scalar(), 1.0);
            capExpr.addTerm(heavyCrudeImport.get(node).scalar(), 1.0);
            add(Enums.ConstraintFamily.distilCap, node, model.addLe(capExpr, plant.getDistillationCap(),
                node.getId() + "_" + Enums.ConstraintFamily.distilCap));
        }
    }

    private void addRefiningConstraints() {
        for (Node node : tree.getNodes()) {
            if (node.isRoot())
                continue;

            final Node parent = tree.getParent(node);
            final VariableBlock routing = intermediateToUnit.get(node);
            final VariableBlock output = productOutput.get(node);

            for (int o = 0; o < products; ++o) {
                LinearExpr outExpr = model.linearNumExpr();
                outExpr.addTerm(output.get(o), 1.0);
                for (int k = 0; k < products; ++k)
                    outExpr.addTerm(routing.get(k, o), -plant.getProductRatio(o, k));
                add(Enums.ConstraintFamily.productOut, node,
                    model.addEq(outExpr, 0.0, rowName(node, Enums.ConstraintFamily.productOut, o)));
            }

            for (int o = 0; o < products; ++o) {
                LinearExpr capExpr = model.linearNumExpr();
                for (int k = 0; k < products; ++k)
                    capExpr.addTerm(routing.get(k, o), 1.0);
                add(Enums.ConstraintFamily.refineCap, node, model.addLe(capExpr, plant.getRefineCap(o),
                    rowName(node, Enums.ConstraintFamily.refineCap, o)));
            }

            // every intermediate produced at the parent is routed to some unit at the child
            final VariableBlock parentIntermediates = intermediates.get(parent);
            for (int k = 0; k < products; ++k) {
                LinearExpr useExpr = model.linearNumExpr();
                for (int o = 0; o < products; ++o)
                    useExpr.addTerm(routing.get(k, o), 1.0);
                useExpr.addTerm(parentIntermediates.get(k), -1.0);
                add(Enums.ConstraintFamily.intermediatesRule, node,
                    model.addEq(useExpr, 0.0, rowName(node, Enums.ConstraintFamily.intermediatesRule, k)));
            }
        }
    }

    private void addDemandConstraints() {
        for (Node node : tree.getNodes()) {
            if (node.isRoot())
                continue;

            final VariableBlock output = productOutput.get(node);
            final VariableBlock fullPrice = prodFullPrice.get(node);
            final VariableBlock excess = prodExcess.get(node);

            for (int o = 0; o < products; ++o) {
                LinearExpr expr = model.linearNumExpr();
                expr.addTerm(output.get(o), 1.0);
                expr.addTerm(fullPrice.get(o), -1.0);
                expr.addTerm(excess.get(o), -1.0);
                add(Enums.ConstraintFamily.breakdown, node,
                    model.addEq(expr, 0.0, rowName(node, Enums.ConstraintFamily.breakdown, o)));
            }

            for (int o = 0; o < products; ++o) {
                add(Enums.ConstraintFamily.demand, node, model.addLe(new LinearExpr(fullPrice.get(o), 1.0),
                    values.demand(node, o), rowName(node, Enums.ConstraintFamily.demand, o)));
            }
        }
    }

    private void addInterstageConstraints() {
        final double change = plant.getAllowedOutputChange();
        for (Node node : tree.getNodes()) {
            // the first recourse level has no earlier output to stay close to
            if (node.isRoot() || tree.getParent(node).isRoot())
                continue;

            final VariableBlock output = productOutput.get(node);
            final VariableBlock parentOutput = productOutput.get(tree.getParent(node));
            for (int o = 0; o < products; ++o) {
                LinearExpr diff = model.linearNumExpr();
                diff.addTerm(output.get(o), 1.0);
                diff.addTerm(parentOutput.get(o), -1.0);
                add(Enums.ConstraintFamily.interstageUpper, node,
                    model.addLe(diff, change, rowName(node, Enums.ConstraintFamily.interstageUpper, o)));
                add(Enums.ConstraintFamily.interstageLower, node,
                    model.addGe(diff, -change, rowName(node, Enums.ConstraintFamily.interstageLower, o)));
            }
        }
    }

    private void buildObjective() {
        contributions = new LinearExpr[tree.size()];
        expectation = model.linearNumExpr();
        for (Node node : tree.getNodes()) {
            if (node.isRoot())
                continue;
            contributions[node.getIndex()] = buildContribution(node);
            // equal probability of all nodes in a stage
            expectation.add(contributions[node.getIndex()], 1.0 / tree.countAtStage(node.getStage()));
        }

        objective = expectation.copy();
        if (riskSettings.isCvarEnabled() || riskSettings.isChanceEnabled()) {
            buildPathValues();
            List<Node> leaves = tree.getLeaves();
            List<LinearExpr> leafValues = new ArrayList<>();
            for (Node leaf : leaves)
                leafValues.add(pathValues[leaf.getIndex()]);

            if (riskSettings.isCvarEnabled()) {
                cvarTermBuilder = new CvarTermBuilder(model, allocator, riskSettings.getCvarBeta());
                LinearExpr cvar = cvarTermBuilder.build(leaves, leafValues);
                objective.add(cvar, -riskSettings.getCvarWeight());
                logger.info("added CVaR term (beta " + riskSettings.getCvarBeta() + ", weight "
                    + riskSettings.getCvarWeight() + ") over " + leaves.size() + " scenarios");
            }
            if (riskSettings.isChanceEnabled()) {
                chanceConstraintBuilder = new ChanceConstraintBuilder(model, allocator,
                    riskSettings.getChanceCutoff(), riskSettings.getChanceFraction());
                chanceConstraintBuilder.build(leaves, leafValues);
                logger.info("added chance constraint (cutoff " + riskSettings.getChanceCutoff() + ", fraction "
                    + riskSettings.getChanceFraction() + ") over " + leaves.size() + " scenarios");
            }
        }
        model.addMaximize(objective);
    }

    /**
     * Value realized at a node: at-price sales at the node's prices minus the parent's crude imports
     * charged at the node's crude prices. Imports are decided before the node's prices are observed.
     */
    private LinearExpr buildContribution(Node node) {
        final Node parent = tree.getParent(node);
        final VariableBlock fullPrice = prodFullPrice.get(node);

        LinearExpr value = model.linearNumExpr();
        for (int o = 0; o < products; ++o)
            value.addTerm(fullPrice.get(o), values.price(node, o));
        value.addTerm(lightCrudeImport.get(parent).scalar(), -values.lightPrice(node));
        value.addTerm(heavyCrudeImport.get(parent).scalar(), -values.heavyPrice(node));
        return value;
    }

    /**
     * Accumulates contributions top-down in one breadth-first pass so that each node's path value is
     * its parent's path value plus its own contribution.
     */
    private void buildPathValues() {
        pathValues = new LinearExpr[tree.size()];
        for (int index : tree.breadthFirstOrder()) {
            Node node = tree.getNode(index);
            if (node.isRoot()) {
                pathValues[index] = model.linearNumExpr();
                continue;
            }
            pathValues[index] = pathValues[node.getParentIndex()].copy().add(contributions[index], 1.0);
        }
    }

    private void add(Enums.ConstraintFamily family, Node node, Constraint constraint) {
        families.get(family).put(node, constraint);
    }

    private static String rowName(Node node, Enums.ConstraintFamily family, int k) {
        return node.getId() + "_" + family + "_" + k;
    }

    private void checkBuilt() {
        if (!built)
            throw new IllegalStateException("recourse model not built yet");
    }

    public LpModel getModel() {
        return model;
    }

    public ScenarioTree getTree() {
        return tree;
    }

    public List<Constraint> getDomainConstraints() {
        return allocator.getDomainConstraints();
    }

    public NodeConstraintMap getConstraints(Enums.ConstraintFamily family) {
        return families.get(family);
    }

    public NodeVariableMap getLightCrudeImport() {
        return lightCrudeImport;
    }

    public NodeVariableMap getHeavyCrudeImport() {
        return heavyCrudeImport;
    }

    public NodeVariableMap getIntermediates() {
        return intermediates;
    }

    public NodeVariableMap getIntermediateToUnit() {
        return intermediateToUnit;
    }

    public NodeVariableMap getProductOutput() {
        return productOutput;
    }

    public NodeVariableMap getProdFullPrice() {
        return prodFullPrice;
    }

    public NodeVariableMap getProdExcess() {
        return prodExcess;
    }

    /**
     * @return unscaled value contribution of a non-root node.
     */
    public LinearExpr getContribution(Node node) {
        checkBuilt();
        if (node.isRoot())
            throw new IllegalArgumentException("the root has no value contribution");
        return contributions[node.getIndex()];
    }

    /**
     * @return total value of the scenario ending at the given node; only available with a risk term.
     */
    public LinearExpr getPathValue(Node node) {
        checkBuilt();
        if (pathValues == null)
            throw new IllegalStateException("path values are only built with a CVaR or chance term");
        return pathValues[node.getIndex()];
    }

    public LinearExpr getExpectation() {
        checkBuilt();
        return expectation;
    }

    public LinearExpr getObjective() {
        checkBuilt();
        return objective;
    }

    public CvarTermBuilder getCvarTermBuilder() {
        return cvarTermBuilder;
    }

    public ChanceConstraintBuilder getChanceConstraintBuilder() {
        return chanceConstraintBuilder;
    }
}
