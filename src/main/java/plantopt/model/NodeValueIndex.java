package plantopt.model;

import plantopt.tree.Node;
import plantopt.tree.ScenarioTree;
import plantopt.utility.ConfigurationException;
import plantopt.utility.Constants;

class NodeValueIndex {
    /**
     * Resolves, once, the tree value columns the refinery model reads at every node: crude prices,
     * product prices and product demands.
     */
    private final int lightPriceColumn;
    private final int heavyPriceColumn;
    private final int[] priceColumns;
    private final int[] demandColumns;

    NodeValueIndex(ScenarioTree tree, int products) throws ConfigurationException {
        lightPriceColumn = column(tree, Constants.CRUDE_LIGHT_PRICE);
        heavyPriceColumn = column(tree, Constants.CRUDE_HEAVY_PRICE);
        priceColumns = new int[products];
        demandColumns = new int[products];
        for (int k = 0; k < products; ++k) {
            priceColumns[k] = column(tree, Constants.PRODUCT_PRICE_PREFIX + k);
            demandColumns[k] = column(tree, Constants.DEMAND_PREFIX + k);
        }

        for (Node node : tree.getNodes()) {
            if (node.isRoot())
                continue;
            checkFinite(tree, node, lightPriceColumn);
            checkFinite(tree, node, heavyPriceColumn);
            for (int k = 0; k < products; ++k) {
                checkFinite(tree, node, priceColumns[k]);
                checkFinite(tree, node, demandColumns[k]);
            }
        }
    }

    private static int column(ScenarioTree tree, String name) throws ConfigurationException {
        final int column = tree.getColumn(name);
        if (column < 0)
            throw new ConfigurationException("scenario tree does not carry required value " + name
                + " (available: " + tree.getVariables() + ")");
        return column;
    }

    private static void checkFinite(ScenarioTree tree, Node node, int column) throws ConfigurationException {
        if (!Double.isFinite(node.getValue(column)))
            throw new ConfigurationException("node " + node.getId() + " has no usable value for "
                + tree.getVariables().get(column));
    }

    double lightPrice(Node node) {
        return node.getValue(lightPriceColumn);
    }

    double heavyPrice(Node node) {
        return node.getValue(heavyPriceColumn);
    }

    double price(Node node, int output) {
        return node.getValue(priceColumns[output]);
    }

    double demand(Node node, int output) {
        return node.getValue(demandColumns[output]);
    }
}
