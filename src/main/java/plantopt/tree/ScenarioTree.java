package plantopt.tree;

import plantopt.utility.ConfigurationException;
import plantopt.utility.Constants;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Rooted scenario tree stored as a flat arena of nodes. The root is always at index 0 and every node's
 * index equals its position in the arena. Node values follow the column order of {@link #getVariables()}.
 */
public class ScenarioTree {
    private final List<String> variables;
    private final ArrayList<Node> nodes;
    private final int stageCount;
    private final int[] stageNodeCounts;

    ScenarioTree(List<String> variables, List<Node> nodes) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.nodes = new ArrayList<>(nodes);

        int maxStage = 0;
        for (Node node : nodes)
            maxStage = Math.max(maxStage, node.getStage());
        stageCount = nodes.isEmpty() ? 0 : maxStage + 1;

        stageNodeCounts = new int[stageCount];
        for (Node node : nodes)
            if (node.getStage() >= 0)
                ++stageNodeCounts[node.getStage()];
    }

    public List<String> getVariables() {
        return variables;
    }

    /**
     * @param name variable name.
     * @return value column of the variable, -1 if the tree does not carry it.
     */
    public int getColumn(String name) {
        return variables.indexOf(name);
    }

    public Node getRoot() {
        return nodes.get(0);
    }

    public Node getNode(int index) {
        return nodes.get(index);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public int getStageCount() {
        return stageCount;
    }

    public Node getParent(Node node) {
        return node.isRoot() ? null : nodes.get(node.getParentIndex());
    }

    /**
     * @return number of nodes that share the given stage; the equal-probability weight of a node is the
     * inverse of this count.
     */
    public int countAtStage(int stage) {
        return stageNodeCounts[stage];
    }

    public List<Node> getNodesAtStage(int stage) {
        List<Node> atStage = new ArrayList<>();
        for (Node node : nodes)
            if (node.getStage() == stage)
                atStage.add(node);
        return atStage;
    }

    public List<Node> getLeaves() {
        List<Node> leaves = new ArrayList<>();
        for (Node node : nodes)
            if (node.isTerminal())
                leaves.add(node);
        return leaves;
    }

    /**
     * @return nodes on the path from the root down to the given node, both included.
     */
    public List<Node> getPath(Node node) {
        ArrayList<Node> path = new ArrayList<>();
        Node current = node;
        while (current != null) {
            path.add(current);
            current = getParent(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * @return node indices in breadth-first order starting at the root.
     */
    public List<Integer> breadthFirstOrder() {
        List<Integer> order = new ArrayList<>();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        while (!queue.isEmpty()) {
            int index = queue.poll();
            order.add(index);
            queue.addAll(nodes.get(index).getChildren());
        }
        return order;
    }

    /**
     * Builds trees node by node. Children are named after their parent and their position among the
     * parent's children, so identifiers are stable and unique.
     */
    public static class Builder {
        private final List<String> variables;
        private final ArrayList<Node> nodes;
        private boolean built; // nodes are shared with the built tree, so no further additions.

        public Builder(List<String> variables) throws ConfigurationException {
            if (new HashSet<>(variables).size() != variables.size())
                throw new ConfigurationException("tree variable names must be unique: " + variables);
            this.variables = new ArrayList<>(variables);
            this.nodes = new ArrayList<>();
            this.built = false;
        }

        public int addRoot(double[] values) throws ConfigurationException {
            checkNotBuilt();
            if (!nodes.isEmpty())
                throw new ConfigurationException("tree already has a root");
            checkValues(values);
            nodes.add(new Node(0, Constants.ROOT_ID, 0, -1, values.clone()));
            return 0;
        }

        public int addChild(int parentIndex, double[] values) throws ConfigurationException {
            checkNotBuilt();
            if (parentIndex < 0 || parentIndex >= nodes.size())
                throw new ConfigurationException("unknown parent index " + parentIndex);
            checkValues(values);

            Node parent = nodes.get(parentIndex);
            final int index = nodes.size();
            final String id = parent.getId() + "_" + parent.getChildren().size();
            Node child = new Node(index, id, parent.getStage() + 1, parentIndex, values.clone());
            parent.addChild(index);
            nodes.add(child);
            return index;
        }

        public double[] getValues(int index) {
            return nodes.get(index).getValues();
        }

        public ScenarioTree build() throws ConfigurationException {
            if (nodes.isEmpty())
                throw new ConfigurationException("tree has no root");
            built = true;
            return new ScenarioTree(variables, nodes);
        }

        private void checkNotBuilt() throws ConfigurationException {
            if (built)
                throw new ConfigurationException("tree already built, nodes can no longer be added");
        }

        private void checkValues(double[] values) throws ConfigurationException {
            if (values.length != variables.size())
                throw new ConfigurationException(
                    "expected " + variables.size() + " node values, got " + values.length);
        }
    }
}
