package plantopt.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Node {
    /**
     * Class used to represent one realized state of the stochastic process. Nodes live in the arena of
     * their ScenarioTree; parent and children are referenced by arena index.
     */
    private final int index;
    private final String id;
    private final int stage;
    private final int parentIndex; // -1 for the root.
    private final ArrayList<Integer> children;
    private final double[] values; // positions follow ScenarioTree.getVariables().

    Node(int index, String id, int stage, int parentIndex, double[] values) {
        this.index = index;
        this.id = id;
        this.stage = stage;
        this.parentIndex = parentIndex;
        this.children = new ArrayList<>();
        this.values = values;
    }

    void addChild(int childIndex) {
        children.add(childIndex);
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public int getStage() {
        return stage;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    /**
     * @return true if the node has no children, i.e. it ends a scenario.
     */
    public boolean isTerminal() {
        return children.isEmpty();
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the arena index of the i-th child.
     *
     * @param i position of the child in creation (branch) order.
     * @return arena index of the child.
     */
    public int getChild(int i) {
        if (children.isEmpty())
            throw new IndexOutOfBoundsException("node " + id + " has no children (tried to access " + i + ")");
        if (i < 0 || i >= children.size())
            throw new IndexOutOfBoundsException(
                "node " + id + " has " + children.size() + " children, tried to access " + i);
        return children.get(i);
    }

    public double getValue(int column) {
        return values[column];
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public String toDetailString() {
        return "Node(" + id + ", parent=" + parentIndex + ", stage=" + stage + ", " + Arrays.toString(values) + ")";
    }

    @Override
    public String toString() {
        return "Node('" + id + "')";
    }
}
