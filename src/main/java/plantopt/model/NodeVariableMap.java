package plantopt.model;

import plantopt.tree.Node;
import plantopt.utility.Enums;

public class NodeVariableMap {
    /**
     * Binding of one decision (e.g. light crude import) to the tree nodes its recourse class applies to,
     * stored by node index.
     */
    private final String name;
    private final Enums.RecourseClass recourseClass;
    private final VariableBlock[] blocks;

    NodeVariableMap(String name, Enums.RecourseClass recourseClass, int numNodes) {
        this.name = name;
        this.recourseClass = recourseClass;
        this.blocks = new VariableBlock[numNodes];
    }

    void put(Node node, VariableBlock block) {
        if (blocks[node.getIndex()] != null)
            throw new IllegalStateException(name + " already bound at node " + node.getId());
        blocks[node.getIndex()] = block;
    }

    public String getName() {
        return name;
    }

    public Enums.RecourseClass getRecourseClass() {
        return recourseClass;
    }

    public boolean contains(Node node) {
        return blocks[node.getIndex()] != null;
    }

    public VariableBlock get(Node node) {
        VariableBlock block = blocks[node.getIndex()];
        if (block == null)
            throw new IllegalStateException(name + " (" + recourseClass + ") has no variables at node " + node.getId());
        return block;
    }

    /**
     * @return number of nodes with a binding.
     */
    public int size() {
        int count = 0;
        for (VariableBlock block : blocks)
            if (block != null)
                ++count;
        return count;
    }
}
