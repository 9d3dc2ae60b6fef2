package plantopt.model;

import plantopt.lp.Constraint;
import plantopt.tree.Node;
import plantopt.utility.Enums;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class NodeConstraintMap {
    /**
     * Rows of one constraint family, grouped by the node they were built for.
     */
    private final Enums.ConstraintFamily family;
    private final ArrayList<List<Constraint>> rowsByNode;

    NodeConstraintMap(Enums.ConstraintFamily family, int numNodes) {
        this.family = family;
        rowsByNode = new ArrayList<>(Collections.nCopies(numNodes, (List<Constraint>) null));
    }

    void put(Node node, Constraint constraint) {
        List<Constraint> rows = rowsByNode.get(node.getIndex());
        if (rows == null) {
            rows = new ArrayList<>();
            rowsByNode.set(node.getIndex(), rows);
        }
        rows.add(constraint);
    }

    public Enums.ConstraintFamily getFamily() {
        return family;
    }

    public boolean contains(Node node) {
        return rowsByNode.get(node.getIndex()) != null;
    }

    public List<Constraint> get(Node node) {
        List<Constraint> rows = rowsByNode.get(node.getIndex());
        return rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    /**
     * @return number of nodes that carry at least one row of this family.
     */
    public int getNodeCount() {
        int count = 0;
        for (List<Constraint> rows : rowsByNode)
            if (rows != null)
                ++count;
        return count;
    }

    public List<Constraint> getAll() {
        List<Constraint> all = new ArrayList<>();
        for (List<Constraint> rows : rowsByNode)
            if (rows != null)
                all.addAll(rows);
        return all;
    }
}
