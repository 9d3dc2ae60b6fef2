package plantopt.tree;

import plantopt.utility.TreeStructureException;

import java.util.HashSet;
import java.util.List;

public class TreeValidator {
    /**
     * Checks the structural invariants of a scenario tree before variables are allocated on it.
     */

    private TreeValidator() {}

    /**
     * @param tree tree to check.
     * @throws TreeStructureException describing the first violated invariant.
     */
    public static void validate(ScenarioTree tree) throws TreeStructureException {
        final List<Node> nodes = tree.getNodes();
        final int n = nodes.size();
        if (n == 0)
            throw new TreeStructureException("scenario tree has no nodes");

        Node root = nodes.get(0);
        if (!root.isRoot() || root.getStage() != 0)
            throw new TreeStructureException("node at index 0 must be a stage 0 root, found " + root.toDetailString());

        HashSet<String> ids = new HashSet<>();
        final int width = tree.getVariables().size();
        for (int i = 0; i < n; ++i) {
            Node node = nodes.get(i);
            if (node.getIndex() != i)
                throw new TreeStructureException("node " + node.getId() + " stored at " + i
                    + " but claims index " + node.getIndex());
            if (!ids.add(node.getId()))
                throw new TreeStructureException("duplicate node identifier " + node.getId());
            if (node.getValues().length != width)
                throw new TreeStructureException("node " + node.getId() + " carries " + node.getValues().length
                    + " values, tree schema has " + width);

            if (i > 0) {
                final int p = node.getParentIndex();
                if (p < 0)
                    throw new TreeStructureException("second root found: " + node.getId());
                if (p >= n || p == i)
                    throw new TreeStructureException("node " + node.getId() + " has parent index " + p
                        + " outside the tree");
                Node parent = nodes.get(p);
                if (node.getStage() != parent.getStage() + 1)
                    throw new TreeStructureException("node " + node.getId() + " at stage " + node.getStage()
                        + " but parent " + parent.getId() + " at stage " + parent.getStage());
                if (!parent.getChildren().contains(i))
                    throw new TreeStructureException("parent " + parent.getId() + " does not list child "
                        + node.getId());
            }

            for (int c : node.getChildren()) {
                if (c <= 0 || c >= n || nodes.get(c).getParentIndex() != i)
                    throw new TreeStructureException("node " + node.getId() + " lists child " + c
                        + " that does not point back to it");
            }
        }

        if (tree.breadthFirstOrder().size() != n)
            throw new TreeStructureException("tree contains nodes unreachable from the root or listed twice");

        final int lastStage = tree.getStageCount() - 1;
        for (Node node : nodes) {
            if (node.isTerminal() && node.getStage() != lastStage)
                throw new TreeStructureException("terminal node " + node.getId() + " at stage " + node.getStage()
                    + ", expected only at stage " + lastStage);
        }
    }
}
