package plantopt.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import plantopt.TestData;
import plantopt.lp.Constraint;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.tree.Node;
import plantopt.tree.ScenarioTree;
import plantopt.utility.ConfigurationException;
import plantopt.utility.Enums;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableAllocatorTests {

    @Test
    @DisplayName("non-recourse variables should live exactly at internal nodes")
    void testNonRecourseSubset() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(4, 2);
        VariableAllocator allocator = new VariableAllocator(tree, new LpModel("test"));
        NodeVariableMap map = allocator.buildNonRecourse("x");

        assertEquals(Enums.RecourseClass.NON_RECOURSE, map.getRecourseClass());
        assertEquals(7, map.size());
        for (Node node : tree.getNodes())
            assertEquals(!node.isTerminal(), map.contains(node));
        for (Node leaf : tree.getLeaves())
            assertThrows(IllegalStateException.class, () -> map.get(leaf));
    }

    @Test
    @DisplayName("recourse variables should live at every node except the root")
    void testRecourseSubset() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(3, 3);
        VariableAllocator allocator = new VariableAllocator(tree, new LpModel("test"));
        NodeVariableMap map = allocator.buildRecourse("y", 2);

        assertEquals(Enums.RecourseClass.RECOURSE, map.getRecourseClass());
        assertEquals(tree.size() - 1, map.size());
        assertFalse(map.contains(tree.getRoot()));
        for (Node node : tree.getNodes())
            if (!node.isRoot())
                assertTrue(map.contains(node));
    }

    @Test
    @DisplayName("a lone root should get no non-recourse and no recourse variables")
    void testSingleNodeTree() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(1, 2);
        LpModel model = new LpModel("test");
        VariableAllocator allocator = new VariableAllocator(tree, model);
        assertEquals(0, allocator.buildNonRecourse("x").size());
        assertEquals(0, allocator.buildRecourse("y").size());
        assertEquals(0, model.getNcols());
    }

    @Test
    @DisplayName("blocks should follow the requested shape and be named after their node")
    void testBlockShapes() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(2, 2);
        LpModel model = new LpModel("test");
        VariableAllocator allocator = new VariableAllocator(tree, model);

        VariableBlock scalar = allocator.buildNonRecourse("s").get(tree.getRoot());
        assertTrue(scalar.isScalar());
        assertEquals("root_s", scalar.scalar().getName());

        Node child = tree.getNode(tree.getRoot().getChild(1));
        VariableBlock vector = allocator.buildRecourse("v", 3).get(child);
        assertFalse(vector.isScalar());
        assertFalse(vector.isMatrix());
        assertEquals(3, vector.size());
        assertEquals("root_1_v_2", vector.get(2).getName());
        assertThrows(IndexOutOfBoundsException.class, () -> vector.get(3));
        assertThrows(IllegalStateException.class, vector::scalar);

        VariableBlock matrix = allocator.buildRecourse("m", 2, 3).get(child);
        assertTrue(matrix.isMatrix());
        assertEquals(6, matrix.size());
        assertEquals("root_1_m_1_2", matrix.get(1, 2).getName());
        assertThrows(IllegalStateException.class, () -> matrix.get(0));
    }

    @Test
    @DisplayName("every allocated variable should be non-negative with a matching domain constraint")
    void testDomainConstraints() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(3, 2);
        LpModel model = new LpModel("test");
        VariableAllocator allocator = new VariableAllocator(tree, model);
        allocator.buildNonRecourse("x", 2);
        allocator.buildRecourse("y", 2, 2);

        assertEquals(3 * 2 + 6 * 4, model.getNcols());
        assertEquals(model.getNcols(), allocator.getDomainConstraints().size());
        for (Variable var : model.getVariables())
            assertEquals(0.0, var.getLb());

        Constraint first = allocator.getDomainConstraints().get(0);
        assertEquals(Enums.Sense.GE, first.getSense());
        assertEquals(0.0, first.getRhs());
        assertEquals(1.0, first.getExpr().getCoefficient(model.getVariables().get(0)));
        // domain rows are kept apart from the model rows
        assertEquals(0, model.getNrows());
    }
}
