package plantopt.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import plantopt.TestData;
import plantopt.utility.ConfigurationException;
import plantopt.utility.TreeStructureException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeValidatorTests {
    private static final List<String> VARIABLES = Collections.singletonList("x");

    @Test
    @DisplayName("generated trees should be valid")
    void testGeneratedTree() throws ConfigurationException {
        ScenarioTree tree = TestData.tree(4, 3);
        assertDoesNotThrow(() -> TreeValidator.validate(tree));
    }

    @Test
    @DisplayName("hand-built irregular trees with leaves on the last stage should be valid")
    void testIrregularTree() throws ConfigurationException {
        ScenarioTree.Builder builder = new ScenarioTree.Builder(VARIABLES);
        int root = builder.addRoot(new double[]{1});
        int a = builder.addChild(root, new double[]{2});
        int b = builder.addChild(root, new double[]{3});
        builder.addChild(a, new double[]{4});
        builder.addChild(b, new double[]{5});
        builder.addChild(b, new double[]{6});
        ScenarioTree tree = builder.build();

        assertDoesNotThrow(() -> TreeValidator.validate(tree));
        assertEquals(3, tree.getLeaves().size());
        assertEquals("root_1_1", tree.getNode(5).getId());
    }

    @Test
    @DisplayName("a leaf before the last stage should be rejected")
    void testEarlyLeaf() throws ConfigurationException {
        ScenarioTree.Builder builder = new ScenarioTree.Builder(VARIABLES);
        int root = builder.addRoot(new double[]{1});
        int a = builder.addChild(root, new double[]{2});
        builder.addChild(root, new double[]{3});
        builder.addChild(a, new double[]{4});
        ScenarioTree tree = builder.build();

        TreeStructureException ex = assertThrows(TreeStructureException.class, () -> TreeValidator.validate(tree));
        assertTrue(ex.getMessage().contains("root_1"));
    }

    @Test
    @DisplayName("a child whose stage does not follow its parent should be rejected")
    void testStageGap() {
        Node root = new Node(0, "root", 0, -1, new double[]{1});
        Node child = new Node(1, "root_0", 2, 0, new double[]{2});
        root.addChild(1);
        ScenarioTree tree = new ScenarioTree(VARIABLES, Arrays.asList(root, child));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(tree));
    }

    @Test
    @DisplayName("a parent index outside the tree should be rejected")
    void testDanglingParent() {
        Node root = new Node(0, "root", 0, -1, new double[]{1});
        Node child = new Node(1, "orphan", 1, 5, new double[]{2});
        ScenarioTree tree = new ScenarioTree(VARIABLES, Arrays.asList(root, child));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(tree));
    }

    @Test
    @DisplayName("a child not listed by its parent should be rejected")
    void testUnlistedChild() {
        Node root = new Node(0, "root", 0, -1, new double[]{1});
        Node first = new Node(1, "root_0", 1, 0, new double[]{2});
        Node second = new Node(2, "root_1", 1, 0, new double[]{3});
        root.addChild(1);
        ScenarioTree tree = new ScenarioTree(VARIABLES, Arrays.asList(root, first, second));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(tree));
    }

    @Test
    @DisplayName("a second root should be rejected")
    void testSecondRoot() {
        Node root = new Node(0, "root", 0, -1, new double[]{1});
        Node other = new Node(1, "other", 0, -1, new double[]{2});
        ScenarioTree tree = new ScenarioTree(VARIABLES, Arrays.asList(root, other));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(tree));
    }

    @Test
    @DisplayName("duplicate identifiers and wrong value widths should be rejected")
    void testIdsAndValues() {
        Node root = new Node(0, "root", 0, -1, new double[]{1});
        Node child = new Node(1, "root", 1, 0, new double[]{2});
        root.addChild(1);
        ScenarioTree duplicate = new ScenarioTree(VARIABLES, Arrays.asList(root, child));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(duplicate));

        Node wideRoot = new Node(0, "root", 0, -1, new double[]{1, 2});
        ScenarioTree wide = new ScenarioTree(VARIABLES, Collections.singletonList(wideRoot));
        assertThrows(TreeStructureException.class, () -> TreeValidator.validate(wide));
    }

    @Test
    @DisplayName("a built tree should not change through its builder")
    void testBuilderSealedAfterBuild() throws ConfigurationException {
        ScenarioTree.Builder builder = new ScenarioTree.Builder(VARIABLES);
        int root = builder.addRoot(new double[]{1});
        int child = builder.addChild(root, new double[]{2});
        ScenarioTree tree = builder.build();

        assertThrows(ConfigurationException.class, () -> builder.addChild(child, new double[]{3}));
        assertThrows(ConfigurationException.class, () -> builder.addRoot(new double[]{1}));
        assertEquals(2, tree.size());
        assertEquals(1, tree.getLeaves().size());
        assertTrue(tree.getNode(child).isTerminal());
    }

    @Test
    @DisplayName("builder should reject bad parents, value widths and duplicate names")
    void testBuilderErrors() throws ConfigurationException {
        assertThrows(ConfigurationException.class, () -> new ScenarioTree.Builder(Arrays.asList("x", "x")));

        ScenarioTree.Builder builder = new ScenarioTree.Builder(VARIABLES);
        assertThrows(ConfigurationException.class, builder::build);
        builder.addRoot(new double[]{1});
        assertThrows(ConfigurationException.class, () -> builder.addRoot(new double[]{1}));
        assertThrows(ConfigurationException.class, () -> builder.addChild(3, new double[]{1}));
        assertThrows(ConfigurationException.class, () -> builder.addChild(0, new double[]{1, 2}));
    }
}
