package plantopt.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import plantopt.lp.Constraint;
import plantopt.lp.LinearExpr;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.utility.Enums;
import plantopt.utility.OptException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SolutionCheckerTests {

    private static LpModel buildModel() {
        LpModel model = new LpModel("check");
        Variable x = model.numVar(0, 5, "x");
        Variable z = model.boolVar("z");
        model.addLe(new LinearExpr(x, 1), 3, "x_cap");
        model.addGe(new LinearExpr(x, 1).addTerm(z, -2), 0, "x_link");
        model.addMaximize(new LinearExpr(x, 2).addTerm(z, 1));
        return model;
    }

    @Test
    @DisplayName("violated rows should be reported by name")
    void testViolatedRows() throws OptException {
        SolutionChecker checker = new SolutionChecker(buildModel());
        assertTrue(checker.isFeasible(new double[]{3, 1}));
        assertEquals(7.0, checker.getObjectiveValue(new double[]{3, 1}));

        List<Constraint> violated = checker.getViolatedConstraints(new double[]{1, 1});
        assertEquals(1, violated.size());
        assertEquals("x_link", violated.get(0).getName());
        assertFalse(checker.isFeasible(new double[]{4, 0}));
    }

    @Test
    @DisplayName("bounds and binary integrality should be checked")
    void testViolatedBounds() throws OptException {
        SolutionChecker checker = new SolutionChecker(buildModel());
        List<Variable> violated = checker.getViolatedBounds(new double[]{6, 0.5});
        assertEquals(2, violated.size());
        assertEquals("x", violated.get(0).getName());
        assertEquals(Enums.VarType.BINARY, violated.get(1).getType());
        assertTrue(checker.getViolatedBounds(new double[]{-1e-7, 1}).isEmpty());
    }

    @Test
    @DisplayName("value vectors of the wrong length should be rejected")
    void testLengthMismatch() {
        SolutionChecker checker = new SolutionChecker(buildModel());
        assertThrows(OptException.class, () -> checker.getViolatedConstraints(new double[1]));
        assertThrows(OptException.class, () -> checker.getObjectiveValue(new double[3]));
    }

    @Test
    @DisplayName("changing returned values should not change the result")
    void testValuesCopied() {
        LpModel model = buildModel();
        SolveResult result = new SolveResult(Enums.SolveStatus.OPTIMAL, 7.0, new double[]{3, 1});
        double[] values = result.getValues();
        values[0] = 100;
        assertEquals(3.0, result.getValue(model.getVariables().get(0)));
        assertEquals(3.0, result.getValues()[0]);
    }

    @Test
    @DisplayName("failed results should carry their status and no values")
    void testFailedResult() {
        LpModel model = buildModel();
        SolveResult result = SolveResult.failed(Enums.SolveStatus.UNBOUNDED);
        assertFalse(result.isOptimal());
        assertEquals(Enums.SolveStatus.UNBOUNDED, result.getStatus());
        assertThrows(IllegalStateException.class, () -> result.getValue(model.getVariables().get(0)));
    }
}
