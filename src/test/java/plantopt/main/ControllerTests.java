package plantopt.main;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import plantopt.TestData;
import plantopt.output.OutputManager;
import plantopt.registry.DataRegistry;
import plantopt.registry.Parameters;
import plantopt.solver.SolveResult;
import plantopt.utility.Enums;
import plantopt.utility.OptException;

import java.io.File;
import java.nio.file.Path;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControllerTests {
    @TempDir
    Path outputFolder;

    @BeforeEach
    void setUp() {
        Main.setDefaultParameters();
        Parameters.setNumStages(3);
        Parameters.setBranchFactor(2);
        Parameters.setOutputPath(outputFolder.toString());
    }

    private Controller buildController() throws OptException {
        DataRegistry dataRegistry = new DataRegistry(TestData.plant(), TestData.randomWalkSpec());
        Controller controller = new Controller(dataRegistry, new OutputManager(outputFolder.toString()));
        controller.buildScenarioTree();
        controller.buildModel();
        return controller;
    }

    @Test
    @DisplayName("controller should build the tree and the model from the run parameters")
    void testBuild() throws OptException {
        Controller controller = buildController();
        assertEquals(7, controller.getDataRegistry().getScenarioTree().size());

        ModelStats stats = controller.getModelStats();
        assertEquals(3, stats.getNumNonRecourseNodes());
        assertEquals(6, stats.getNumRecourseNodes());
        assertEquals(126, stats.getNumRows());
        assertEquals(123, stats.getNumColumns());
        assertEquals(7, stats.asMap("model").get("modelNumNodes"));
    }

    @Test
    @DisplayName("a non-optimal solver status should be surfaced unchanged")
    void testInfeasibleStatus() throws OptException {
        Controller controller = buildController();
        controller.solve(model -> SolveResult.failed(Enums.SolveStatus.INFEASIBLE));
        assertEquals(Enums.SolveStatus.INFEASIBLE, controller.getSolveResult().getStatus());
    }

    @Test
    @DisplayName("an optimal solve should be checked and written with the model")
    void testOptimalSolveAndOutput() throws OptException {
        Controller controller = buildController();
        controller.solve(model -> new SolveResult(Enums.SolveStatus.OPTIMAL, 0.0, new double[model.getNcols()]));
        assertTrue(controller.getSolveResult().isOptimal());

        controller.writeOutput();
        File[] files = Objects.requireNonNull(outputFolder.toFile().listFiles());
        boolean foundLp = false;
        boolean foundKpis = false;
        for (File file : files) {
            foundLp |= file.getName().endsWith("refinery_recourse.lp");
            foundKpis |= file.getName().endsWith("kpis.yaml");
        }
        assertTrue(foundLp);
        assertTrue(foundKpis);
    }

    @Test
    @DisplayName("adapter failures should propagate")
    void testAdapterFailure() throws OptException {
        Controller controller = buildController();
        assertThrows(OptException.class, () -> controller.solve(model -> {
            throw new OptException("solver not available");
        }));
        assertNull(controller.getSolveResult());
    }

    @Test
    @DisplayName("reported input parameters should include the output switches")
    void testParameterMap() {
        Parameters.setExportLp(false);
        assertEquals(false, Parameters.asMap().get("exportLp"));
        assertEquals(true, Parameters.asMap().get("checkSolutionQuality"));
        assertEquals(3, Parameters.asMap().get("numStages"));
    }

    @Test
    @DisplayName("command line values should override the defaults")
    void testUpdateParameters() throws ParseException, OptException {
        Options options = new Options();
        options.addOption("stages", true, "");
        options.addOption("cvar", true, "");
        options.addOption("cvarWeight", true, "");

        CommandLine cmd = new DefaultParser().parse(options,
            new String[]{"-stages", "5", "-cvar", "y", "-cvarWeight", "0.25"});
        Main.updateParameters(cmd);
        assertEquals(5, Parameters.getNumStages());
        assertTrue(Parameters.isCvar());
        assertEquals(0.25, Parameters.getCvarWeight());
        assertNotNull(Parameters.getInstancePath());

        CommandLine bad = new DefaultParser().parse(options, new String[]{"-cvar", "maybe"});
        assertThrows(OptException.class, () -> Main.updateParameters(bad));
        CommandLine badNumber = new DefaultParser().parse(options, new String[]{"-stages", "many"});
        assertThrows(OptException.class, () -> Main.updateParameters(badNumber));
    }
}
