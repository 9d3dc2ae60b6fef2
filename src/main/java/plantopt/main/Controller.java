package plantopt.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.dao.PlantDAO;
import plantopt.domain.RiskSettings;
import plantopt.lp.Constraint;
import plantopt.lp.LpModel;
import plantopt.lp.Variable;
import plantopt.model.RecourseModelBuilder;
import plantopt.output.OutputManager;
import plantopt.registry.DataRegistry;
import plantopt.registry.Parameters;
import plantopt.solver.SolutionChecker;
import plantopt.solver.SolveResult;
import plantopt.solver.SolverAdapter;
import plantopt.tree.Node;
import plantopt.tree.RandomWalkTreeGenerator;
import plantopt.tree.ScenarioTree;
import plantopt.utility.OptException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

class Controller {
    /**
     * Class that controls the entire process from reading data to handing the model to a solver.
     */
    private final static Logger logger = LogManager.getLogger(Controller.class);
    private final DataRegistry dataRegistry;
    private final OutputManager outputManager;

    private ModelStats modelStats;
    private SolveResult solveResult;

    Controller() throws OptException {
        logger.info("Started reading data...");
        logger.debug("instance path: " + Parameters.getInstancePath());
        PlantDAO plantDAO = new PlantDAO(Parameters.getInstancePath());
        dataRegistry = new DataRegistry(plantDAO.getPlant(), plantDAO.getRandomWalkSpec());
        outputManager = new OutputManager(Parameters.getOutputPath());
        logger.info("completed reading data.");
    }

    Controller(DataRegistry dataRegistry, OutputManager outputManager) {
        this.dataRegistry = dataRegistry;
        this.outputManager = outputManager;
    }

    DataRegistry getDataRegistry() {
        return dataRegistry;
    }

    ModelStats getModelStats() {
        return modelStats;
    }

    SolveResult getSolveResult() {
        return solveResult;
    }

    final void buildScenarioTree() throws OptException {
        RandomWalkTreeGenerator generator = new RandomWalkTreeGenerator(dataRegistry.getRandomWalkSpec(),
            Parameters.getNumStages(), Parameters.getBranchFactor(), Parameters.getSeed());
        ScenarioTree tree = generator.generate();
        dataRegistry.setScenarioTree(tree);
        if (logger.isDebugEnabled()) {
            for (Node node : tree.getNodes())
                logger.debug(node.toDetailString());
        }
    }

    final void buildModel() throws OptException {
        RiskSettings riskSettings = new RiskSettings(
            Parameters.isCvar(), Parameters.getCvarBeta(), Parameters.getCvarWeight(),
            Parameters.isChanceConstraint(), Parameters.getChanceCutoff(), Parameters.getChanceFraction());

        Instant start = Instant.now();
        RecourseModelBuilder builder = new RecourseModelBuilder(dataRegistry.getPlant(),
            dataRegistry.getScenarioTree(), riskSettings);
        builder.build();
        final double buildTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        logger.info("model build time (seconds): " + buildTime);

        dataRegistry.setModelBuilder(builder);
        modelStats = new ModelStats(builder);
        outputManager.addKpis(modelStats.asMap("model"));
        outputManager.addKpi("modelBuildTimeInSec", buildTime);
    }

    /**
     * Hands the assembled model to a solver. The reported status is stored as is; a non-optimal status is
     * the caller's concern.
     */
    final void solve(SolverAdapter solver) throws OptException {
        RecourseModelBuilder builder = dataRegistry.getModelBuilder();
        LpModel model = builder.getModel();

        logger.info("starting solver...");
        Instant start = Instant.now();
        solveResult = solver.solve(model);
        final double solveTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        logger.info("solver status: " + solveResult.getStatus() + ", solution time (seconds): " + solveTime);
        outputManager.addKpi("solveStatus", solveResult.getStatus().name());
        outputManager.addKpi("solveTimeInSec", solveTime);

        if (!solveResult.isOptimal())
            return;

        logger.info("objective: " + solveResult.getObjective());
        outputManager.addKpi("objective", solveResult.getObjective());

        Node root = dataRegistry.getScenarioTree().getRoot();
        if (builder.getLightCrudeImport().contains(root)) {
            final double light = solveResult.getValue(builder.getLightCrudeImport().get(root).scalar());
            final double heavy = solveResult.getValue(builder.getHeavyCrudeImport().get(root).scalar());
            logger.info("light import: " + light + ", heavy import: " + heavy);
            outputManager.addKpi("rootLightCrudeImport", light);
            outputManager.addKpi("rootHeavyCrudeImport", heavy);
        }

        if (Parameters.isCheckSolutionQuality())
            checkSolutionQuality(model);
    }

    private void checkSolutionQuality(LpModel model) throws OptException {
        SolutionChecker checker = new SolutionChecker(model);
        List<Constraint> rows = checker.getViolatedConstraints(solveResult.getValues());
        List<Variable> columns = checker.getViolatedBounds(solveResult.getValues());
        for (Constraint row : rows)
            logger.warn("solver solution violates " + row.getName());
        for (Variable column : columns)
            logger.warn("solver solution violates bounds of " + column.getName());
        outputManager.addKpi("numViolatedRows", rows.size());
        outputManager.addKpi("numViolatedBounds", columns.size());
    }

    final void writeOutput() throws OptException {
        if (Parameters.isExportLp())
            outputManager.writeLp(dataRegistry.getModelBuilder().getModel());
        outputManager.writeKpis();
    }
}
