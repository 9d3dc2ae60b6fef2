package plantopt.main;

import org.apache.commons.cli.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.registry.Parameters;
import plantopt.utility.OptException;

/**
 * Class that owns main().
 */
public class Main {
    private final static Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            CommandLine cmd = addOptions(args);
            if (cmd == null)
                return;

            setDefaultParameters();
            updateParameters(cmd);
            singleRun();
        } catch (OptException ex) {
            logger.error(ex);
            ex.printStackTrace();
        }
    }

    private static CommandLine addOptions(String[] args) throws OptException {
        Options options = new Options();
        options.addOption("branches", true, "branch factor of the scenario tree");
        options.addOption("chance", true, "enable chance constraint (y/n)");
        options.addOption("chanceCutoff", true, "scenario value the chance constraint requires");
        options.addOption("chanceFraction", true, "fraction of scenarios that must reach the cutoff");
        options.addOption("cvar", true, "enable CVaR term (y/n)");
        options.addOption("cvarBeta", true, "CVaR tail fraction");
        options.addOption("cvarWeight", true, "CVaR weight in the objective");
        options.addOption("exportLp", true, "write the model as an LP file (y/n)");
        options.addOption("inputPath", true, "path to the YAML instance file");
        options.addOption("outputPath", true, "path to output folder");
        options.addOption("seed", true, "seed of the scenario tree random walk");
        options.addOption("stages", true, "number of stages including the root");
        options.addOption("h", false, "help (show options and exit)");

        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption('h')) {
                HelpFormatter helpFormatter = new HelpFormatter();
                helpFormatter.printHelp("plantopt.jar", options);
                return null;
            }
            return cmd;
        } catch (ParseException ex) {
            logger.error(ex);
            throw new OptException("error parsing CLI args");
        }
    }

    private static void singleRun() throws OptException {
        logger.info("Started model generation...");
        Controller controller = new Controller();
        controller.buildScenarioTree();
        controller.buildModel();
        controller.writeOutput();
        logger.info("completed model generation.");
    }

    static void setDefaultParameters() {
        Parameters.setInstancePath("data/refinery.yaml");
        Parameters.setOutputPath("solution");

        Parameters.setNumStages(4);
        Parameters.setBranchFactor(2);
        Parameters.setSeed(42);

        Parameters.setCvar(false);
        Parameters.setCvarBeta(0.1);
        Parameters.setCvarWeight(0.5);

        Parameters.setChanceConstraint(false);
        Parameters.setChanceCutoff(0);
        Parameters.setChanceFraction(0.9);

        Parameters.setExportLp(true);
        Parameters.setCheckSolutionQuality(true);
    }

    static void updateParameters(CommandLine cmd) throws OptException {
        Parameters.setInstancePath(cmd.getOptionValue("inputPath", Parameters.getInstancePath()));
        Parameters.setOutputPath(cmd.getOptionValue("outputPath", Parameters.getOutputPath()));
        try {
            if (cmd.hasOption("stages"))
                Parameters.setNumStages(Integer.parseInt(cmd.getOptionValue("stages")));
            if (cmd.hasOption("branches"))
                Parameters.setBranchFactor(Integer.parseInt(cmd.getOptionValue("branches")));
            if (cmd.hasOption("seed"))
                Parameters.setSeed(Long.parseLong(cmd.getOptionValue("seed")));
            if (cmd.hasOption("cvar")) {
                final boolean useCvar = parseFlag(cmd, "cvar");
                Parameters.setCvar(useCvar);
                logger.info("use CVaR term: " + useCvar);
            }
            if (cmd.hasOption("cvarBeta"))
                Parameters.setCvarBeta(Double.parseDouble(cmd.getOptionValue("cvarBeta")));
            if (cmd.hasOption("cvarWeight"))
                Parameters.setCvarWeight(Double.parseDouble(cmd.getOptionValue("cvarWeight")));
            if (cmd.hasOption("chance")) {
                final boolean useChance = parseFlag(cmd, "chance");
                Parameters.setChanceConstraint(useChance);
                logger.info("use chance constraint: " + useChance);
            }
            if (cmd.hasOption("chanceCutoff"))
                Parameters.setChanceCutoff(Double.parseDouble(cmd.getOptionValue("chanceCutoff")));
            if (cmd.hasOption("chanceFraction"))
                Parameters.setChanceFraction(Double.parseDouble(cmd.getOptionValue("chanceFraction")));
            if (cmd.hasOption("exportLp"))
                Parameters.setExportLp(parseFlag(cmd, "exportLp"));
        } catch (NumberFormatException ex) {
            logger.error(ex);
            throw new OptException("invalid numeric CLI argument: " + ex.getMessage());
        }
    }

    private static boolean parseFlag(CommandLine cmd, String option) throws OptException {
        final String value = cmd.getOptionValue(option);
        if (value.equals("y"))
            return true;
        if (value.equals("n"))
            return false;
        throw new OptException("option " + option + " expects y/n, got " + value);
    }
}
