package plantopt.registry;

import java.util.HashMap;

public class Parameters {
    private static String instancePath;
    private static String outputPath;

    // scenario tree
    private static int numStages;
    private static int branchFactor;
    private static long seed;

    // CVaR term: objective = expectation - cvarWeight * CVaR_cvarBeta(losses)
    private static boolean cvar;
    private static double cvarBeta;
    private static double cvarWeight;

    // chance constraint: at least chanceFraction of scenarios reach chanceCutoff
    private static boolean chanceConstraint;
    private static double chanceCutoff;
    private static double chanceFraction;

    private static boolean exportLp; // writes the assembled model as an LP file.
    private static boolean checkSolutionQuality; // checks solver values against every row and bound.

    public static String getInstancePath() {
        return instancePath;
    }

    public static void setInstancePath(String instancePath) {
        Parameters.instancePath = instancePath;
    }

    public static String getOutputPath() {
        return outputPath;
    }

    public static void setOutputPath(String outputPath) {
        Parameters.outputPath = outputPath;
    }

    public static int getNumStages() {
        return numStages;
    }

    public static void setNumStages(int numStages) {
        Parameters.numStages = numStages;
    }

    public static int getBranchFactor() {
        return branchFactor;
    }

    public static void setBranchFactor(int branchFactor) {
        Parameters.branchFactor = branchFactor;
    }

    public static long getSeed() {
        return seed;
    }

    public static void setSeed(long seed) {
        Parameters.seed = seed;
    }

    public static boolean isCvar() {
        return cvar;
    }

    public static void setCvar(boolean cvar) {
        Parameters.cvar = cvar;
    }

    public static double getCvarBeta() {
        return cvarBeta;
    }

    public static void setCvarBeta(double cvarBeta) {
        Parameters.cvarBeta = cvarBeta;
    }

    public static double getCvarWeight() {
        return cvarWeight;
    }

    public static void setCvarWeight(double cvarWeight) {
        Parameters.cvarWeight = cvarWeight;
    }

    public static boolean isChanceConstraint() {
        return chanceConstraint;
    }

    public static void setChanceConstraint(boolean chanceConstraint) {
        Parameters.chanceConstraint = chanceConstraint;
    }

    public static double getChanceCutoff() {
        return chanceCutoff;
    }

    public static void setChanceCutoff(double chanceCutoff) {
        Parameters.chanceCutoff = chanceCutoff;
    }

    public static double getChanceFraction() {
        return chanceFraction;
    }

    public static void setChanceFraction(double chanceFraction) {
        Parameters.chanceFraction = chanceFraction;
    }

    public static boolean isExportLp() {
        return exportLp;
    }

    public static void setExportLp(boolean exportLp) {
        Parameters.exportLp = exportLp;
    }

    public static boolean isCheckSolutionQuality() {
        return checkSolutionQuality;
    }

    public static void setCheckSolutionQuality(boolean checkSolutionQuality) {
        Parameters.checkSolutionQuality = checkSolutionQuality;
    }

    public static HashMap<String, Object> asMap() {
        HashMap<String, Object> results = new HashMap<>();
        results.put("instancePath", instancePath);
        results.put("numStages", numStages);
        results.put("branchFactor", branchFactor);
        results.put("seed", seed);
        results.put("cvar", cvar);
        results.put("cvarBeta", cvarBeta);
        results.put("cvarWeight", cvarWeight);
        results.put("chanceConstraint", chanceConstraint);
        results.put("chanceCutoff", chanceCutoff);
        results.put("chanceFraction", chanceFraction);
        results.put("exportLp", exportLp);
        results.put("checkSolutionQuality", checkSolutionQuality);
        return results;
    }
}
