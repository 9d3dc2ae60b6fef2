package plantopt.domain;

import plantopt.utility.ConfigurationException;

public class RiskSettings {
    /**
     * Optional risk terms of the recourse model.
     * <p>
     * CVaR: the objective becomes expectation - cvarWeight * CVaR of the scenario losses, where CVaR is
     * the mean loss of the worst cvarBeta fraction of scenarios.
     * Chance constraint: at least chanceFraction of the scenarios must reach a total value of chanceCutoff.
     */
    private final boolean cvarEnabled;
    private final double cvarBeta;
    private final double cvarWeight;
    private final boolean chanceEnabled;
    private final double chanceCutoff;
    private final double chanceFraction;

    public RiskSettings(boolean cvarEnabled, double cvarBeta, double cvarWeight,
                        boolean chanceEnabled, double chanceCutoff, double chanceFraction)
        throws ConfigurationException {
        if (cvarEnabled) {
            if (!(cvarBeta > 0 && cvarBeta <= 1))
                throw new ConfigurationException("CVaR beta must be in (0, 1], got " + cvarBeta);
            if (cvarWeight < 0)
                throw new ConfigurationException("CVaR weight must be non-negative, got " + cvarWeight);
        }
        if (chanceEnabled && !(chanceFraction >= 0 && chanceFraction <= 1))
            throw new ConfigurationException("chance constraint fraction must be in [0, 1], got " + chanceFraction);

        this.cvarEnabled = cvarEnabled;
        this.cvarBeta = cvarBeta;
        this.cvarWeight = cvarWeight;
        this.chanceEnabled = chanceEnabled;
        this.chanceCutoff = chanceCutoff;
        this.chanceFraction = chanceFraction;
    }

    public static RiskSettings none() {
        try {
            return new RiskSettings(false, 1.0, 0.0, false, 0.0, 0.0);
        } catch (ConfigurationException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public boolean isCvarEnabled() {
        return cvarEnabled;
    }

    public double getCvarBeta() {
        return cvarBeta;
    }

    public double getCvarWeight() {
        return cvarWeight;
    }

    public boolean isChanceEnabled() {
        return chanceEnabled;
    }

    public double getChanceCutoff() {
        return chanceCutoff;
    }

    public double getChanceFraction() {
        return chanceFraction;
    }
}
