package plantopt.domain;

import plantopt.utility.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

public class RandomWalkSpec {
    /**
     * Parameters of the truncated random walk followed by every tree variable: start value at the root,
     * standard deviation of a step and the maximum absolute step.
     */
    private final List<String> variables;
    private final double[] startValues;
    private final double[] stepSds;
    private final double[] stepCaps;
    private final Integer truncatePlaces; // null keeps raw steps.

    public RandomWalkSpec(List<String> variables, double[] startValues, double[] stepSds, double[] stepCaps,
                          Integer truncatePlaces) throws ConfigurationException {
        if (variables == null || variables.isEmpty())
            throw new ConfigurationException("random walk needs at least one variable");
        final int n = variables.size();
        if (startValues.length != n || stepSds.length != n || stepCaps.length != n)
            throw new ConfigurationException("random walk arrays must all have length " + n + " (start="
                + startValues.length + ", sd=" + stepSds.length + ", cap=" + stepCaps.length + ")");
        if (new HashSet<>(variables).size() != n)
            throw new ConfigurationException("random walk variable names must be unique: " + variables);

        for (int i = 0; i < n; ++i) {
            if (variables.get(i) == null || variables.get(i).isEmpty())
                throw new ConfigurationException("random walk variable " + i + " has no name");
            if (stepSds[i] < 0 || stepCaps[i] < 0)
                throw new ConfigurationException("step sd and cap of " + variables.get(i) + " must be non-negative");
        }
        if (truncatePlaces != null && truncatePlaces < 0)
            throw new ConfigurationException("truncation precision must be non-negative");

        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.startValues = startValues.clone();
        this.stepSds = stepSds.clone();
        this.stepCaps = stepCaps.clone();
        this.truncatePlaces = truncatePlaces;
    }

    public List<String> getVariables() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    public double[] getStartValues() {
        return startValues.clone();
    }

    public double getStepSd(int i) {
        return stepSds[i];
    }

    public double getStepCap(int i) {
        return stepCaps[i];
    }

    public Integer getTruncatePlaces() {
        return truncatePlaces;
    }
}
