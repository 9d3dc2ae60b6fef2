package plantopt.tree;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;

import java.math.BigDecimal;
import java.math.RoundingMode;

class StepSampler {
    /**
     * generates clamped random walk steps from a single seeded standard normal stream.
     */
    private final NormalDistribution standardNormal;

    StepSampler(long seed) {
        standardNormal = new NormalDistribution(new Well19937c(seed), 0.0, 1.0,
            NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
    }

    /**
     * Draws one step. Exactly one standard normal realization is consumed per call, also when sd is zero,
     * so that the stream position only depends on the number of draws.
     *
     * @param sd standard deviation of the step.
     * @param cap maximum absolute step.
     * @param places decimal places to round to, null to keep the raw value.
     * @return step in [-cap, cap]. Rounding that would leave the interval rounds toward zero instead.
     */
    double sample(double sd, double cap, Integer places) {
        double step = sd * standardNormal.sample();
        step = Math.max(-cap, Math.min(cap, step));
        if (places != null) {
            final double clamped = step;
            step = round(clamped, places, RoundingMode.HALF_EVEN);
            if (Math.abs(step) > cap)
                step = round(clamped, places, RoundingMode.DOWN);
        }
        return step;
    }

    /**
     * Rounds the decimal representation of the value, so 0.15 to one place gives 0.2 under half-even.
     */
    private static double round(double value, int places, RoundingMode mode) {
        return new BigDecimal(Double.toString(value)).setScale(places, mode).doubleValue();
    }
}
