package plantopt;

import plantopt.domain.Plant;
import plantopt.domain.RandomWalkSpec;
import plantopt.tree.RandomWalkTreeGenerator;
import plantopt.tree.ScenarioTree;
import plantopt.utility.ConfigurationException;

import java.util.Arrays;
import java.util.List;

public class TestData {
    public static final List<String> VARIABLES = Arrays.asList(
        "crude_light_price",
        "crude_heavy_price",
        "prod_price_0",
        "prod_price_1",
        "prod_price_2",
        "demand_0",
        "demand_1",
        "demand_2");

    public static RandomWalkSpec randomWalkSpec() throws ConfigurationException {
        return new RandomWalkSpec(VARIABLES,
            new double[]{30, 20, 50, 40, 30, 400, 300, 200},
            new double[]{1, 1, 1, 1, 1, 30, 30, 30},
            new double[]{0, 0, 0, 0, 0, 60, 60, 60},
            0);
    }

    /**
     * Three products, distillation cap 500, identity-like refining and a non-binding output change bound.
     */
    public static Plant plant() throws ConfigurationException {
        return new Plant(3, 500,
            new double[][]{{2, 0}, {1, 1}, {0, 2}},
            new double[]{1000, 1000, 1000},
            new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}},
            1000);
    }

    public static ScenarioTree tree(int stages, int branchFactor) throws ConfigurationException {
        return new RandomWalkTreeGenerator(randomWalkSpec(), stages, branchFactor, 42).generate();
    }

    /**
     * Number of nodes in a full tree: 1 + b + b^2 + ... + b^(stages-1).
     */
    public static int fullTreeSize(int stageCount, int branchFactor) {
        int total = 0;
        int atStage = 1;
        for (int s = 0; s < stageCount; ++s) {
            total += atStage;
            atStage *= branchFactor;
        }
        return total;
    }

    /**
     * Values in VARIABLES order.
     */
    public static double[] nodeValues(double lightPrice, double heavyPrice, double[] prices, double[] demands) {
        return new double[]{lightPrice, heavyPrice, prices[0], prices[1], prices[2],
            demands[0], demands[1], demands[2]};
    }
}
