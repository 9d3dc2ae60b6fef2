package plantopt.tree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.domain.RandomWalkSpec;
import plantopt.utility.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

public class RandomWalkTreeGenerator {
    /**
     * RandomWalkTreeGenerator builds a balanced scenario tree in which every variable follows a clamped
     * normal random walk from its start value.
     * <p>
     * Draws are consumed stage by stage in a fixed order: nodes of the current stage in creation order,
     * then branches, then variables in declaration order. A fixed seed therefore reproduces the same tree.
     */
    private final static Logger logger = LogManager.getLogger(RandomWalkTreeGenerator.class);
    private final RandomWalkSpec spec;
    private final int stageCount;
    private final int branchFactor;
    private final StepSampler sampler;

    public RandomWalkTreeGenerator(RandomWalkSpec spec, int stageCount, int branchFactor, long seed)
        throws ConfigurationException {
        if (stageCount < 1)
            throw new ConfigurationException("stage count must be at least 1, got " + stageCount);
        if (branchFactor < 1)
            throw new ConfigurationException("branch factor must be at least 1, got " + branchFactor);

        this.spec = spec;
        this.stageCount = stageCount;
        this.branchFactor = branchFactor;
        this.sampler = new StepSampler(seed);
    }

    public ScenarioTree generate() throws ConfigurationException {
        ScenarioTree.Builder builder = new ScenarioTree.Builder(spec.getVariables());
        List<Integer> currentNodes = new ArrayList<>();
        currentNodes.add(builder.addRoot(spec.getStartValues()));

        for (int stage = 1; stage < stageCount; ++stage) {
            List<Integer> nextNodes = new ArrayList<>();
            for (int parent : currentNodes) {
                final double[] parentValues = builder.getValues(parent);
                for (int branch = 0; branch < branchFactor; ++branch) {
                    double[] childValues = new double[spec.size()];
                    for (int v = 0; v < spec.size(); ++v) {
                        final double step = sampler.sample(spec.getStepSd(v), spec.getStepCap(v),
                            spec.getTruncatePlaces());
                        childValues[v] = parentValues[v] + step;
                    }
                    nextNodes.add(builder.addChild(parent, childValues));
                }
            }
            logger.debug("generated " + nextNodes.size() + " nodes for stage " + stage);
            currentNodes = nextNodes;
        }

        ScenarioTree tree = builder.build();
        logger.info("generated scenario tree with " + tree.size() + " nodes over " + stageCount
            + " stages (branch factor " + branchFactor + ")");
        return tree;
    }
}
