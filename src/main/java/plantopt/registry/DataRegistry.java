package plantopt.registry;

import plantopt.domain.Plant;
import plantopt.domain.RandomWalkSpec;
import plantopt.model.RecourseModelBuilder;
import plantopt.tree.ScenarioTree;

public class DataRegistry {
    /**
     * Holds the input data of a run and the objects built from it.
     */
    private final Plant plant;
    private final RandomWalkSpec randomWalkSpec;

    private ScenarioTree scenarioTree;
    private RecourseModelBuilder modelBuilder;

    public DataRegistry(Plant plant, RandomWalkSpec randomWalkSpec) {
        this.plant = plant;
        this.randomWalkSpec = randomWalkSpec;
    }

    public Plant getPlant() {
        return plant;
    }

    public RandomWalkSpec getRandomWalkSpec() {
        return randomWalkSpec;
    }

    public ScenarioTree getScenarioTree() {
        return scenarioTree;
    }

    public void setScenarioTree(ScenarioTree scenarioTree) {
        this.scenarioTree = scenarioTree;
    }

    public RecourseModelBuilder getModelBuilder() {
        return modelBuilder;
    }

    public void setModelBuilder(RecourseModelBuilder modelBuilder) {
        this.modelBuilder = modelBuilder;
    }
}
