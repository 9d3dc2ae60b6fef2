package plantopt.main;

import plantopt.lp.LpModel;
import plantopt.model.RecourseModelBuilder;
import plantopt.tree.ScenarioTree;

import java.util.HashMap;

public class ModelStats {
    private final int numRows;
    private final int numColumns;
    private final int numNonZeroes;
    private final int numBinaries;
    private final int numNodes;
    private final int numLeaves;
    private final int numNonRecourseNodes;
    private final int numRecourseNodes;

    public ModelStats(RecourseModelBuilder builder) {
        LpModel model = builder.getModel();
        ScenarioTree tree = builder.getTree();
        numRows = model.getNrows();
        numColumns = model.getNcols();
        numNonZeroes = model.getNNZs();
        numBinaries = model.getNumBinaries();
        numNodes = tree.size();
        numLeaves = tree.getLeaves().size();
        numNonRecourseNodes = builder.getLightCrudeImport().size();
        numRecourseNodes = builder.getProductOutput().size();
    }

    public int getNumRows() {
        return numRows;
    }

    public int getNumColumns() {
        return numColumns;
    }

    public int getNumNonZeroes() {
        return numNonZeroes;
    }

    public int getNumNonRecourseNodes() {
        return numNonRecourseNodes;
    }

    public int getNumRecourseNodes() {
        return numRecourseNodes;
    }

    HashMap<String, Object> asMap(String prefix) {
        HashMap<String, Object> data = new HashMap<>();
        data.put(prefix + "NumRows", numRows);
        data.put(prefix + "NumColumns", numColumns);
        data.put(prefix + "NumNonZeroes", numNonZeroes);
        data.put(prefix + "NumBinaries", numBinaries);
        data.put(prefix + "NumNodes", numNodes);
        data.put(prefix + "NumLeaves", numLeaves);
        data.put(prefix + "NumNonRecourseNodes", numNonRecourseNodes);
        data.put(prefix + "NumRecourseNodes", numRecourseNodes);
        return data;
    }
}
