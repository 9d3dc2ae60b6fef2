package plantopt.solver;

import plantopt.lp.LpModel;
import plantopt.utility.OptException;

/**
 * Hand-off to an external LP/MIP solver. Implementations solve synchronously and report the status
 * exactly as the solver gives it; any timeout policy belongs to the implementation.
 */
public interface SolverAdapter {
    /**
     * @param model fully assembled model.
     * @return status, objective and one value per model variable.
     * @throws OptException if the solver could not be run at all.
     */
    SolveResult solve(LpModel model) throws OptException;
}
