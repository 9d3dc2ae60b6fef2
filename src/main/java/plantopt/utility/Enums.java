package plantopt.utility;

public class Enums {

    /**
     * Sense of a linear constraint: expr <= rhs, expr >= rhs or expr == rhs.
     */
    public enum Sense {LE, GE, EQ}

    /**
     * VarType specifies the domain of a model variable. BINARY variables only appear in the chance
     * constraint formulation.
     */
    public enum VarType {CONTINUOUS, BINARY}

    /**
     * SolveStatus is the discrete outcome reported by a solver adapter. It is passed on verbatim.
     */
    public enum SolveStatus {OPTIMAL, INFEASIBLE, UNBOUNDED, ERROR}

    /**
     * RecourseClass specifies how a decision variable is shared over the scenario tree.
     * <p>
     * NON_RECOURSE: one variable per internal node, inherited by the whole subtree below it.
     * RECOURSE: one variable per non-root node, chosen after observing the transition into the node.
     */
    public enum RecourseClass {NON_RECOURSE, RECOURSE}

    /**
     * Constraint families emitted by the recourse model builder.
     */
    public enum ConstraintFamily {
        distil,
        distilCap,
        productOut,
        refineCap,
        intermediatesRule,
        breakdown,
        demand,
        interstageUpper,
        interstageLower
    }
}
