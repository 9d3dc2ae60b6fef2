package plantopt.lp;

import plantopt.utility.Enums;

public class Variable {
    /**
     * A model column. Variables are created through LpModel, which assigns the index used to look up
     * solution values.
     */
    private final int index;
    private final String name;
    private final Enums.VarType type;
    private final double lb;
    private final double ub;

    Variable(int index, String name, Enums.VarType type, double lb, double ub) {
        this.index = index;
        this.name = name;
        this.type = type;
        this.lb = lb;
        this.ub = ub;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public Enums.VarType getType() {
        return type;
    }

    public double getLb() {
        return lb;
    }

    public double getUb() {
        return ub;
    }

    @Override
    public String toString() {
        return name;
    }
}
