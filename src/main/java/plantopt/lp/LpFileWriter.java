package plantopt.lp;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.utility.Enums;
import plantopt.utility.OptException;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class LpFileWriter {
    /**
     * Writes an LpModel in CPLEX LP text format so that any LP/MIP solver can read it.
     */
    private final static Logger logger = LogManager.getLogger(LpFileWriter.class);
    private final static int TERMS_PER_LINE = 6;

    private final LpModel model;

    public LpFileWriter(LpModel model) {
        this.model = model;
    }

    public void write(String filePath) throws OptException {
        try {
            BufferedWriter writer = new BufferedWriter(new FileWriter(filePath));
            write(writer);
            writer.close();
            logger.info("wrote LP file " + filePath);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("error writing LP file " + filePath);
        }
    }

    public void write(Writer writer) throws IOException {
        writer.write("\\ Problem name: " + model.getName() + "\n\n");
        writer.write(model.isMaximize() ? "Maximize\n" : "Minimize\n");
        writer.write(" obj:");
        writeTerms(writer, model.getObjective());
        if (model.getObjective().getConstant() != 0.0)
            writer.write(" " + signed(model.getObjective().getConstant()));
        writer.write("\n");

        writer.write("Subject To\n");
        int row = 0;
        for (Constraint constraint : model.getConstraints()) {
            String rowName = constraint.getName() != null ? constraint.getName() : "r" + row;
            writer.write(" " + sanitize(rowName) + ":");
            writeTerms(writer, constraint.getExpr());
            writer.write(" " + op(constraint.getSense()) + " " + format(constraint.getRhs()) + "\n");
            ++row;
        }

        writer.write("Bounds\n");
        List<Variable> binaries = new ArrayList<>();
        for (Variable var : model.getVariables()) {
            if (var.getType() == Enums.VarType.BINARY) {
                binaries.add(var);
                continue;
            }
            final String varName = sanitize(var.getName());
            final boolean freeBelow = var.getLb() == Double.NEGATIVE_INFINITY;
            final boolean freeAbove = var.getUb() == Double.POSITIVE_INFINITY;
            if (freeBelow && freeAbove)
                writer.write(" " + varName + " free\n");
            else if (freeBelow)
                writer.write(" -inf <= " + varName + " <= " + format(var.getUb()) + "\n");
            else if (!freeAbove)
                writer.write(" " + format(var.getLb()) + " <= " + varName + " <= " + format(var.getUb()) + "\n");
            else if (var.getLb() != 0.0)
                writer.write(" " + varName + " >= " + format(var.getLb()) + "\n");
        }

        if (!binaries.isEmpty()) {
            writer.write("Binaries\n");
            for (Variable var : binaries)
                writer.write(" " + sanitize(var.getName()) + "\n");
        }
        writer.write("End\n");
    }

    private void writeTerms(Writer writer, LinearExpr expr) throws IOException {
        if (expr.size() == 0) {
            writer.write(" 0 " + sanitize(model.getVariables().isEmpty() ? "x0" : model.getVariables().get(0).getName()));
            return;
        }
        int count = 0;
        for (Map.Entry<Variable, Double> term : expr.getTerms().entrySet()) {
            if (count > 0 && count % TERMS_PER_LINE == 0)
                writer.write("\n   ");
            writer.write(" " + signed(term.getValue()) + " " + sanitize(term.getKey().getName()));
            ++count;
        }
    }

    private static String op(Enums.Sense sense) {
        switch (sense) {
            case LE:
                return "<=";
            case GE:
                return ">=";
            default:
                return "=";
        }
    }

    private static String signed(double value) {
        return value < 0 ? "- " + format(-value) : "+ " + format(value);
    }

    private static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15)
            return Long.toString((long) value);
        return Double.toString(value);
    }

    /**
     * LP format names may not contain blanks, brackets or operators.
     */
    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_.]", "_");
    }
}
