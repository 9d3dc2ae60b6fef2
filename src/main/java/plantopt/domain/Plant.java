package plantopt.domain;

import plantopt.utility.ConfigurationException;

public class Plant {
    /**
     * Plant holds the fixed technical data of the refinery. Every crude import goes to distillation,
     * which produces one intermediate per product; each output unit refines any mix of intermediates.
     */
    private final int products;
    private final double distillationCap;
    private final double[][] crudeRatios; // crudeRatios[intermediate] = {per unit light crude, per unit heavy crude}.
    private final double[] refineCaps; // refineCaps[output] = input capacity of the output's unit.
    private final double[][] productRatios; // productRatios[output][intermediate] = output yield per unit input.
    private final double allowedOutputChange;

    public Plant(int products, double distillationCap, double[][] crudeRatios, double[] refineCaps,
                 double[][] productRatios, double allowedOutputChange) throws ConfigurationException {
        if (products < 1)
            throw new ConfigurationException("plant needs at least one product, got " + products);
        if (distillationCap < 0)
            throw new ConfigurationException("distillation capacity must be non-negative");
        if (allowedOutputChange < 0)
            throw new ConfigurationException("allowed output change must be non-negative");

        checkShape("crude ratios", crudeRatios, products, 2);
        if (refineCaps == null || refineCaps.length != products)
            throw new ConfigurationException("refine caps must have " + products + " entries, got "
                + (refineCaps == null ? 0 : refineCaps.length));
        checkShape("product ratios", productRatios, products, products);

        this.products = products;
        this.distillationCap = distillationCap;
        this.crudeRatios = copy(crudeRatios);
        this.refineCaps = refineCaps.clone();
        this.productRatios = copy(productRatios);
        this.allowedOutputChange = allowedOutputChange;
    }

    private static void checkShape(String what, double[][] matrix, int rows, int cols) throws ConfigurationException {
        if (matrix == null || matrix.length != rows)
            throw new ConfigurationException(what + " must have " + rows + " rows, got "
                + (matrix == null ? 0 : matrix.length));
        for (int i = 0; i < rows; ++i) {
            if (matrix[i] == null || matrix[i].length != cols)
                throw new ConfigurationException(what + " row " + i + " must have " + cols + " columns, got "
                    + (matrix[i] == null ? 0 : matrix[i].length));
        }
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; ++i)
            result[i] = matrix[i].clone();
        return result;
    }

    public int getProducts() {
        return products;
    }

    public double getDistillationCap() {
        return distillationCap;
    }

    public double getLightCrudeRatio(int intermediate) {
        return crudeRatios[intermediate][0];
    }

    public double getHeavyCrudeRatio(int intermediate) {
        return crudeRatios[intermediate][1];
    }

    public double getRefineCap(int output) {
        return refineCaps[output];
    }

    public double getProductRatio(int output, int intermediate) {
        return productRatios[output][intermediate];
    }

    public double getAllowedOutputChange() {
        return allowedOutputChange;
    }
}
