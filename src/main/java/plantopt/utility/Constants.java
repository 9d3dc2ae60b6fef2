package plantopt.utility;

public class Constants {
    public final static double EPS = 1e-5;
    public final static String ROOT_ID = "root";

    // names of the realized values a refinery tree must carry
    public final static String CRUDE_LIGHT_PRICE = "crude_light_price";
    public final static String CRUDE_HEAVY_PRICE = "crude_heavy_price";
    public final static String PRODUCT_PRICE_PREFIX = "prod_price_";
    public final static String DEMAND_PREFIX = "demand_";
}
