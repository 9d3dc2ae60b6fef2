package plantopt.dao;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import plantopt.domain.Plant;
import plantopt.domain.RandomWalkSpec;
import plantopt.utility.ConfigurationException;
import plantopt.utility.OptException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class PlantDAO {
    /**
     * Used to read plant data and random walk parameters from a YAML instance file with two sections,
     * "plant" and "randomWalk".
     */
    private final static Logger logger = LogManager.getLogger(PlantDAO.class);
    private Plant plant;
    private RandomWalkSpec randomWalkSpec;

    public PlantDAO(String filePath) throws OptException {
        try (InputStream in = new FileInputStream(filePath)) {
            load(in);
        } catch (IOException ex) {
            logger.error(ex);
            throw new OptException("unable to read instance file " + filePath);
        }
    }

    public PlantDAO(InputStream in) throws OptException {
        load(in);
    }

    @SuppressWarnings("unchecked")
    private void load(InputStream in) throws OptException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (YAMLException ex) {
            logger.error(ex);
            throw new ConfigurationException("possibly ill-formed YAML instance file");
        }
        if (!(loaded instanceof Map))
            throw new ConfigurationException("instance file must hold a mapping with plant and randomWalk sections");
        Map<String, Object> root = (Map<String, Object>) loaded;

        try {
            plant = buildPlant(section(root, "plant"));
            randomWalkSpec = buildRandomWalkSpec(section(root, "randomWalk"));
        } catch (ClassCastException | NullPointerException ex) {
            logger.error(ex);
            throw new ConfigurationException("unexpected value type in instance file: " + ex.getMessage());
        }
        logger.info("read plant with " + plant.getProducts() + " products and "
            + randomWalkSpec.size() + " random variables");
    }

    public Plant getPlant() {
        return plant;
    }

    public RandomWalkSpec getRandomWalkSpec() {
        return randomWalkSpec;
    }

    private static Plant buildPlant(Map<String, Object> data) throws ConfigurationException {
        final int products = ((Number) require(data, "products")).intValue();
        return new Plant(
            products,
            toDouble(require(data, "distillationCap")),
            toMatrix(require(data, "crudeRatios")),
            toArray(require(data, "refineCaps")),
            toMatrix(require(data, "productRatios")),
            toDouble(require(data, "allowedOutputChange")));
    }

    @SuppressWarnings("unchecked")
    private static RandomWalkSpec buildRandomWalkSpec(Map<String, Object> data) throws ConfigurationException {
        List<Object> entries = (List<Object>) require(data, "variables");
        List<String> names = new ArrayList<>();
        double[] start = new double[entries.size()];
        double[] sd = new double[entries.size()];
        double[] cap = new double[entries.size()];
        for (int i = 0; i < entries.size(); ++i) {
            Map<String, Object> entry = (Map<String, Object>) entries.get(i);
            names.add((String) require(entry, "name"));
            start[i] = toDouble(require(entry, "start"));
            sd[i] = toDouble(require(entry, "sd"));
            cap[i] = toDouble(require(entry, "cap"));
        }

        Integer truncatePlaces = null;
        if (data.get("truncatePlaces") != null)
            truncatePlaces = ((Number) data.get("truncatePlaces")).intValue();
        return new RandomWalkSpec(names, start, sd, cap, truncatePlaces);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) throws ConfigurationException {
        return (Map<String, Object>) require(root, key);
    }

    private static Object require(Map<String, Object> data, String key) throws ConfigurationException {
        Object value = data.get(key);
        if (value == null)
            throw new ConfigurationException("instance file is missing " + key);
        return value;
    }

    private static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    @SuppressWarnings("unchecked")
    private static double[] toArray(Object value) {
        List<Object> list = (List<Object>) value;
        double[] result = new double[list.size()];
        for (int i = 0; i < list.size(); ++i)
            result[i] = toDouble(list.get(i));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static double[][] toMatrix(Object value) {
        List<Object> rows = (List<Object>) value;
        double[][] result = new double[rows.size()][];
        for (int i = 0; i < rows.size(); ++i)
            result[i] = toArray(rows.get(i));
        return result;
    }
}
