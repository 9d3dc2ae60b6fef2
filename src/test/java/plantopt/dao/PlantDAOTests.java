package plantopt.dao;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import plantopt.domain.Plant;
import plantopt.domain.RandomWalkSpec;
import plantopt.utility.ConfigurationException;
import plantopt.utility.OptException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlantDAOTests {

    @Test
    @DisplayName("instance file should load plant data and walk parameters")
    void testLoad() throws OptException {
        InputStream in = getClass().getResourceAsStream("/refinery.yaml");
        PlantDAO dao = new PlantDAO(in);

        Plant plant = dao.getPlant();
        assertEquals(3, plant.getProducts());
        assertEquals(1000.0, plant.getDistillationCap());
        assertEquals(3.0, plant.getLightCrudeRatio(0));
        assertEquals(2.0, plant.getHeavyCrudeRatio(1));
        assertEquals(0.2, plant.getProductRatio(1, 0));
        assertEquals(0.8, plant.getProductRatio(2, 1));
        assertEquals(20.0, plant.getAllowedOutputChange());

        RandomWalkSpec spec = dao.getRandomWalkSpec();
        assertEquals(8, spec.size());
        assertEquals("crude_light_price", spec.getVariables().get(0));
        assertEquals("demand_2", spec.getVariables().get(7));
        assertEquals(400.0, spec.getStartValues()[5]);
        assertEquals(30.0, spec.getStepSd(6));
        assertEquals(60.0, spec.getStepCap(7));
        assertEquals(Integer.valueOf(0), spec.getTruncatePlaces());
    }

    @Test
    @DisplayName("missing keys, wrong types and malformed YAML should be configuration errors")
    void testBadInput() {
        assertThrows(ConfigurationException.class, () -> load("plant:\n  products: 3\n"));
        assertThrows(ConfigurationException.class, () -> load("- a\n- b\n"));
        assertThrows(ConfigurationException.class, () -> load("plant: [1, 2\n"));
        assertThrows(ConfigurationException.class, () -> load(
            "plant:\n  products: three\n  distillationCap: 1\n  crudeRatios: [[1, 1]]\n"
                + "  refineCaps: [1]\n  productRatios: [[1]]\n  allowedOutputChange: 1\n"));
        assertThrows(ConfigurationException.class, () -> load(
            "plant:\n  products: 1\n  distillationCap: 1\n  crudeRatios: [[1, 1]]\n"
                + "  refineCaps: [1]\n  productRatios: [[1]]\n  allowedOutputChange: 1\n"));
    }

    @Test
    @DisplayName("a missing instance file should be reported")
    void testMissingFile() {
        assertThrows(OptException.class, () -> new PlantDAO("no/such/instance.yaml"));
    }

    private static PlantDAO load(String yaml) throws OptException {
        return new PlantDAO(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
