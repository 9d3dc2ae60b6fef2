package plantopt.utility;

/**
 * Thrown when plant data, walk parameters or risk settings are inconsistent. Always raised before any
 * part of a model is handed to a solver.
 */
public class ConfigurationException extends OptException {
    public ConfigurationException(String message) {
        super(message);
    }
}
