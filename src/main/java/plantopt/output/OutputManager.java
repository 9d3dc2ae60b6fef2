package plantopt.output;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import plantopt.lp.LpFileWriter;
import plantopt.lp.LpModel;
import plantopt.registry.Parameters;
import plantopt.utility.OptException;
import plantopt.utility.Util;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Map;
import java.util.TreeMap;

public class OutputManager {
    /**
     * OutputManager objects collect KPIs of a run and write them, together with the assembled model, to
     * the output folder.
     */
    private final static Logger logger = LogManager.getLogger(OutputManager.class);
    private final String timeStamp;
    private final String outputPath;
    private final TreeMap<String, Object> kpis;

    public OutputManager(String outputPath) {
        timeStamp = new SimpleDateFormat("yyyy_MM_dd'T'HH_mm_ss").format(new Date());
        this.outputPath = outputPath;
        kpis = new TreeMap<>();
    }

    public void addKpi(String key, Object value) {
        kpis.put(key, value);
    }

    public void addKpis(Map<String, Object> values) {
        kpis.putAll(values);
    }

    public String getFilePath(String suffix) {
        return outputPath + "/" + timeStamp + "__" + suffix;
    }

    public void writeLp(LpModel model) throws OptException {
        ensureOutputFolder();
        new LpFileWriter(model).write(getFilePath(model.getName() + ".lp"));
    }

    public void writeKpis() throws OptException {
        ensureOutputFolder();
        TreeMap<String, Object> allKpis = new TreeMap<>();
        allKpis.put("input", new TreeMap<>(Parameters.asMap()));
        allKpis.put("output", kpis);
        Util.writeToYaml(allKpis, getFilePath("kpis.yaml"));
        logger.info("wrote KPIs");
    }

    private void ensureOutputFolder() throws OptException {
        File folder = new File(outputPath);
        if (!folder.isDirectory() && !folder.mkdirs())
            throw new OptException("unable to create output folder " + outputPath);
    }
}
