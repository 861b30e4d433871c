package io.hyperfoil.tools.sls.lsp;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.util.Properties;

/**
 * Settings read from {@value #RESOURCE} on the classpath. A JVM system property with the same name
 * overrides each entry.
 */
public class SlsConfig {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String RESOURCE = "sls-lsp.properties";

    public static final String EXTENSION = "sls.extension";
    public static final String TOP_FILE = "sls.top.file";
    public static final String STATES_INDEX = "sls.states.index";

    private static final String DEFAULT_EXTENSION = "sls";
    private static final String DEFAULT_TOP_FILE = "top.sls";
    private static final String DEFAULT_STATES_INDEX = "states.yaml";

    private final Properties properties;

    public SlsConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    public static SlsConfig load() {
        Properties properties = new Properties();
        try (InputStream is = SlsConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                properties.load(is);
            } else {
                logger.warnf("%s not found on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warnf(e, "failed to read %s, using defaults", RESOURCE);
        }
        for (String key : new String[]{EXTENSION, TOP_FILE, STATES_INDEX}) {
            String override = System.getProperty(key);
            if (override != null && !override.isBlank()) {
                properties.setProperty(key, override);
            }
        }
        return new SlsConfig(properties);
    }

    public String getExtension() {
        return properties.getProperty(EXTENSION, DEFAULT_EXTENSION);
    }

    public String getTopFile() {
        return properties.getProperty(TOP_FILE, DEFAULT_TOP_FILE);
    }

    public String getStatesIndex() {
        return properties.getProperty(STATES_INDEX, DEFAULT_STATES_INDEX);
    }
}
