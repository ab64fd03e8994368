package org.cardiocore.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathExpressionException;

import org.apache.log4j.Logger;
import org.cardiocore.exceptions.ConfigurationException;
import org.cardiocore.utils.XPathHelper;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * Pipeline settings
 *
 * Loaded once at start-up from an XML settings file on the classpath:
 *
 * <pre>
 * &lt;PipelineSettings&gt;
 *   &lt;LoaderSettings&gt;
 *     &lt;defaultSampleRate&gt;500&lt;/defaultSampleRate&gt;
 *   &lt;/LoaderSettings&gt;
 *   ...
 * &lt;/PipelineSettings&gt;
 * </pre>
 *
 * Section elements only group keys; every leaf element name is a key. A JVM
 * system property named {@code cardiocore.<key>} replaces the file value.
 * Missing files, missing keys and unparsable values raise
 * {@link ConfigurationException}.
 */
public class PipelineSettings {

    private static final Logger logger = Logger.getLogger(PipelineSettings.class);

    public static final String DEFAULT_RESOURCE = "pipelineSettings.xml";
    public static final String OVERRIDE_PREFIX = "cardiocore.";
    private static final String SETTINGS_PATH = "//PipelineSettings/*/*";

    private final TreeMap<String, String> settings;

    private PipelineSettings(Map<String, String> settings) {
        this.settings = new TreeMap<>(settings);
    }

    // ===== FACTORY METHODS =====

    public static PipelineSettings load() {
        return load(DEFAULT_RESOURCE, System.getProperties());
    }

    public static PipelineSettings load(String resourceName, Properties overrides) {
        TreeMap<String, String> values = readResource(resourceName);

        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(OVERRIDE_PREFIX)) {
                String key = name.substring(OVERRIDE_PREFIX.length());
                String value = overrides.getProperty(name);
                logger.info("Setting override: " + key + " = " + value);
                values.put(key, value.trim());
            }
        }
        logger.info("Loaded " + values.size() + " pipeline settings from " + resourceName);
        return new PipelineSettings(values);
    }

    public static PipelineSettings fromMap(Map<String, String> values) {
        return new PipelineSettings(values);
    }

    public PipelineSettings withOverride(String key, String value) {
        TreeMap<String, String> copy = new TreeMap<>(settings);
        copy.put(key, value);
        return new PipelineSettings(copy);
    }

    private static TreeMap<String, String> readResource(String resourceName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PipelineSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new ConfigurationException(resourceName, "Settings resource not found on classpath");
            }
            Document doc = XPathHelper.parseXml(in);
            return XPathHelper.findMultipleXMLItems(doc, SETTINGS_PATH);
        } catch (IOException | ParserConfigurationException | SAXException | XPathExpressionException e) {
            throw new ConfigurationException(resourceName, "Unreadable settings file: " + e.getMessage(), e);
        }
    }

    // ===== TYPED ACCESSORS =====

    public String getString(String key) {
        String value = settings.get(key);
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException(key, "Missing required setting");
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        String value = settings.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public double getDouble(String key) {
        String value = getString(key);
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                throw new ConfigurationException(key, "Setting must be finite: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "Setting is not a number: " + value, e);
        }
    }

    public double getPositiveDouble(String key) {
        double value = getDouble(key);
        if (value <= 0) {
            throw new ConfigurationException(key, "Setting must be positive: " + value);
        }
        return value;
    }

    public int getPositiveInt(String key) {
        String value = getString(key);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new ConfigurationException(key, "Setting must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "Setting is not an integer: " + value, e);
        }
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException(key, "Setting is not a boolean: " + value);
    }

    /**
     * Comma separated list of numbers
     */
    public double[] getDoubleList(String key) {
        String[] parts = getString(key).split(",");
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key, "List entry is not a number: " + parts[i], e);
            }
        }
        return values;
    }

    public boolean contains(String key) {
        return settings.containsKey(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(settings);
    }

    @Override
    public String toString() {
        return "PipelineSettings" + settings;
    }
}
