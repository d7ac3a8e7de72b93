package ch.ethz.systems.wimaxbench.core.config;

import ch.ethz.systems.wimaxbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.wimaxbench.core.config.exceptions.PropertyNotExistingException;
import ch.ethz.systems.wimaxbench.core.config.exceptions.PropertyValueInvalidException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Run configuration read from a properties file.
 *
 * Every key in the file must be listed in one of the allowed property
 * arrays (see {@link BaseAllowedProperties}).
 */
public class WBProperties {

    private final Properties properties;
    private final Set<String> allowedProperties;
    private final String fileName;

    /**
     * Load the properties from file.
     *
     * @param fileName                  Properties file name
     * @param allowedPropertiesArrays   Arrays of allowed property keys
     */
    public WBProperties(String fileName, String[]... allowedPropertiesArrays) {
        this.fileName = fileName;
        this.properties = new Properties();
        this.allowedProperties = collectAllowed(allowedPropertiesArrays);
        try (InputStream in = new FileInputStream(fileName)) {
            this.properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException("WBProperties: could not load properties file " + fileName, e);
        }
        checkAllowed();
    }

    /**
     * Wrap already loaded properties.
     *
     * @param properties                Properties instance (copied)
     * @param allowedPropertiesArrays   Arrays of allowed property keys
     */
    public WBProperties(Properties properties, String[]... allowedPropertiesArrays) {
        this.fileName = "<in-memory>";
        this.properties = new Properties();
        this.properties.putAll(properties);
        this.allowedProperties = collectAllowed(allowedPropertiesArrays);
        checkAllowed();
    }

    private static Set<String> collectAllowed(String[]... allowedPropertiesArrays) {
        Set<String> allowed = new HashSet<>();
        for (String[] array : allowedPropertiesArrays) {
            allowed.addAll(Arrays.asList(array));
        }
        return allowed;
    }

    private void checkAllowed() {
        for (String key : properties.stringPropertyNames()) {
            checkAllowed(key);
        }
    }

    private void checkAllowed(String key) {
        if (!allowedProperties.contains(key)) {
            throw new PropertyNotExistingException(key, fileName);
        }
    }

    /**
     * Override (or add) a property, e.g. from the command line.
     *
     * @param key       Property key
     * @param value     New value
     */
    public void overrideProperty(String key, String value) {
        checkAllowed(key);
        properties.setProperty(key, value);
    }

    public boolean isPropertyDefined(String key) {
        return properties.getProperty(key) != null;
    }

    public String getPropertyOrFail(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new PropertyMissingException(key);
        }
        return value.trim();
    }

    public String getPropertyWithDefault(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    public boolean getBooleanPropertyOrFail(String key) {
        return parseBoolean(key, getPropertyOrFail(key));
    }

    public boolean getBooleanPropertyWithDefault(String key, boolean defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseBoolean(key, value);
    }

    public int getIntegerPropertyOrFail(String key) {
        return parseInteger(key, getPropertyOrFail(key));
    }

    public int getIntegerPropertyWithDefault(String key, int defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseInteger(key, value);
    }

    public long getLongPropertyOrFail(String key) {
        return parseLong(key, getPropertyOrFail(key));
    }

    public long getLongPropertyWithDefault(String key, long defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseLong(key, value);
    }

    public double getDoublePropertyOrFail(String key) {
        return parseDouble(key, getPropertyOrFail(key));
    }

    public double getDoublePropertyWithDefault(String key, double defaultValue) {
        String value = getPropertyWithDefault(key, null);
        return value == null ? defaultValue : parseDouble(key, value);
    }

    /**
     * Retrieve all properties as a sorted "key=value" listing, one per line.
     *
     * @return  Properties listing
     */
    public String getAllPropertiesToString() {
        StringBuilder builder = new StringBuilder();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            builder.append(key).append("=").append(properties.getProperty(key)).append("\n");
        }
        return builder.toString();
    }

    private static boolean parseBoolean(String key, String value) {
        if (value.equalsIgnoreCase("true")) {
            return true;
        } else if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new PropertyValueInvalidException(key, value);
    }

    private static int parseInteger(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(key, value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(key, value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new PropertyValueInvalidException(key, value, e);
        }
    }

}
