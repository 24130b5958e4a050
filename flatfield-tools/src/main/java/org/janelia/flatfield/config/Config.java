package org.janelia.flatfield.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Layered application properties. Later layers override earlier ones.
 */
public class Config {

    private final Map<String, String> properties;

    Config(Map<String, String> properties) {
        this.properties = new LinkedHashMap<>(properties);
    }

    public String getStringPropertyValue(String name) {
        return properties.get(name);
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = properties.get(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public double getDoublePropertyValue(String name, double defaultValue) {
        String value = getStringPropertyValue(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    public <E extends Enum<E>> E getEnumPropertyValue(String name, Class<E> enumType, E defaultValue) {
        String value = getStringPropertyValue(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(enumType, value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + enumType.getSimpleName() + " value for " + name + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("properties", properties)
                .toString();
    }
}
