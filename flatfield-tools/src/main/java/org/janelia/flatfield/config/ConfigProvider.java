package org.janelia.flatfield.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/flatfield-correction.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Map<String, String> properties = new LinkedHashMap<>();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream resourceStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (resourceStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                fromInputStream(resourceStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    /**
     * Add the properties from the given file. A blank file name is ignored.
     */
    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file " + fileName + " not found");
        }
        try (InputStream fileStream = Files.newInputStream(configFile)) {
            LOG.info("Read config from {}", configFile);
            fromInputStream(fileStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    public ConfigProvider fromMap(Map<String, String> values) {
        properties.putAll(values);
        return this;
    }

    private void fromInputStream(InputStream stream) throws IOException {
        Properties props = new Properties();
        props.load(stream);
        props.stringPropertyNames().forEach(name -> properties.put(name, props.getProperty(name)));
    }

    public Config get() {
        return new Config(properties);
    }
}
