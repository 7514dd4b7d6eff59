// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web;

import io.pfive.web.util.Instances;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/// Configuration options read from properties files on the classpath. The base file is
/// application.properties, overlaid by application-{environment}.properties when one exists, and
/// finally by JVM system properties so any key can be overridden with -Dkey=value.
///
/// There is one global instance for the process, but instances can also be built directly from a
/// Properties object, which is how tests run servers with different settings side by side.
public class Configuration {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String BASE_RESOURCE = "application.properties";
    public static final String ENVIRONMENT_KEY = "environment";

    private static Configuration global;

    private final Properties properties;
    private final Environment environment;

    private Configuration (Properties properties) {
        this.properties = properties;
        this.environment = new Environment(this);
    }

    /// Lazily loaded on first use. Like the server app instance this is not synchronized, as it's
    /// expected to be touched first during single-threaded startup.
    public static Configuration global () {
        if (global == null) {
            global = load();
        }
        return global;
    }

    public static Configuration load () {
        Properties properties = new Properties();
        loadResource(BASE_RESOURCE, properties);
        properties.putAll(System.getProperties());
        String environmentName = properties.getProperty(ENVIRONMENT_KEY);
        if (environmentName != null && !environmentName.isBlank()) {
            loadResource("application-" + environmentName.trim() + ".properties", properties);
            // System properties still win over the environment-specific file.
            properties.putAll(System.getProperties());
        }
        return new Configuration(properties);
    }

    /// Build a configuration that sees only the supplied properties, with no files or system
    /// properties involved.
    public static Configuration fromProperties (Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new Configuration(copy);
    }

    private static void loadResource (String name, Properties properties) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) classLoader = Configuration.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(name)) {
            if (in == null) {
                LOG.debug("No configuration resource named {} on the classpath.", name);
                return;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            LOG.info("Loaded configuration from {}.", name);
        } catch (IOException e) {
            throw new RuntimeException("Could not read configuration resource " + name, e);
        }
    }

    public Environment environment () {
        return environment;
    }

    public boolean contains (String key) {
        return stringValOrNull(key) != null;
    }

    /// @return the trimmed value for the key, or null if the key is missing or blank.
    public String stringValOrNull (String key) {
        String val = properties.getProperty(key);
        if (val == null || val.isBlank()) return null;
        return val.trim();
    }

    public String stringVal (String key) {
        String val = stringValOrNull(key);
        if (val == null) throw new RuntimeException("Missing configuration key: " + key);
        return val;
    }

    public String stringVal (String key, String defaultValue) {
        String val = stringValOrNull(key);
        return val == null ? defaultValue : val;
    }

    public int intVal (String key, int defaultValue) {
        String val = stringValOrNull(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    public boolean boolVal (String key, boolean defaultValue) {
        String val = stringValOrNull(key);
        if (val == null) return defaultValue;
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

    /// The value is the fully qualified name of a class implementing the given type. The instance
    /// is taken from a static INSTANCE field when the class has one, otherwise it is constructed.
    public <T> T instanceVal (String key, Class<T> type, T defaultValue) {
        String className = stringValOrNull(key);
        if (className == null) return defaultValue;
        Class<?> clazz;
        try {
            clazz = Class.forName(className, true, Configuration.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            var message = String.format("Class '%s' for configuration key '%s' was not found.", className, key);
            throw new RuntimeException(message, e);
        }
        if (!type.isAssignableFrom(clazz)) {
            var message = String.format("Class '%s' for configuration key '%s' is not a %s.",
                    className, key, type.getSimpleName());
            throw new RuntimeException(message);
        }
        return Instances.singletonOrNew(clazz.asSubclass(type));
    }

}
