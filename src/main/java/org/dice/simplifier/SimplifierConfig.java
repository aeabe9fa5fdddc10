package org.dice.simplifier;

import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of a {@link BooleanSimplifier}. {@link #load()} reads
 * {@value SimplifierParams#RESOURCE} from the classpath; JVM system properties with the
 * same keys take precedence. Invalid values are logged and replaced by the defaults.
 */
public class SimplifierConfig {

    private static final Logger Log = LoggerFactory.getLogger( SimplifierConfig.class );

    public static final int DEFAULT_MAX_STEPS = 1000;

    private final int maxSteps;

    public SimplifierConfig(int maxSteps) {
        Preconditions.checkArgument(maxSteps > 0, "%s must be positive, got %s", SimplifierParams.MAX_STEPS, maxSteps);
        this.maxSteps = maxSteps;
    }

    public static SimplifierConfig defaults() {
        return new SimplifierConfig(DEFAULT_MAX_STEPS);
    }

    public static SimplifierConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SimplifierConfig.class.getClassLoader().getResourceAsStream(SimplifierParams.RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            Log.warn(String.format("Failed to read %s, using defaults", SimplifierParams.RESOURCE), e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SimplifierParams.PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static SimplifierConfig fromProperties(Properties properties) {
        return new SimplifierConfig(getPositiveInt(properties, SimplifierParams.MAX_STEPS, DEFAULT_MAX_STEPS));
    }

    private static int getPositiveInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            Log.error(String.format("%s must be an integer but is '%s', using %d", key, value, defaultValue));
            return defaultValue;
        }
        if (parsed > 0) {
            return parsed;
        }
        Log.error(String.format("%s must be positive but is %d, using %d", key, parsed, defaultValue));
        return defaultValue;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Override
    public String toString() {
        return String.format("%s=%d", SimplifierParams.MAX_STEPS, maxSteps);
    }
}
