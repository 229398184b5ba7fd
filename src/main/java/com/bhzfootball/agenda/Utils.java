package com.bhzfootball.agenda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for common helper methods used by configuration and file output.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Reads a setting from Java system properties, then from the environment.
     * @param key setting name
     * @param defaultVal value used when neither is set
     * @return setting value
     */
    public static String propOrEnv(String key, String defaultVal) {
        String prop = System.getProperty(key);
        if (prop != null) return prop;
        String env = System.getenv(key);
        return env != null ? env : defaultVal;
    }

    /**
     * Parses {@code --key=value} arguments. Bare {@code --flag} means {@code true}; anything else is ignored with a warning.
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> parsed = new LinkedHashMap<>();
        if (args == null) return parsed;
        for (String arg : args) {
            if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
                logger.warn("Ignoring argument '{}'. Expected --KEY=value.", arg);
                continue;
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            String key = (eq < 0 ? body : body.substring(0, eq)).trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_');
            parsed.put(key, eq < 0 ? "true" : body.substring(eq + 1).trim());
        }
        return parsed;
    }
}
