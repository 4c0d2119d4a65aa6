package io.scrapehive.common;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the application configuration from the classpath and the command line.
 * <p>
 * Recognised arguments:
 * <pre>
 *   --config /path/to/app.conf   (or -c)  file layered over application.conf / reference.conf
 *   --conf scrapehive.urls=[...]         single override, may be repeated, highest precedence
 * </pre>
 */
public final class ConfigUtils {

    public static final String CONFIG_ROOT = "scrapehive";

    private ConfigUtils() {}

    public static Config loadConfig(String[] args) {
        List<String> overrides = new ArrayList<>();
        String configFile = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--conf" -> overrides.add(requireValue(args, ++i, arg));
                case "--config", "-c" -> configFile = requireValue(args, ++i, arg);
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        Config base = ConfigFactory.load();
        if (configFile != null) {
            File file = new File(configFile);
            if (!file.isFile()) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            base = ConfigFactory.parseFile(file).withFallback(base);
        }
        Config result = base;
        for (String override : overrides) {
            result = ConfigFactory.parseString(override).withFallback(result);
        }
        return result.resolve();
    }

    public static Config scraperConfig(String[] args) {
        return loadConfig(args).getConfig(CONFIG_ROOT);
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }
}
