package com.brewuv.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * <p>
 * Lookup order: programmatic overrides or {@code config.properties} in the working directory,
 * then {@code config.properties} on the classpath, then the built-in defaults table.
 * Blank values count as unset.
 */
public final class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException e) {
            log.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path localFile = workingDir.resolve("config.properties");
        if (Files.exists(localFile)) {
            Properties local = new Properties();
            try (InputStream in = Files.newInputStream(localFile)) {
                local.load(in);
                config.props.putAll(local);
            } catch (IOException e) {
                log.warn("failed to read {}: {}", localFile, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a config from a (possibly nested) map, flattening nested keys with dots.
     * Used by embedding callers and tests; entries behave like local overrides.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public static Config defaults() {
        return new Config(Path.of(".").toAbsolutePath().normalize());
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Optional numeric value: {@code null} when unset or set to {@code none}.
     */
    public Double getOptionalDouble(String key) {
        String value = getString(key);
        if (value.isEmpty() || "none".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.warn("config {}={} is not a number, treating as unset", key, value);
            return null;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("input.dir", "input");
        defaults.put("input.instr_subdir", "instr");
        defaults.put("input.uvdata_subdir", "uvdata");
        defaults.put("outputs.dir", "out");
        defaults.put("tmp.dir", "tmp");

        defaults.put("scan.threads", "0");
        defaults.put("scan.threads.extra", "4");
        defaults.put("scan.threads.max", "20");
        defaults.put("init.threads", "0");
        defaults.put("output.threads", "0");

        defaults.put("arf.column", "3");

        defaults.put("calibration.temperature_factor", "0");
        defaults.put("calibration.temperature_ref", "0");
        defaults.put("calibration.linearity_iterations", "25");
        defaults.put("calibration.straylight_cutoff_nm", "292");
        defaults.put("straylight.default", "APPLIED");

        defaults.put("default.ozone", "300");
        defaults.put("default.albedo", "0.04");
        defaults.put("default.alpha", "1.3");
        defaults.put("default.beta", "0.1");

        defaults.put("correction.enabled", "true");
        defaults.put("correction.cloud_threshold", "0.9");
        defaults.put("correction.default_cloud_cover", "0");
        defaults.put("correction.integration_steps", "160");

        defaults.put("solver.command", "uvspec");
        defaults.put("solver.data_files_path", "/opt/libRadtran/data/");
        defaults.put("solver.timeout_sec", "40");

        defaults.put("eubrewnet.enabled", "false");
        defaults.put("eubrewnet.base_url", "http://rbcce.aemet.es/eubrewnet");
        defaults.put("eubrewnet.user", "");
        defaults.put("eubrewnet.pass", "");
        defaults.put("eubrewnet.request_timeout_sec", "30");
        defaults.put("eubrewnet.retry_count", "2");
        defaults.put("eubrewnet.retry_sleep_ms", "500");

        defaults.put("cloud.api_key", "");
        defaults.put("cloud.url_template",
                "https://api.pirateweather.net/forecast/%s/%s,%s,%s?exclude=minutely,currently,daily&units=si");
        defaults.put("cloud.request_timeout_sec", "20");
        defaults.put("cloud.max_station_distance_km", "30");

        return Collections.unmodifiableMap(defaults);
    }
}
