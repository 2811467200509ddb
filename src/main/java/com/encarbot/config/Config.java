package com.encarbot.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并代码默认值、classpath 下的 config.properties 与工作目录覆盖文件，提供类型化读取。
 * 使用建议：新增配置键时同步补充 buildDefaults，保证未配置时行为可预期。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from an in-memory, possibly nested, property map. Nested maps are
     * flattened with '.' and lists are joined with ','.
     */
    public static Config fromProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
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

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
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
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
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
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
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
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:sqlite:outputs/encar_listings.db");
        defaults.put("db.user", "encarbot");
        defaults.put("db.pass", "");
        defaults.put("db.schema", "encarbot");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("search.car_type", "N");
        defaults.put("search.manufacturer", "벤츠");
        defaults.put("search.model_group", "GLE-클래스");
        defaults.put("search.year_min", "2021");
        defaults.put("search.year_max", "");
        defaults.put("search.price_min", "");
        defaults.put("search.price_max", "9000");
        defaults.put("search.mileage_max", "");

        defaults.put("acquisition.list_url", "https://api.encar.com/search/car/list/general");
        defaults.put("acquisition.home_url", "http://www.encar.com/");
        defaults.put("acquisition.search_url", "http://www.encar.com/dc/dc_carsearchlist.do");
        defaults.put("acquisition.detail_url", "https://fem.encar.com/cars/detail/%s");
        defaults.put("acquisition.page_size", "20");
        defaults.put("acquisition.max_attempts", "3");
        defaults.put("acquisition.retry_sleep_ms", "2000");
        defaults.put("acquisition.session_ttl_minutes", "60");
        defaults.put("acquisition.request_timeout_sec", "30");
        defaults.put("acquisition.page_pause_ms", "1000");

        defaults.put("browser.headless", "true");
        defaults.put("browser.navigation_timeout_ms", "30000");
        defaults.put("browser.settle_ms", "3000");

        defaults.put("monitor.zone", "Asia/Seoul");
        defaults.put("monitor.check_interval_minutes", "10");
        defaults.put("monitor.quick_scan_minutes", "5");
        defaults.put("monitor.tick_seconds", "30");
        defaults.put("monitor.daily_summary_time", "08:00");
        defaults.put("monitor.listing_timeout_sec", "90");

        defaults.put("population.min_pages", "10");
        defaults.put("population.max_pages", "50");
        defaults.put("population.target_coverage", "0.8");
        defaults.put("regular.base_pages", "3");
        defaults.put("regular.enrich_limit", "5");
        defaults.put("quick.pages", "1");
        defaults.put("quick.enrich_limit", "0");

        defaults.put("new_listing.max_registration_age_days", "30");
        defaults.put("new_listing.recent_days", "7");
        defaults.put("new_listing.max_views_for_new", "100");
        defaults.put("new_listing.immediate_alert_views", "10");
        defaults.put("new_listing.alert_window_minutes", "15");
        defaults.put("filters.exclude_keywords", "");

        defaults.put("closure.interval_hours", "6");
        defaults.put("closure.max_listings", "50");
        defaults.put("closure.min_age_hours", "24");
        defaults.put("closure.delay_ms", "2000");

        defaults.put("cleanup.retention_days", "90");
        defaults.put("cleanup.day", "SUNDAY");
        defaults.put("cleanup.time", "02:00");

        defaults.put("notify.telegram.enabled", "false");
        defaults.put("notify.telegram.api_base", "https://api.telegram.org");
        defaults.put("notify.telegram.max_per_minute", "20");
        defaults.put("notify.telegram.timeout_sec", "30");
        defaults.put("notify.telegram.parse_mode", "HTML");
        defaults.put("notify.telegram.disable_preview", "false");
        return defaults;
    }
}
