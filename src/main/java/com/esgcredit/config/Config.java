package com.esgcredit.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：承载 config 模块 的关键逻辑，对外提供可复用的调用入口。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：classpath config.properties 之后叠加工作目录下的同名文件。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Defaults plus the given overrides, without touching the classpath or the file system.
     */
    public static Config fromMap(Map<String, String> overrides) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : entry.getValue();
                config.overrideProps.setProperty(entry.getKey().trim(), value);
                config.props.setProperty(entry.getKey().trim(), value);
            }
        }
        return config;
    }

    public static Config defaults() {
        return fromMap(Map.of());
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

/**
 * 方法说明：getBoolean，负责获取数据并返回结果。
 * 处理流程：true/1/yes/y 视为真，其余为假。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
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

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

/**
 * 方法说明：getList，负责获取数据并返回结果。
 * 处理流程：按逗号或分号切分并去除空白项。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
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

    /**
     * Keys starting with the given prefix, with the prefix stripped. Defaults are included.
     */
    public Map<String, String> withPrefix(String prefix) {
        Map<String, String> out = new HashMap<>();
        for (Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                out.put(entry.getKey().substring(prefix.length()), entry.getValue());
            }
        }
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                out.put(name.substring(prefix.length()), props.getProperty(name).trim());
            }
        }
        return out;
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

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return fallback;
        }
    }

/**
 * 方法说明：buildDefaults，负责构建目标对象或输出内容。
 * 处理流程：内置默认值，classpath 与本地文件中的同名键会覆盖这里的取值。
 * 维护提示：调整此方法时建议同步检查调用方、异常分支与日志输出。
 */
    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("score.weight.environmental", "0.30");
        defaults.put("score.weight.social", "0.35");
        defaults.put("score.weight.governance", "0.35");
        defaults.put("score.improvement_threshold", "70");
        defaults.put("grade.table", "A+:90-100:2.7,A:85-90:2.2,A-:80-85:1.8,B+:75-80:1.3,B:70-75:1.2,B-:65-70:0.8,C:0-65:0.4");

        defaults.put("indicator.raw.min", "0");
        defaults.put("indicator.raw.max", "100");
        defaults.put("indicator.inverse", "");
        defaults.put("indicator.required.environmental", "");
        defaults.put("indicator.required.social", "");
        defaults.put("indicator.required.governance", "");
        defaults.put("compliance.frameworks", "k_taxonomy,tcfd,gri");

        defaults.put("supply.target_esg_score", "70");
        defaults.put("supply.risk_scale", "0.5");
        defaults.put("supply.high_risk_score", "40");
        defaults.put("supply.concentration_top_n", "5");

        defaults.put("forecast.seed", "42");
        defaults.put("forecast.members", "5");
        defaults.put("forecast.trees", "40");
        defaults.put("forecast.max_depth", "8");
        defaults.put("forecast.node_size", "3");
        defaults.put("forecast.z", "1.96");
        defaults.put("forecast.default_horizon", "12");

        defaults.put("match.rate_floor", "0");
        defaults.put("loan.term_years", "5");

        defaults.put("pipeline.threads", "4");
        defaults.put("pipeline.fit_timeout_sec", "60");

        return Collections.unmodifiableMap(defaults);
    }
}
