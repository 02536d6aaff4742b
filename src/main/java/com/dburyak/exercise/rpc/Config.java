package com.dburyak.exercise.rpc;

import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

@Value
public class Config {
    public static final String CFG_PREFIX_ENV = "RPC_";
    public static final String NUM_VERTICLES_ENV = CFG_PREFIX_ENV + "NUM_VERTICLES";
    public static final String PORT_ENV = CFG_PREFIX_ENV + "PORT";
    public static final String API_PATH_ENV = CFG_PREFIX_ENV + "API_PATH";
    public static final String GRACEFUL_SHUTDOWN_TIMEOUT_ENV = CFG_PREFIX_ENV + "GRACEFUL_SHUTDOWN_TIMEOUT";
    public static final String ACCESS_LOG_ENABLED_ENV = CFG_PREFIX_ENV + "ACCESS_LOG_ENABLED";
    public static final String BLOCKING_DISPATCH_ENV = CFG_PREFIX_ENV + "BLOCKING_DISPATCH";
    public static final String STRICT_JSON_RPC_VERSION_ENV = CFG_PREFIX_ENV + "STRICT_JSON_RPC_VERSION";
    public static final List<String> ALL_ENV_VARS = List.of(
            NUM_VERTICLES_ENV,
            PORT_ENV,
            API_PATH_ENV,
            GRACEFUL_SHUTDOWN_TIMEOUT_ENV,
            ACCESS_LOG_ENABLED_ENV,
            BLOCKING_DISPATCH_ENV,
            STRICT_JSON_RPC_VERSION_ENV
    );

    private static final String CFG_PREFIX = "rpc";
    private static final String NUM_VERTICLES = "numVerticles";
    private static final String PORT = "port";
    private static final int PORT_DEFAULT = 8080;
    private static final String API_PATH = "apiPath";
    private static final String API_PATH_DEFAULT = "/";
    private static final String GRACEFUL_SHUTDOWN_TIMEOUT = "gracefulShutdownTimeout";
    private static final String GRACEFUL_SHUTDOWN_TIMEOUT_DEFAULT_STR = "60s";
    private static final String ACCESS_LOG_ENABLED = "accessLogEnabled";
    private static final String BLOCKING_DISPATCH = "blockingDispatch";
    private static final String STRICT_JSON_RPC_VERSION = "strictJsonRpcVersion";

    int numVerticles;
    int port;
    String apiPath;
    Duration gracefulShutdownTimeout;
    boolean accessLogEnabled;
    boolean blockingDispatch;
    boolean strictJsonRpcVersion;

    public Config(JsonObject cfgRootJson) {
        var cfgRpcJson = cfgRootJson.getJsonObject(CFG_PREFIX);
        var numVerticles = getInt(NUM_VERTICLES_ENV, cfgRootJson, NUM_VERTICLES, cfgRpcJson,
                () -> Runtime.getRuntime().availableProcessors());
        if (numVerticles <= 0) {
            throw new IllegalArgumentException(NUM_VERTICLES + " must be > 0");
        }
        this.numVerticles = numVerticles;
        var port = getInt(PORT_ENV, cfgRootJson, PORT, cfgRpcJson, () -> PORT_DEFAULT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(PORT + " must be within [0, 65535], got " + port);
        }
        this.port = port;
        var apiPath = getString(API_PATH_ENV, cfgRootJson, API_PATH, cfgRpcJson, () -> API_PATH_DEFAULT);
        if (!apiPath.startsWith("/")) {
            throw new IllegalArgumentException(API_PATH + " must start with '/', got " + apiPath);
        }
        this.apiPath = apiPath;
        var gracefulShutdownTimeoutStr = getString(GRACEFUL_SHUTDOWN_TIMEOUT_ENV, cfgRootJson,
                GRACEFUL_SHUTDOWN_TIMEOUT, cfgRpcJson, () -> GRACEFUL_SHUTDOWN_TIMEOUT_DEFAULT_STR);
        this.gracefulShutdownTimeout = parseDuration(gracefulShutdownTimeoutStr);
        this.accessLogEnabled = getBoolean(ACCESS_LOG_ENABLED_ENV, cfgRootJson, ACCESS_LOG_ENABLED, cfgRpcJson,
                () -> true);
        this.blockingDispatch = getBoolean(BLOCKING_DISPATCH_ENV, cfgRootJson, BLOCKING_DISPATCH, cfgRpcJson,
                () -> false);
        this.strictJsonRpcVersion = getBoolean(STRICT_JSON_RPC_VERSION_ENV, cfgRootJson, STRICT_JSON_RPC_VERSION,
                cfgRpcJson, () -> false);
    }

    private static int getInt(String envVarName, JsonObject cfgJson, String cfgName, JsonObject subCfgJson,
            Supplier<Integer> defaultValue) {
        if (envVarName != null) {
            var envValue = cfgJson.getValue(envVarName);
            if (envValue != null) {
                return toInt(envVarName, envValue);
            }
        }
        if (subCfgJson != null && cfgName != null) {
            var cfgValue = subCfgJson.getValue(cfgName);
            if (cfgValue != null) {
                return toInt(cfgName, cfgValue);
            }
        }
        return defaultValue.get();
    }

    private static String getString(String envVarName, JsonObject cfgJson, String cfgName, JsonObject subCfgJson,
            Supplier<String> defaultValue) {
        if (envVarName != null) {
            var envValue = cfgJson.getValue(envVarName);
            if (envValue != null) {
                return envValue.toString();
            }
        }
        if (subCfgJson != null && cfgName != null) {
            var cfgValue = subCfgJson.getValue(cfgName);
            if (cfgValue != null) {
                return cfgValue.toString();
            }
        }
        return defaultValue.get();
    }

    private static boolean getBoolean(String envVarName, JsonObject cfgJson, String cfgName, JsonObject subCfgJson,
            Supplier<Boolean> defaultValue) {
        if (envVarName != null) {
            var envValue = cfgJson.getValue(envVarName);
            if (envValue != null) {
                return toBoolean(envVarName, envValue);
            }
        }
        if (subCfgJson != null && cfgName != null) {
            var cfgValue = subCfgJson.getValue(cfgName);
            if (cfgValue != null) {
                return toBoolean(cfgName, cfgValue);
            }
        }
        return defaultValue.get();
    }

    // Vertx env store parses values that look like JSON (numbers, booleans), everything else stays a String, so we
    // accept both representations
    private static int toInt(String name, Object value) {
        if (value instanceof Number num) {
            var longValue = num.longValue();
            if (num.doubleValue() != longValue || longValue != (int) longValue) {
                throw new IllegalArgumentException(name + " must be an integer, got " + value);
            }
            return (int) longValue;
        }
        try {
            return Integer.parseInt(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value, e);
        }
    }

    private static boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        var str = value.toString().strip();
        if ("true".equalsIgnoreCase(str)) {
            return true;
        } else if ("false".equalsIgnoreCase(str)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be a boolean, got " + value);
    }

    private static Duration parseDuration(String durationStr) {
        // for simple cases this should work, e.g. "60s", "5m", "1h", "2h30m", "1h15m10s"
        Duration duration;
        try {
            duration = Duration.parse("PT" + durationStr);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid duration: " + durationStr, e);
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + durationStr);
        }
        return duration;
    }
}
