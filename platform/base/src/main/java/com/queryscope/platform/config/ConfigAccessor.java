package com.queryscope.platform.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Null-free reads of HOCON values.
 *
 * <pre>
 *   int batch = ConfigAccessor.intVal(queue, "batch-size", 10);
 *   Optional&lt;String&gt; url = ConfigAccessor.nonBlank(planCapture, "connection-string");
 * </pre>
 *
 * A missing path yields the default (or empty). {@link #nonBlank} also treats
 * "" as missing, which is how optional strings are declared in reference.conf.
 * Present values of the wrong type still fail with the usual ConfigException.
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    public static Optional<String> string(Config c, String path) {
        return read(c, path, Config::getString);
    }

    public static String string(Config c, String path, String defaultValue) {
        return string(c, path).orElse(defaultValue);
    }

    public static Optional<String> nonBlank(Config c, String path) {
        return string(c, path).map(String::trim).filter(s -> !s.isEmpty());
    }

    public static int intVal(Config c, String path, int defaultValue) {
        return read(c, path, Config::getInt).orElse(defaultValue);
    }

    public static boolean bool(Config c, String path, boolean defaultValue) {
        return read(c, path, Config::getBoolean).orElse(defaultValue);
    }

    public static Duration duration(Config c, String path, Duration defaultValue) {
        return read(c, path, Config::getDuration).orElse(defaultValue);
    }

    public static <E extends Enum<E>> E enumVal(Config c, Class<E> type, String path, E defaultValue) {
        return read(c, path, (cfg, p) -> cfg.getEnum(type, p)).orElse(defaultValue);
    }

    public static List<String> stringList(Config c, String path, List<String> defaultValue) {
        return read(c, path, Config::getStringList).orElse(defaultValue);
    }

    private static <T> Optional<T> read(Config c, String path, BiFunction<Config, String, T> getter) {
        return c.hasPath(path) ? Optional.of(getter.apply(c, path)) : Optional.empty();
    }
}
