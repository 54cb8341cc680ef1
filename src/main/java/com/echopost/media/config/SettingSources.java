package com.echopost.media.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Resolves a setting from JVM properties, environment variables and a classpath
 * properties file, in that order.
 */
public final class SettingSources {

    private final Properties fileProperties;

    private SettingSources(Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    public static SettingSources fromClasspath(String resource) {
        return new SettingSources(loadFileProperties(resource));
    }

    static SettingSources of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new SettingSources(copy);
    }

    /**
     * @param property system property name, e.g. {@code media.batchSize}
     * @param fileKey  key inside the properties file, e.g. {@code batchSize}
     */
    public String lookup(String property, String fileKey) {
        return firstNonBlank(
            System.getProperty(property),
            System.getenv(toEnvName(property)),
            fileProperties.getProperty(fileKey)
        );
    }

    public int intValue(String property, String fileKey, int fallback) {
        return parse(lookup(property, fileKey), Integer::parseInt, fallback, value -> value > 0);
    }

    public long longValue(String property, String fileKey, long fallback) {
        return parse(lookup(property, fileKey), Long::parseLong, fallback, value -> value > 0);
    }

    public boolean booleanValue(String property, String fileKey, boolean fallback) {
        String raw = lookup(property, fileKey);
        if (raw == null) {
            return fallback;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on" -> true;
            case "false", "no", "0", "off" -> false;
            default -> fallback;
        };
    }

    public static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * {@code media.itemTimeoutMillis} becomes {@code MEDIA_ITEM_TIMEOUT_MILLIS}.
     */
    static String toEnvName(String property) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < property.length(); i++) {
            char c = property.charAt(i);
            if (c == '.' || c == '-') {
                out.append('_');
            } else if (Character.isUpperCase(c)) {
                out.append('_').append(c);
            } else {
                out.append(Character.toUpperCase(c));
            }
        }
        return out.toString();
    }

    private static <T extends Number> T parse(String raw,
                                              Function<String, T> parser,
                                              T fallback,
                                              Predicate<T> accept) {
        if (raw == null) {
            return fallback;
        }
        try {
            T value = parser.apply(raw);
            return accept.test(value) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static Properties loadFileProperties(String resource) {
        Properties props = new Properties();
        try (InputStream stream = SettingSources.class
            .getClassLoader()
            .getResourceAsStream(resource)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ignored) {
            // malformed file: system properties and environment still apply
        }
        return props;
    }
}
