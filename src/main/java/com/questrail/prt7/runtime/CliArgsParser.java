package com.questrail.prt7.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} command-line arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 */
final class CliArgsParser {
    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

    private CliArgsParser() {}

    /**
     * Splits each argument on its first {@code '='}.
     *
     * @param args raw CLI arguments; {@code null} returns an empty map
     * @return mutable map in argument order
     * @throws IllegalArgumentException if an argument is not {@code key=value}
     */
    static Map<String, String> toMap(String[] args) {
        Map<String, String> map = new LinkedHashMap<>();
        if (args == null) {
            return map;
        }
        for (String raw : args) {
            if (raw == null) {
                continue;
            }
            String arg = raw.trim();
            if (arg.isEmpty()) {
                continue;
            }
            int idx = arg.indexOf('=');
            if (idx <= 0 || idx == arg.length() - 1) {
                throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
            }
            String key = arg.substring(0, idx).trim();
            String value = arg.substring(idx + 1).trim();
            if (!KEY_PATTERN.matcher(key).matches()) {
                throw new IllegalArgumentException("invalid argument name: " + key);
            }
            if (containsControl(value)) {
                throw new IllegalArgumentException("argument " + key + " must not contain control characters");
            }
            map.put(key, value);
        }
        return map;
    }

    static int intValue(Map<String, String> args, String key, int defaultValue) {
        String value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", e);
        }
    }

    static boolean booleanValue(Map<String, String> args, String key, boolean defaultValue) {
        String value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    }

    private static boolean containsControl(CharSequence value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
