package throttle.java.config;

import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Blank or malformed values fall back to the default; out-of-range numbers are clamped.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(String name, String defaultValue) {
        return getOrDefault(System.getenv(), name, defaultValue);
    }

    public static boolean getBoolean(String name, boolean defaultValue) {
        return getBoolean(System.getenv(), name, defaultValue);
    }

    public static int getIntClamped(String name, int defaultValue, int min, int max) {
        return getIntClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static long getLongClamped(String name, long defaultValue, long min, long max) {
        return getLongClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        return (int) getLongClamped(env, name, defaultValue, min, max);
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw.trim());
        } catch (NumberFormatException malformed) {
            return defaultValue;
        }
        if (parsed < min) return min;
        return Math.min(parsed, max);
    }
}
