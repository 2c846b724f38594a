package com.libragraph.keeper.util;

/**
 * Build metadata read from the jar manifest of a class.
 */
public final class BuildInfo {

    private BuildInfo() {
    }

    /**
     * Returns the {@code Implementation-Version} of the jar containing {@code type},
     * or the empty string when the class was not loaded from a versioned jar.
     */
    public static String version(Class<?> type) {
        Package pkg = type.getPackage();
        if (pkg == null) {
            return "";
        }
        String version = pkg.getImplementationVersion();
        return version == null ? "" : version;
    }

    /**
     * Returns {@code version(type)} or {@code fallback} when no version is recorded.
     */
    public static String versionOr(Class<?> type, String fallback) {
        String version = version(type);
        return version.isEmpty() ? fallback : version;
    }
}
