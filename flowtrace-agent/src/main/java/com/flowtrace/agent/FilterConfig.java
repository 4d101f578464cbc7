package com.flowtrace.agent;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Read-only input of {@link ScopeFilter}.
 *
 * @param packagePrefixes allow-list of class-name prefixes; empty allows everything
 * @param excludePatterns deny-list of class-name prefixes
 * @param entryPoint      launcher main class, exempt from the platform-namespace rule; may be null
 */
public record FilterConfig(
    List<String> packagePrefixes,
    List<String> excludePatterns,
    String entryPoint
) {

    public FilterConfig {
        packagePrefixes = clean(packagePrefixes);
        excludePatterns = clean(excludePatterns);
        entryPoint = entryPoint == null || entryPoint.isBlank() ? null : entryPoint.trim();
    }

    public static FilterConfig defaults() {
        return new FilterConfig(List.of(), List.of(), null);
    }

    public static FilterConfig of(List<String> packagePrefixes, List<String> excludePatterns) {
        return new FilterConfig(packagePrefixes, excludePatterns, null);
    }

    /** Builds a config from comma-separated allow and deny lists, as read from configuration. */
    public static FilterConfig parse(String packagePrefixes, String excludePatterns, String entryPoint) {
        return new FilterConfig(splitList(packagePrefixes), splitList(excludePatterns), entryPoint);
    }

    public FilterConfig withEntryPoint(String mainClass) {
        return new FilterConfig(packagePrefixes, excludePatterns, mainClass);
    }

    static List<String> splitList(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.asList(csv.split(","));
    }

    private static List<String> clean(Collection<String> raw) {
        if (raw == null) return List.of();
        return raw.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
    }
}
