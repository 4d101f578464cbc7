package com.flowtrace.agent;

import java.util.List;

/**
 * Decides whether calls declared in a class are observed.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>platform namespaces are rejected, except the configured entry-point class</li>
 *   <li>well-known third-party namespaces (and this agent) are rejected</li>
 *   <li>any configured exclude prefix rejects</li>
 *   <li>with a non-empty allow-list only matching prefixes are accepted; otherwise everything is</li>
 * </ol>
 * Stateless and deterministic, so it is evaluated on every boundary without caching.
 */
public final class ScopeFilter {

    static final List<String> PLATFORM_PREFIXES = List.of(
        "java.",
        "javax.",
        "jdk.",
        "sun.",
        "com.sun.",
        "org.w3c.",
        "org.xml.",
        "org.ietf.",
        "org.omg."
    );

    static final List<String> LIBRARY_PREFIXES = List.of(
        "com.flowtrace.agent.",
        // logging
        "org.slf4j.",
        "ch.qos.logback.",
        "org.apache.logging.log4j.",
        "org.apache.log4j.",
        "org.apache.commons.logging.",
        // the agent's own dependencies
        "net.bytebuddy.",
        "com.google.gson.",
        // serialization
        "com.fasterxml.jackson.",
        // Spring infrastructure
        "org.springframework.boot.loader.",
        "org.springframework.boot.context.",
        "org.springframework.boot.autoconfigure.",
        "org.springframework.core.",
        "org.springframework.beans.",
        "org.springframework.context.",
        "org.springframework.cglib.",
        "org.springframework.aop.",
        "org.springframework.web.servlet.",
        // misc runtime plumbing
        "com.lmax.disruptor.",
        "kotlin.",
        "scala.",
        "groovy.",
        // test runners
        "org.junit.",
        "org.opentest4j.",
        "org.apiguardian.",
        "org.apache.maven.surefire."
    );

    private ScopeFilter() {}

    public static boolean shouldTrace(String scope, FilterConfig config) {
        if (scope == null || scope.isBlank()) return false;

        if (isPlatform(scope) && !scope.equals(config.entryPoint())) return false;

        if (startsWithAny(scope, LIBRARY_PREFIXES)) return false;

        if (startsWithAny(scope, config.excludePatterns())) return false;

        List<String> prefixes = config.packagePrefixes();
        return prefixes.isEmpty() || startsWithAny(scope, prefixes);
    }

    static boolean isPlatform(String scope) {
        return startsWithAny(scope, PLATFORM_PREFIXES);
    }

    private static boolean startsWithAny(String scope, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (scope.startsWith(prefix)) return true;
        }
        return false;
    }
}
