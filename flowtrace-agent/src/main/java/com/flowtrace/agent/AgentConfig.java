package com.flowtrace.agent;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Resolved agent configuration.
 *
 * Sources, highest precedence first: agent args, system properties, environment, defaults.
 * Agent args look like:
 * <pre>
 *   java -javaagent:flowtrace-agent.jar=packages=com.myapp,com.shared,logfile=/tmp/trace.jsonl,async=true -jar app.jar
 * </pre>
 *
 * Agent args (key=value pairs separated by comma):
 *   packages   - allow-listed class-name prefixes (default: everything)
 *   exclude    - denied class-name prefixes
 *   logfile    - JSONL target (default: flowtrace.jsonl); blank disables the file
 *   stdout     - "true" also echoes every line to standard output
 *   max_length - cap on serialized values (default: 1000, 0 = unbounded)
 *   async      - "true" writes from a background thread
 *   main       - entry-point class exempt from the platform-namespace rule
 *   segment_dir        - directory for full copies of events with oversized values (default: off)
 *   truncate_threshold - longest value kept in the main log when segmenting (default: 1000)
 */
public record AgentConfig(
    List<String> packagePrefixes,
    List<String> excludePatterns,
    Path logFile,
    boolean echoToStdout,
    int maxSerializedLength,
    boolean asyncMode,
    String entryPoint,
    Path segmentDirectory,
    int truncateThreshold
) {

    static final String DEFAULT_LOG_FILE = "flowtrace.jsonl";
    static final int DEFAULT_MAX_LENGTH = 1000;

    /** Setting name -> (agent arg, system property, environment variable). */
    enum Setting {
        PACKAGES("packages", "flowtrace.package-prefix", "FLOWTRACE_PACKAGE_PREFIX", true),
        EXCLUDE("exclude", "flowtrace.exclude", "FLOWTRACE_EXCLUDE", true),
        LOG_FILE("logfile", "flowtrace.logfile", "FLOWTRACE_LOGFILE", false),
        STDOUT("stdout", "flowtrace.stdout", "FLOWTRACE_STDOUT", false),
        MAX_LENGTH("max_length", "flowtrace.max-arg-length", "FLOWTRACE_MAX_ARG_LENGTH", false),
        ASYNC("async", "flowtrace.async", "FLOWTRACE_ASYNC", false),
        MAIN("main", "flowtrace.main-class", null, false),
        SEGMENT_DIR("segment_dir", "flowtrace.segment-dir", "FLOWTRACE_SEGMENT_DIR", false),
        TRUNCATE_THRESHOLD("truncate_threshold", "flowtrace.truncate-threshold", "FLOWTRACE_TRUNCATE_THRESHOLD", false);

        final String arg;
        final String property;
        final String env;
        final boolean list;

        Setting(String arg, String property, String env, boolean list) {
            this.arg = arg;
            this.property = property;
            this.env = env;
            this.list = list;
        }

        static Setting forArg(String key) {
            for (Setting s : values()) {
                if (s.arg.equals(key)) return s;
            }
            return null;
        }
    }

    /** Without segmentation. */
    public AgentConfig(List<String> packagePrefixes, List<String> excludePatterns, Path logFile,
                       boolean echoToStdout, int maxSerializedLength, boolean asyncMode, String entryPoint) {
        this(packagePrefixes, excludePatterns, logFile, echoToStdout, maxSerializedLength, asyncMode,
            entryPoint, null, SinkConfig.DEFAULT_TRUNCATE_THRESHOLD);
    }

    public AgentConfig {
        packagePrefixes = packagePrefixes == null ? List.of() : List.copyOf(packagePrefixes);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static AgentConfig defaults() {
        return resolve(null, new Properties(), Map.of());
    }

    /** Reads system properties and environment only, for processes without the agent. */
    public static AgentConfig fromEnvironment() {
        return resolve(null, System.getProperties(), System.getenv());
    }

    public static AgentConfig fromAgentArgs(String agentArgs) {
        return resolve(agentArgs, System.getProperties(), System.getenv());
    }

    static AgentConfig resolve(String agentArgs, Properties sysProps, Map<String, String> env) {
        Map<Setting, String> args = parseArgs(agentArgs);
        Map<Setting, String> raw = new HashMap<>();
        for (Setting s : Setting.values()) {
            String value = args.get(s);
            if (value == null && s.property != null) value = sysProps.getProperty(s.property);
            if (value == null && s.env != null) value = env.get(s.env);
            if (value != null) raw.put(s, value.trim());
        }

        String logFile = raw.getOrDefault(Setting.LOG_FILE, DEFAULT_LOG_FILE);
        String entryPoint = raw.containsKey(Setting.MAIN)
            ? raw.get(Setting.MAIN)
            : mainClassFromCommand(sysProps.getProperty("sun.java.command"));

        return new AgentConfig(
            FilterConfig.splitList(raw.get(Setting.PACKAGES)),
            FilterConfig.splitList(raw.get(Setting.EXCLUDE)),
            logFile.isBlank() ? null : Paths.get(logFile),
            Boolean.parseBoolean(raw.get(Setting.STDOUT)),
            parseInt(Setting.MAX_LENGTH, raw.get(Setting.MAX_LENGTH), DEFAULT_MAX_LENGTH),
            Boolean.parseBoolean(raw.get(Setting.ASYNC)),
            entryPoint,
            blankToNull(raw.get(Setting.SEGMENT_DIR)),
            parseInt(Setting.TRUNCATE_THRESHOLD, raw.get(Setting.TRUNCATE_THRESHOLD),
                SinkConfig.DEFAULT_TRUNCATE_THRESHOLD)
        );
    }

    public FilterConfig filterConfig() {
        return new FilterConfig(packagePrefixes, excludePatterns, entryPoint);
    }

    public SinkConfig sinkConfig() {
        return new SinkConfig(logFile, echoToStdout, asyncMode, maxSerializedLength,
            segmentDirectory, truncateThreshold);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /**
     * Splits agent args on commas. A token without '=' continues the previous list-valued
     * setting, so {@code packages=com.a,com.b,stdout=true} keeps both prefixes.
     */
    static Map<Setting, String> parseArgs(String agentArgs) {
        Map<Setting, String> parsed = new HashMap<>();
        if (agentArgs == null || agentArgs.isBlank()) return parsed;

        Setting previous = null;
        for (String part : agentArgs.split(",")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2) {
                Setting s = Setting.forArg(kv[0].trim());
                if (s == null) {
                    System.err.println("[flowtrace] WARN unknown agent arg: " + kv[0].trim());
                }
                previous = s;
                if (s != null) parsed.put(s, kv[1].trim());
            } else if (previous != null && previous.list && !part.isBlank()) {
                parsed.merge(previous, part.trim(), (a, b) -> a + "," + b);
            }
        }
        return parsed;
    }

    private static int parseInt(Setting setting, String value, int fallback) {
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("[flowtrace] WARN invalid " + setting.arg + " '" + value
                + "', using " + fallback);
            return fallback;
        }
    }

    private static Path blankToNull(String path) {
        return path == null || path.isBlank() ? null : Paths.get(path);
    }

    /** First token of {@code sun.java.command}, unless the process was launched with -jar. */
    static String mainClassFromCommand(String command) {
        if (command == null || command.isBlank()) return null;
        String first = command.trim().split("\\s+", 2)[0];
        return first.endsWith(".jar") ? null : first;
    }
}
