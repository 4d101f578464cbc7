package com.flowtrace.agent;

import com.flowtrace.agent.annotation.Traced;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.annotation.AnnotationDescription;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.matcher.ElementMatchers;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:flowtrace-agent.jar=packages=com.myapp,logfile=trace.jsonl -jar app.jar
 *
 * See {@link AgentConfig} for the accepted agent args. Two transformations are installed:
 * every method of a type accepted by {@link ScopeFilter} gets {@link BoundaryAdvice} feeding the
 * {@link InterceptionEngine}; methods annotated {@link Traced} (or declared in a {@code @Traced}
 * type) get {@link TracedAdvice} wherever they live.
 */
public class FlowTraceAgent {

    /** Engine started by the last premain/agentmain; null before attach. */
    static volatile InterceptionEngine engine;

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process class file versions newer than it officially supports.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = AgentConfig.fromAgentArgs(agentArgs);
        System.err.println("[flowtrace] packages: "
            + (config.packagePrefixes().isEmpty() ? "<all>" : String.join(",", config.packagePrefixes())));
        System.err.println("[flowtrace] log file: "
            + (config.logFile() != null ? config.logFile() : "<none>")
            + " stdout=" + config.echoToStdout() + " async=" + config.asyncMode()
            + " max_length=" + config.maxSerializedLength());
        if (config.segmentDirectory() != null) {
            System.err.println("[flowtrace] segments: " + config.segmentDirectory()
                + " truncate_threshold=" + config.truncateThreshold());
        }

        EventSink sink;
        try {
            sink = FlowTrace.init(config);
        } catch (JsonlEventSink.SinkOpenException e) {
            System.err.println("[flowtrace] ERROR " + e.getMessage() + "; tracing disabled");
            return;
        }

        InterceptionEngine started = new InterceptionEngine(
            config.filterConfig(), sink, AdviceBoundary.INSTANCE, config.maxSerializedLength());
        engine = started;

        // Register shutdown hook first so buffered events are flushed even if instrumentation fails
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(started), "flowtrace-shutdown"));

        install(config.filterConfig(), instrumentation);
        started.start();

        System.err.println("[flowtrace] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static void install(FilterConfig filter, Instrumentation instrumentation) {
        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[flowtrace] TRANSFORM ERROR for " + typeName + ": " + throwable);
                }
            })
            .type(TraceableTypes.automatic(filter))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(Advice.to(BoundaryAdvice.class).on(
                    weavable().and(not(explicitlyTraced(typeDescription)))))
            )
            .type(TraceableTypes.notGenerated().and(hasTracedAnnotation()))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(Advice.to(TracedAdvice.class).on(
                    weavable().and(explicitlyTraced(typeDescription))))
            )
            .installOn(instrumentation);
    }

    static ElementMatcher.Junction<MethodDescription> weavable() {
        return isMethod()
            .and(not(isConstructor()))
            .and(not(isAbstract()))
            .and(not(isNative()))
            .and(not(isSynthetic()));
    }

    /**
     * Methods that take {@link TracedAdvice}: annotated {@code @Traced} with {@code enabled = true},
     * or declared in a {@code @Traced} type without opting out.
     */
    static ElementMatcher.Junction<MethodDescription> explicitlyTraced(TypeDescription type) {
        boolean typeTraced = isEnabled(type.getDeclaredAnnotations().ofType(Traced.class), false);
        return new ElementMatcher.Junction.AbstractBase<MethodDescription>() {
            @Override
            public boolean matches(MethodDescription method) {
                return isEnabled(method.getDeclaredAnnotations().ofType(Traced.class), typeTraced);
            }
        };
    }

    /** {@code absent} when not annotated. */
    private static boolean isEnabled(AnnotationDescription.Loadable<Traced> annotation, boolean absent) {
        return annotation == null ? absent : annotation.load().enabled();
    }

    /** Types annotated {@code @Traced} or declaring at least one {@code @Traced} method. */
    static ElementMatcher.Junction<TypeDescription> hasTracedAnnotation() {
        return ElementMatchers.<TypeDescription>isAnnotatedWith(Traced.class)
            .or(declaresMethod(isAnnotatedWith(Traced.class)));
    }
}
