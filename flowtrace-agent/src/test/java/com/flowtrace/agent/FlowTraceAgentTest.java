package com.flowtrace.agent;

import com.flowtrace.fixture.Calculator;
import com.flowtrace.fixture.Greeter;
import com.flowtrace.fixture.TracedService;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.bytebuddy.matcher.ElementMatchers.named;
import static org.junit.jupiter.api.Assertions.*;

class FlowTraceAgentTest {

    private static MethodDescription method(Class<?> type, String name) {
        return TypeDescription.ForLoadedType.of(type).getDeclaredMethods().filter(named(name)).getOnly();
    }

    @Test
    void typeMatcherFollowsScopeFilter() {
        FilterConfig config = FilterConfig.of(List.of("com.flowtrace.fixture"), List.of());
        ElementMatcher<TypeDescription> matcher = TraceableTypes.automatic(config);

        assertTrue(matcher.matches(TypeDescription.ForLoadedType.of(Calculator.class)));
        assertFalse(matcher.matches(TypeDescription.ForLoadedType.of(String.class)));
        assertFalse(matcher.matches(TypeDescription.ForLoadedType.of(InterceptionEngine.class)));
    }

    @Test
    void generatedClassesAreNeverWoven() {
        Runnable lambda = () -> { };
        assertFalse(TraceableTypes.notGenerated().matches(TypeDescription.ForLoadedType.of(lambda.getClass())));
        assertTrue(TraceableTypes.notGenerated().matches(TypeDescription.ForLoadedType.of(Calculator.class)));
    }

    @Test
    void weavableSkipsConstructorsAndAbstractMethods() {
        TypeDescription calc = TypeDescription.ForLoadedType.of(Calculator.class);
        assertTrue(FlowTraceAgent.weavable().matches(method(Calculator.class, "add")));
        assertFalse(FlowTraceAgent.weavable().matches(calc.getDeclaredMethods().filter(
            net.bytebuddy.matcher.ElementMatchers.isConstructor()).getOnly()));
        assertFalse(FlowTraceAgent.weavable().matches(method(Runnable.class, "run")));
    }

    @Test
    void explicitlyTracedHonoursMethodAndTypeAnnotations() {
        TypeDescription greeter = TypeDescription.ForLoadedType.of(Greeter.class);
        assertTrue(FlowTraceAgent.explicitlyTraced(greeter).matches(method(Greeter.class, "greet")));
        assertFalse(FlowTraceAgent.explicitlyTraced(greeter).matches(method(Greeter.class, "plain")));

        TypeDescription service = TypeDescription.ForLoadedType.of(TracedService.class);
        assertTrue(FlowTraceAgent.explicitlyTraced(service).matches(method(TracedService.class, "twice")));
        assertFalse(FlowTraceAgent.explicitlyTraced(service).matches(method(TracedService.class, "quiet")));
    }

    @Test
    void tracedTypeMatcherFindsAnnotatedTypes() {
        assertTrue(FlowTraceAgent.hasTracedAnnotation().matches(TypeDescription.ForLoadedType.of(Greeter.class)));
        assertTrue(FlowTraceAgent.hasTracedAnnotation().matches(TypeDescription.ForLoadedType.of(TracedService.class)));
        assertFalse(FlowTraceAgent.hasTracedAnnotation().matches(TypeDescription.ForLoadedType.of(Calculator.class)));
    }
}
