package com.flowtrace.agent;

import com.flowtrace.fixture.Greeter;
import com.flowtrace.fixture.TracedService;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import net.bytebuddy.description.type.TypeDescription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TracedAdviceTest {

    private Path log;

    @BeforeEach
    void init(@TempDir Path tmp) {
        FlowTrace.shutdown();
        log = tmp.resolve("trace.jsonl");
        FlowTrace.init(FlowTraceTest.configFor(log, 1000));
    }

    @AfterEach
    void reset() {
        FlowTrace.shutdown();
    }

    private static Class<?> weave(Class<?> type) {
        return Weaving.weave(type, TracedAdvice.class,
            FlowTraceAgent.weavable().and(FlowTraceAgent.explicitlyTraced(TypeDescription.ForLoadedType.of(type))));
    }

    private List<JsonObject> lines() throws Exception {
        FlowTrace.shutdown();
        return Files.readAllLines(log).stream()
            .map(line -> JsonParser.parseString(line).getAsJsonObject())
            .collect(Collectors.toList());
    }

    @Test
    void annotatedMethodIsTraced() throws Throwable {
        Object greeter = Weaving.newInstance(weave(Greeter.class));

        assertEquals("Hello, Ada", Weaving.call(greeter, "greet", new Class<?>[]{ String.class }, "Ada"));
        assertEquals("plain", Weaving.call(greeter, "plain", new Class<?>[]{}));

        List<JsonObject> events = lines();
        assertEquals(2, events.size(), "plain() is not annotated");
        assertEquals("ENTER", events.get(0).get("kind").getAsString());
        assertEquals(Greeter.class.getName(), events.get(0).get("scope").getAsString());
        assertEquals("\"Hello, Ada\"", events.get(1).get("result").getAsString());
    }

    @Test
    void annotatedMethodExceptionPropagates() throws Throwable {
        Object greeter = Weaving.newInstance(weave(Greeter.class));

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
            () -> Weaving.call(greeter, "fail", new Class<?>[]{ String.class }, "nope"));
        assertEquals("nope", thrown.getMessage());

        List<JsonObject> events = lines();
        assertEquals("EXCEPTION", events.get(1).get("kind").getAsString());
        assertEquals("nope", events.get(1).get("exceptionMessage").getAsString());
    }

    @Test
    void annotatedTypeTracesAllMethodsExceptOptOuts() throws Throwable {
        Object service = Weaving.newInstance(weave(TracedService.class));

        assertEquals(4, Weaving.call(service, "twice", new Class<?>[]{ int.class }, 2));
        assertEquals(5, Weaving.call(service, "quiet", new Class<?>[]{ int.class }, 5));

        List<JsonObject> events = lines();
        assertEquals(2, events.size());
        assertEquals("twice", events.get(0).get("name").getAsString());
    }
}
