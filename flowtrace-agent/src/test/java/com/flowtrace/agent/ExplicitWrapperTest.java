package com.flowtrace.agent;

import com.flowtrace.fixture.Countable;
import com.flowtrace.fixture.InMemoryRepository;
import com.flowtrace.fixture.Repository;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ExplicitWrapperTest {

    interface Adder {
        int add(int a, int b);
    }

    interface Labeller {
        String label(Object value);
    }

    static class FixedLabeller implements Labeller {
        @Override
        public String label(Object value) {
            return "label";
        }
    }

    static class SimpleAdder implements Adder {
        @Override
        public int add(int a, int b) {
            return a + b;
        }
    }

    private final RecordingSink sink = new RecordingSink();
    private final AtomicLong now = new AtomicLong(100);
    private final ExplicitWrapper wrapper = new ExplicitWrapper(() -> sink, () -> 1000, now::get);

    // --- proxy ---

    @Test
    void proxiedCallLogsNamedArgsAndResult() {
        Adder traced = wrapper.proxy(Adder.class, new SimpleAdder());

        assertEquals(8, traced.add(5, 3));

        assertEquals(List.of(EventKind.ENTER, EventKind.EXIT), sink.kinds());
        TraceEvent enter = sink.get(0);
        assertEquals(SimpleAdder.class.getName(), enter.scope());
        assertEquals("add", enter.name());
        assertEquals(Map.of("a", "5", "b", "3"), enter.args());
        assertEquals("8", sink.get(1).result());
        assertTrue(sink.get(1).durationMicros() >= 0);
    }

    @Test
    void proxiedExceptionIsTheSameInstance() {
        Repository traced = wrapper.proxy(Repository.class, new InMemoryRepository());

        NoSuchElementException thrown = assertThrows(NoSuchElementException.class, () -> traced.find("missing"));

        TraceEvent event = sink.get(1);
        assertEquals(EventKind.EXCEPTION, event.kind());
        assertEquals(NoSuchElementException.class.getName(), event.exceptionKind());
        assertEquals(thrown.getMessage(), event.exceptionMessage());
    }

    @Test
    void voidInterfaceMethodOmitsResult() {
        Repository traced = wrapper.proxy(Repository.class, new InMemoryRepository());
        traced.save("k", "v");

        assertEquals(Map.of("id", "\"k\"", "value", "\"v\""), sink.get(0).args());
        assertNull(sink.get(1).result());
    }

    @Test
    void argumentWithNullToStringStillLogsEnter() {
        Labeller traced = wrapper.proxy(Labeller.class, new FixedLabeller());
        Object blank = new ValueSerializerTest.Blank();

        assertEquals("label", traced.label(blank));

        assertEquals(List.of(EventKind.ENTER, EventKind.EXIT), sink.kinds());
        assertEquals(Map.of("value", "null"), sink.get(0).args());
    }

    @Test
    void proxyImplementsTheTargetsOtherInterfaces() {
        InMemoryRepository target = new InMemoryRepository();
        target.save("k", "v");
        Repository traced = wrapper.proxy(Repository.class, target);

        assertTrue(traced instanceof Countable);
        assertEquals(1, ((Countable) traced).count());
        TraceEvent enter = sink.get(0);
        assertEquals(InMemoryRepository.class.getName(), enter.scope());
        assertEquals("count", enter.name());
        assertEquals("1", sink.get(1).result());
    }

    @Test
    void defaultMethodsAreTraced() {
        Repository traced = wrapper.proxy(Repository.class, new InMemoryRepository());
        assertEquals("repository", traced.describe());
        assertEquals(List.of(EventKind.ENTER, EventKind.EXIT), sink.kinds());
    }

    @Test
    void objectMethodsDelegateUntraced() {
        InMemoryRepository target = new InMemoryRepository();
        Repository traced = wrapper.proxy(Repository.class, target);

        assertEquals(target.toString(), traced.toString());
        assertEquals(target.hashCode(), traced.hashCode());
        assertEquals(traced, traced);
        assertTrue(sink.events().isEmpty());
    }

    @Test
    void wrappingTwiceDoesNotDoubleTrace() {
        Adder once = wrapper.proxy(Adder.class, new SimpleAdder());
        Adder twice = wrapper.proxy(Adder.class, once);

        assertSame(once, twice);
        twice.add(1, 1);
        assertEquals(2, sink.events().size());
    }

    @Test
    void unwrapReturnsTarget() {
        SimpleAdder target = new SimpleAdder();
        assertSame(target, ExplicitWrapper.unwrap(wrapper.proxy(Adder.class, target)));
        assertSame(target, ExplicitWrapper.unwrap(target));
    }

    @Test
    void proxyRequiresInterface() {
        assertThrows(IllegalArgumentException.class, () -> wrapper.proxy(SimpleAdder.class, new SimpleAdder()));
    }

    // --- callable ---

    @Test
    void wrappedCallableKeepsIdentityMetadata() throws Exception {
        Callable<String> body = () -> "done";
        TracedCallable<String> traced = wrapper.wrap("com.myapp.Jobs", "nightly", body);

        assertEquals("com.myapp.Jobs", traced.scope());
        assertEquals("nightly", traced.name());
        assertSame(body, traced.delegate());
        assertEquals("done", traced.call());
        assertEquals("\"done\"", sink.get(1).result());
    }

    @Test
    void wrappedCallableRethrowsSameInstance() {
        Exception failure = new Exception("checked failure");
        TracedCallable<Object> traced = wrapper.wrap("com.myapp.Jobs", "broken", () -> { throw failure; });

        Exception thrown = assertThrows(Exception.class, traced::call);
        assertSame(failure, thrown);
        assertEquals(List.of(EventKind.ENTER, EventKind.EXCEPTION), sink.kinds());
        assertEquals("checked failure", sink.get(1).exceptionMessage());
    }

    // --- invoke ---

    @Test
    void nestedInvocationsAreOrdered() {
        int result = wrapper.invoke("com.myapp.A", "outer", Map.of(), () ->
            wrapper.invoke("com.myapp.B", "inner", Map.of("x", 1), () -> 41) + 1);

        assertEquals(42, result);
        assertEquals(List.of(EventKind.ENTER, EventKind.ENTER, EventKind.EXIT, EventKind.EXIT), sink.kinds());
        assertEquals("outer", sink.get(0).name());
        assertEquals("inner", sink.get(1).name());
        assertEquals("inner", sink.get(2).name());
        assertEquals("outer", sink.get(3).name());
    }

    @Test
    void durationComesFromClock() {
        wrapper.invoke("com.myapp.A", "slow", Map.of(), () -> now.addAndGet(75));
        assertEquals(75L, sink.get(1).durationMicros());
    }

    @Test
    void errorsArePropagatedUnchanged() {
        StackOverflowError error = new StackOverflowError("deep");
        StackOverflowError thrown = assertThrows(StackOverflowError.class,
            () -> wrapper.invoke("com.myapp.A", "recurse", Map.of(), () -> { throw error; }));
        assertSame(error, thrown);
    }

    @Test
    void failingSinkDoesNotBreakTheCall() {
        EventSink broken = new EventSink() {
            @Override public void log(TraceEvent event) { throw new IllegalStateException("sink down"); }
            @Override public void close() { }
        };
        ExplicitWrapper unreliable = new ExplicitWrapper(broken, 100);

        assertEquals(3, unreliable.invoke("com.myapp.A", "ok", Map.of(), () -> 3));
    }

    @Test
    void noFilterIsConsulted() {
        wrapper.invoke("java.util.Internal", "anything", Map.of(), () -> null);
        assertEquals(2, sink.events().size());
    }
}
