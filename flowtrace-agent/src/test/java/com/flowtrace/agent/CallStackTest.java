package com.flowtrace.agent;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CallStackTest {

    private final CallStack stack = new CallStack();

    @Test
    void pushPeekPop() {
        stack.push(new CallStack.CallFrame(1L, "A", "a"));
        stack.push(new CallStack.CallFrame(2L, "B", "b"));
        assertEquals("B", stack.peek().scope());
        assertEquals(2L, stack.pop().entryMicros());
        assertEquals("A", stack.peek().scope());
        stack.pop();
        assertNull(stack.peek());
    }

    @Test
    void popOnEmptyStackReturnsNull() {
        assertNull(stack.pop());
        assertEquals(0, stack.depth());
    }

    @Test
    void threadLocalStacksAreIsolated() throws InterruptedException {
        stack.push(new CallStack.CallFrame(1L, "main-thread-value", "m"));

        AtomicInteger otherDepth = new AtomicInteger(-1);
        Thread other = new Thread(() -> otherDepth.set(stack.depth()));
        other.start();
        other.join();

        assertEquals(0, otherDepth.get(), "Thread should not see main thread's stack");
        assertEquals(1, stack.depth());
        stack.clear();
        assertEquals(0, stack.depth());
    }
}
