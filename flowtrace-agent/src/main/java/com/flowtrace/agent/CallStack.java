package com.flowtrace.agent;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-thread stack of open calls, used to pair each EXIT/EXCEPTION with its ENTER timestamp.
 *
 * Every thread owns its own deque; nothing here is shared across threads or locked.
 */
final class CallStack {

    /** Bookkeeping for one open call. Never written to the log. */
    record CallFrame(long entryMicros, String scope, String name) {}

    private final ThreadLocal<Deque<CallFrame>> frames =
        ThreadLocal.withInitial(ArrayDeque::new);

    void push(CallFrame frame) {
        frames.get().push(frame);
    }

    /** Removes and returns the innermost frame of the current thread, or null if none is open. */
    CallFrame pop() {
        Deque<CallFrame> s = frames.get();
        return s.isEmpty() ? null : s.pop();
    }

    CallFrame peek() {
        return frames.get().peek();
    }

    int depth() {
        return frames.get().size();
    }

    /** Clears the current thread's frames only. */
    void clear() {
        frames.get().clear();
    }
}
