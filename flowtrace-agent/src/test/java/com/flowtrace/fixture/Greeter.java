package com.flowtrace.fixture;

import com.flowtrace.agent.annotation.Traced;

public class Greeter {

    @Traced("greeting entry point")
    public String greet(String name) {
        return "Hello, " + name;
    }

    @Traced
    public void fail(String reason) {
        throw new IllegalArgumentException(reason);
    }

    public String plain() {
        return "plain";
    }
}
