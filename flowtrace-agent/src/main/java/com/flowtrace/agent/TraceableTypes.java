package com.flowtrace.agent;

import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;

import static net.bytebuddy.matcher.ElementMatchers.nameContains;
import static net.bytebuddy.matcher.ElementMatchers.not;

/**
 * Type matchers deciding which loaded classes the agent weaves.
 */
final class TraceableTypes {

    private TraceableTypes() {}

    /** Proxies, lambdas and other generated classes whose methods are never user code. */
    static ElementMatcher.Junction<TypeDescription> notGenerated() {
        return not(nameContains("$$Lambda"))
            .and(not(nameContains("$Proxy")))
            .and(not(nameContains("CGLIB")))
            .and(not(nameContains("$$EnhancerBySpring")))
            .and(not(nameContains("$ByteBuddy$")))
            .and(not(nameContains("$auxiliary$")));
    }

    /** Types the automatic engine should weave: accepted by {@link ScopeFilter}, not generated. */
    static ElementMatcher.Junction<TypeDescription> automatic(FilterConfig filter) {
        return notGenerated().and(new ScopeMatcher(filter));
    }

    static final class ScopeMatcher extends ElementMatcher.Junction.AbstractBase<TypeDescription> {

        private final FilterConfig filter;

        ScopeMatcher(FilterConfig filter) {
            this.filter = filter;
        }

        @Override
        public boolean matches(TypeDescription target) {
            return !target.isInterface() && ScopeFilter.shouldTrace(target.getName(), filter);
        }
    }
}
