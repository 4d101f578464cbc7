package com.flowtrace.agent.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks methods (or every method of a type) for explicit tracing.
 *
 * With the agent attached, annotated methods are woven with {@code TracedAdvice} regardless of the
 * configured package filter. Source tooling that inserts the annotation only relies on it existing.
 *
 * <pre>{@code
 * public class OrderService {
 *     @Traced("checkout entry point")
 *     public Order placeOrder(Cart cart) { ... }
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Traced {

    /** Optional free-form description for readers of the source. */
    String value() default "";

    /** {@code false} on a method opts it out of a {@code @Traced} type. */
    boolean enabled() default true;
}
