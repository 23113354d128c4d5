package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Termination measure of the method's loop, in WhyML syntax.
 * Must be a non-negative integer expression that decreases on every iteration.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface Variant {
    String value();
}
