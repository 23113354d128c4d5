package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Marks a method for formal verification against its {@link Requires} and {@link Ensures}.
 * When no {@link LoopInvariant} or {@link Variant} is given, the loop contract is discovered automatically.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface Safe {
}
