package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Marks a method for verification with oracle-suggested pre- and postconditions.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface SafeAuto {
}
