package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Postcondition of a verified method, in WhyML syntax.
 * Several postconditions are conjoined.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
@Repeatable(Ensures.List.class)
public @interface Ensures {
    /**
     * The postcondition expression. The return value is {@code result}.
     * @return the WhyML expression
     */
    String value();

    /**
     * Container annotation for multiple @Ensures.
     */
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.METHOD)
    @interface List {
        Ensures[] value();
    }
}
