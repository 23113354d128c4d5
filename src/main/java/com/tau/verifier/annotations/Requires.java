package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Precondition of a verified method, in WhyML syntax.
 * Several preconditions are conjoined.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
@Repeatable(Requires.List.class)
public @interface Requires {
    /**
     * The precondition expression. Parameters are referenced by name.
     * @return the WhyML expression
     */
    String value();

    /**
     * Container annotation for multiple @Requires.
     */
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.METHOD)
    @interface List {
        Requires[] value();
    }
}
