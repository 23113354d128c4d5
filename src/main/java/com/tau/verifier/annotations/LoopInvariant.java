package com.tau.verifier.annotations;

import java.lang.annotation.*;

/**
 * Invariant of the method's loop, in WhyML syntax.
 * Invariants are emitted in declaration order.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
@Repeatable(LoopInvariant.List.class)
public @interface LoopInvariant {
    /**
     * The invariant expression. Local variables are dereferenced ({@code !i}), parameters are not.
     * @return the WhyML expression
     */
    String value();

    /**
     * Container annotation for multiple @LoopInvariant.
     */
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.METHOD)
    @interface List {
        LoopInvariant[] value();
    }
}
