package com.tau.verifier.visitor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-function translation state.
 *
 * Holds the names that may be called and the names currently bound as mutable
 * reference cells. The ref-cell set only grows; once a name is a ref-cell every later
 * read dereferences it and every later write stores into it. A context must not be
 * shared between functions.
 */
public class TranslationContext {

    private final Set<String> knownFunctions;
    private final Set<String> externalFunctions;
    private final Set<String> refCells = new LinkedHashSet<>();
    private boolean loopSeen = false;

    public TranslationContext(Set<String> knownFunctions, Set<String> externalFunctions) {
        this.knownFunctions = knownFunctions == null ? Collections.emptySet() : Set.copyOf(knownFunctions);
        this.externalFunctions = externalFunctions == null ? Collections.emptySet() : Set.copyOf(externalFunctions);
    }

    public TranslationContext() {
        this(Collections.emptySet(), Collections.emptySet());
    }

    public boolean isCallable(String name) {
        return knownFunctions.contains(name) || externalFunctions.contains(name);
    }

    public boolean isRefCell(String name) {
        return refCells.contains(name);
    }

    /**
     * Binds a name as a reference cell.
     *
     * @return true if the name was not a ref-cell before
     */
    public boolean addRefCell(String name) {
        return refCells.add(name);
    }

    public Set<String> getRefCells() {
        return Collections.unmodifiableSet(refCells);
    }

    /**
     * Records that the function's loop has been translated.
     *
     * @throws MultipleLoopsUnsupportedException if a loop was already seen
     */
    public void enterLoop() {
        if (loopSeen) {
            throw new MultipleLoopsUnsupportedException();
        }
        loopSeen = true;
    }

    public boolean isLoopSeen() {
        return loopSeen;
    }
}
