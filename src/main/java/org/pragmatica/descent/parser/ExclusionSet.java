package org.pragmatica.descent.parser;

import java.util.BitSet;

/**
 * Body ids of the productions that may not be selected at the current position.
 *
 * <p>A fresh set is created per parse and copied one nonterminal call at a time; it is
 * never shared between parses. Consuming a terminal or the end of input clears it.
 */
final class ExclusionSet {
    private final BitSet bodyIds;

    private ExclusionSet(BitSet bodyIds) {
        this.bodyIds = bodyIds;
    }

    static ExclusionSet empty() {
        return new ExclusionSet(new BitSet());
    }

    ExclusionSet copy() {
        return new ExclusionSet((BitSet) bodyIds.clone());
    }

    void exclude(int bodyId) {
        bodyIds.set(bodyId);
    }

    boolean isExcluded(int bodyId) {
        return bodyIds.get(bodyId);
    }

    void clear() {
        bodyIds.clear();
    }

    boolean isEmpty() {
        return bodyIds.isEmpty();
    }

    @Override
    public String toString() {
        return bodyIds.toString();
    }
}
