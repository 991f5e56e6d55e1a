package org.pragmatica.descent.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionSetTest {

    @Test
    void copy_isIndependentOfOriginal() {
        var original = ExclusionSet.empty();
        original.exclude(1);

        var derived = original.copy();
        derived.exclude(4);
        original.clear();

        assertTrue(original.isEmpty());
        assertTrue(derived.isExcluded(1));
        assertTrue(derived.isExcluded(4));
        assertFalse(derived.isExcluded(2));
    }
}
