package org.pragmatica.veq.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    @Test
    void length_countsCoveredColumns() {
        assertEquals(3, SourceSpan.of(2, 5).length());
    }

    @Test
    void at_isEmpty() {
        assertEquals(0, SourceSpan.at(7).length());
        assertEquals("7-7", SourceSpan.at(7).toString());
    }
}
