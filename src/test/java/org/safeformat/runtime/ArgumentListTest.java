package org.safeformat.runtime;

import org.junit.jupiter.api.Test;
import org.safeformat.Configuration;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentListTest {

    @Test
    void testKeepsInsertionOrderAcrossSpill() {
        ArgumentList list = new ArgumentList();
        int count = Configuration.inlineArgumentCount * 2 + 5;
        for (int i = 0; i < count; i++) {
            list.add(FormatArgument.ofInt(i));
        }
        assertEquals(count, list.size());
        for (int i = 0; i < count; i++) {
            assertEquals(i, list.get(i).getLong());
        }
    }

    @Test
    void testSpillsOnlyPastInlineSlots() {
        ArgumentList list = new ArgumentList();
        for (int i = 0; i < Configuration.inlineArgumentCount; i++) {
            list.add(FormatArgument.ofInt(i));
        }
        assertFalse(list.isSpilled());
        list.add(FormatArgument.ofInt(-1));
        assertTrue(list.isSpilled());
    }

    @Test
    void testFrozenListRejectsArguments() {
        ArgumentList list = new ArgumentList();
        list.add(FormatArgument.ofInt(1));
        list.freeze();
        assertTrue(list.isFrozen());
        assertThrows(IllegalStateException.class, () -> list.add(FormatArgument.ofInt(2)));
    }

    @Test
    void testClearEmptiesAndUnfreezes() {
        ArgumentList list = new ArgumentList();
        for (int i = 0; i < 12; i++) {
            list.add(FormatArgument.ofInt(i));
        }
        list.freeze();
        list.clear();
        assertEquals(0, list.size());
        assertFalse(list.isFrozen());
        assertFalse(list.isSpilled());
        list.add(FormatArgument.ofText("x"));
        assertEquals(ArgumentType.TEXT, list.get(0).getType());
    }

    @Test
    void testGetOutOfRange() {
        ArgumentList list = new ArgumentList();
        list.add(FormatArgument.ofInt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.get(1));
    }
}
