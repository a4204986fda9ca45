package org.safeformat.runtime;

import org.safeformat.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The ordered arguments of one formatting call.
 * <p>
 * The first {@link Configuration#inlineArgumentCount} arguments live in a
 * fixed array; later ones spill into a growable list. Spilling only saves
 * allocations for the common case and is invisible to callers.
 * <p>
 * The list is frozen before the template is rendered against it; adding to a
 * frozen list fails.
 */
public final class ArgumentList {

    private final FormatArgument[] inline = new FormatArgument[Configuration.inlineArgumentCount];
    private List<FormatArgument> spilled;
    private int size;
    private boolean frozen;

    public void add(FormatArgument argument) {
        Objects.requireNonNull(argument, "argument");
        if (frozen) {
            throw new IllegalStateException("arguments cannot be added after formatting has started");
        }
        if (size < inline.length) {
            inline[size] = argument;
        } else {
            if (spilled == null) {
                spilled = new ArrayList<>();
            }
            spilled.add(argument);
        }
        size++;
    }

    public FormatArgument get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("argument index " + index + " out of bounds for " + size);
        }
        return index < inline.length ? inline[index] : spilled.get(index - inline.length);
    }

    public int size() {
        return size;
    }

    /**
     * Returns true once arguments no longer fit in the inline slots.
     */
    public boolean isSpilled() {
        return spilled != null;
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Empties and unfreezes the list so it can serve the next formatting call.
     */
    public void clear() {
        Arrays.fill(inline, null);
        spilled = null;
        size = 0;
        frozen = false;
    }
}
