package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.array.NdArray;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arrays referenced by a schedule, deduplicated by identity and addressed by
 * slot. Shared by the forward schedule and the backward schedules contained
 * in it.
 *
 * <p>The identity index describes arrays as they were while tracing. Replays
 * only read and write slots.
 */
public final class UniqueArrayTable {

    private final Map<NdArray, Integer> traced = new IdentityHashMap<>();
    private final List<NdArray> slots = new ArrayList<>();
    private final BitSet dynamic = new BitSet();

    /**
     * Slot of {@code array}, creating one if it has not been seen.
     */
    public int intern(NdArray array) {
        Integer slot = traced.get(array);
        if (slot != null) {
            return slot;
        }
        int created = slots.size();
        slots.add(array);
        traced.put(array, created);
        return created;
    }

    /**
     * Creates a slot for a freshly allocated result.
     */
    public int internDynamic(NdArray array) {
        int slot = intern(array);
        dynamic.set(slot);
        return slot;
    }

    /**
     * Slot of a traced array, or -1.
     */
    public int find(NdArray array) {
        Integer slot = traced.get(array);
        return slot == null ? -1 : slot;
    }

    public NdArray get(int slot) {
        return slots.get(slot);
    }

    public void set(int slot, NdArray array) {
        slots.set(slot, array);
    }

    /**
     * Overwrites the contents of the array in {@code slot} with {@code source}.
     */
    public void copyInto(int slot, NdArray source) {
        NdArray destination = slots.get(slot);
        destination.backend().copyTo(destination, source);
    }

    public boolean isDynamic(int slot) {
        return dynamic.get(slot);
    }

    public int size() {
        return slots.size();
    }

    public int dynamicCount() {
        return dynamic.cardinality();
    }

    @Override
    public String toString() {
        return "UniqueArrayTable[size=" + slots.size() + ", dynamic=" + dynamic.cardinality() + "]";
    }
}
