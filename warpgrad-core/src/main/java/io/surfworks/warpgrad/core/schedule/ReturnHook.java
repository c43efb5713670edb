package io.surfworks.warpgrad.core.schedule;

import java.util.Objects;

/**
 * After a recorded call runs, result {@code position} is written into table
 * slot {@code slot}.
 */
public record ReturnHook(int position, int slot, WriteBack writeBack) {

    /**
     * How a dynamically allocated result reaches its slot.
     */
    public enum WriteBack {
        /** The slot is pointed at the new result array. */
        REFERENCE,
        /**
         * The new result is copied into the array already in the slot, whose
         * identity is kept. Used for outputs the producing operator retains.
         */
        IN_PLACE_COPY
    }

    public ReturnHook {
        Objects.requireNonNull(writeBack, "writeBack cannot be null");
    }
}
