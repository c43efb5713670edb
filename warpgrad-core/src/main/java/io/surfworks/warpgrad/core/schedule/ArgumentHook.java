package io.surfworks.warpgrad.core.schedule;

/**
 * Before a recorded call runs, argument {@code position} is read from table
 * slot {@code slot}.
 */
public record ArgumentHook(int position, int slot) {
}
