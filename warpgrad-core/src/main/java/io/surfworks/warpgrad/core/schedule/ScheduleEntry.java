package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One recorded operation call with its argument and return hooks.
 */
public final class ScheduleEntry {

    private final OperationNode node;
    private final List<ArgumentHook> argumentHooks;
    private final List<ReturnHook> returnHooks;

    ScheduleEntry(OperationNode node, List<ArgumentHook> argumentHooks, List<ReturnHook> returnHooks) {
        this.node = node;
        this.argumentHooks = List.copyOf(argumentHooks);
        this.returnHooks = List.copyOf(returnHooks);
    }

    /**
     * Reads arguments from their slots, calls the operation and writes fresh
     * results back.
     */
    void run(UniqueArrayTable table) {
        List<NdArray> args = new ArrayList<>(argumentHooks.size());
        for (ArgumentHook hook : argumentHooks) {
            args.add(table.get(hook.slot()));
        }
        List<NdArray> results = node.forward(args);
        for (ReturnHook hook : returnHooks) {
            NdArray result = results.get(hook.position());
            if (hook.writeBack() == ReturnHook.WriteBack.IN_PLACE_COPY) {
                table.copyInto(hook.slot(), result);
            } else {
                table.set(hook.slot(), result);
            }
        }
    }

    public OperationNode node() {
        return node;
    }

    public List<ArgumentHook> argumentHooks() {
        return argumentHooks;
    }

    public List<ReturnHook> returnHooks() {
        return returnHooks;
    }

    @Override
    public String toString() {
        return node.label() + "(args=" + argumentHooks + ", returns=" + returnHooks + ")";
    }
}
