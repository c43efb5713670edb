package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.List;

/**
 * Graph node standing for one replay of a {@link StaticSchedule}. Its forward
 * runs the recorded calls; its backward runs the contained backward schedule.
 */
final class ScheduleInvocation extends OperationNode {

    private final StaticSchedule schedule;

    ScheduleInvocation(StaticSchedule schedule) {
        this.schedule = schedule;
    }

    @Override
    public String label() {
        return "StaticSchedule(depth=" + schedule.depth() + ")";
    }

    @Override
    public List<NdArray> forward(List<NdArray> inputs) {
        return schedule.replay(inputs);
    }

    @Override
    public List<Variable> backward(int[] targetInputIndexes, List<Variable> gradOutputs) {
        return schedule.backward(inputs(), gradOutputs);
    }
}
