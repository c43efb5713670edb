package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.array.BackendCapabilities;
import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.graph.BackwardPropagator;
import io.surfworks.warpgrad.core.graph.GraphBuilder;
import io.surfworks.warpgrad.core.graph.OperationNode;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A recorded, replayable list of operation calls for one static region at one
 * pass depth: 0 for forward, 1 for its backward, 2 for the backward of that.
 *
 * <p>Lifecycle: {@code EMPTY} &rarr; {@link #traceOnce} &rarr; {@code TRACED}
 * &rarr; {@link #build()} &rarr; {@code BUILT}, after which {@link #replay}
 * and {@link #apply} may be called any number of times.
 *
 * <p>While tracing, each operation's array arguments are interned in the
 * shared {@link UniqueArrayTable}. Results that were not seen before are
 * freshly allocated and get a {@link ReturnHook}; results identical to an
 * interned array are aliases and get none. A fresh result the operator
 * retains is written back by in-place copy, so the retained array keeps its
 * identity across replays; other results are written back by reference.
 */
public final class StaticSchedule {

    private static final Logger LOGGER = Logger.getLogger(StaticSchedule.class.getName());

    /**
     * Deepest supported pass: the backward of a backward.
     */
    public static final int MAX_DEPTH = 2;

    public enum State {
        EMPTY,
        TRACING,
        TRACED,
        BUILT
    }

    private final ScheduleManager manager;
    private final int depth;
    private final UniqueArrayTable table;
    private final boolean enableDoubleBackprop;
    private final int verbosity;

    private final List<ScheduleEntry> entries = new ArrayList<>();
    private State state = State.EMPTY;
    private List<Variable> traceInputs;
    private List<Variable> traceOutputs;
    private int[] inputSlots;
    private int[] outputSlots;
    private long replayCount;

    private StaticSchedule backwardSchedule;
    private int[] gradientSources;

    StaticSchedule(ScheduleManager manager, int depth, UniqueArrayTable table,
                   boolean enableDoubleBackprop, int verbosity) {
        this.manager = manager;
        this.depth = depth;
        this.table = table;
        this.enableDoubleBackprop = enableDoubleBackprop;
        this.verbosity = verbosity;
    }

    // ==================== Trace ====================

    /**
     * Runs {@code body} once in define-by-run mode, recording every operation
     * it applies.
     *
     * @param inputs leaves the region is rooted at
     * @return the define-by-run outputs of the body
     * @throws GraphStateException if this schedule was already traced, or a
     *                             static region is already being traced
     */
    public List<Variable> traceOnce(List<Variable> inputs, Function<List<Variable>, List<Variable>> body) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
        if (state != State.EMPTY) {
            throw new GraphStateException("traceOnce() was called on a schedule in state " + state);
        }
        List<Variable> outputs;
        try (ScheduleContext ignored = ScheduleContext.enter(this)) {
            state = State.TRACING;
            outputs = body.apply(Collections.unmodifiableList(inputs));
        } catch (RuntimeException e) {
            state = State.EMPTY;
            entries.clear();
            throw e;
        }
        if (outputs == null || outputs.stream().anyMatch(Objects::isNull)) {
            state = State.EMPTY;
            entries.clear();
            throw new GraphStateException("A static region must not return null outputs");
        }
        this.traceInputs = List.copyOf(inputs);
        this.traceOutputs = List.copyOf(outputs);
        state = State.TRACED;
        return traceOutputs;
    }

    /**
     * Records one operation call. Invoked through the thread's
     * {@link io.surfworks.warpgrad.core.graph.CallRecorder} while tracing.
     */
    void record(OperationNode node, List<NdArray> inputs, List<NdArray> outputs) {
        if (state != State.TRACING) {
            throw new GraphStateException("Schedule is not tracing");
        }
        if (node instanceof ScheduleInvocation) {
            throw new GraphStateException("Not allowed to nest static regions");
        }
        List<ArgumentHook> argumentHooks = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            argumentHooks.add(new ArgumentHook(i, table.intern(inputs.get(i))));
        }
        List<ReturnHook> returnHooks = new ArrayList<>();
        for (int i = 0; i < outputs.size(); i++) {
            NdArray result = outputs.get(i);
            if (table.find(result) >= 0) {
                continue;
            }
            int slot = table.internDynamic(result);
            ReturnHook.WriteBack writeBack = writeBackFor(node, i, result.backend().capabilities());
            returnHooks.add(new ReturnHook(i, slot, writeBack));
        }
        entries.add(new ScheduleEntry(node, argumentHooks, returnHooks));
    }

    /**
     * Outputs the operator retains keep their array identity across replays,
     * so they are copied in place; every other output is rebound.
     *
     * @throws GraphStateException if a retained output lives on a backend that cannot copy in place
     */
    static ReturnHook.WriteBack writeBackFor(OperationNode node, int output, BackendCapabilities capabilities) {
        if (!node.retention().isOutputRetained(output)) {
            return ReturnHook.WriteBack.REFERENCE;
        }
        if (!capabilities.supportsInPlaceCopy()) {
            throw new GraphStateException(node.label() + " retains output " + output
                    + " but its backend cannot copy in place");
        }
        return ReturnHook.WriteBack.IN_PLACE_COPY;
    }

    // ==================== Build ====================

    /**
     * Finalizes the schedule: locates the table slots of the traced inputs and
     * outputs.
     *
     * @throws GraphStateException if the schedule has not been traced
     */
    public void build() {
        if (state != State.TRACED) {
            throw new GraphStateException("build() requires a traced schedule, state is " + state);
        }
        inputSlots = new int[traceInputs.size()];
        for (int i = 0; i < inputSlots.length; i++) {
            inputSlots[i] = table.intern(traceInputs.get(i).array());
        }
        outputSlots = new int[traceOutputs.size()];
        for (int i = 0; i < outputSlots.length; i++) {
            outputSlots[i] = table.intern(traceOutputs.get(i).array());
        }
        state = State.BUILT;
        if (verbosity >= 1) {
            LOGGER.log(Level.INFO, "Built static schedule at depth {0}: {1} calls, {2} unique arrays ({3} dynamic)",
                    new Object[]{depth, entries.size(), table.size(), table.dynamicCount()});
        }
    }

    // ==================== Replay ====================

    /**
     * Runs the recorded calls on new input arrays.
     *
     * @param inputs one array per traced input, same shapes and dtypes
     * @return copies of the output arrays
     * @throws GraphStateException if {@link #build()} has not completed
     */
    public List<NdArray> replay(List<NdArray> inputs) {
        if (state != State.BUILT) {
            throw new GraphStateException("replay() was called before build()");
        }
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (inputs.size() != inputSlots.length) {
            throw new IllegalArgumentException("Schedule expects " + inputSlots.length
                    + " inputs, got " + inputs.size());
        }
        for (int i = 0; i < inputSlots.length; i++) {
            table.set(inputSlots[i], inputs.get(i));
        }
        for (ScheduleEntry entry : entries) {
            entry.run(table);
        }

        List<NdArray> results = new ArrayList<>(outputSlots.length);
        for (int slot : outputSlots) {
            NdArray out = table.get(slot);
            if (out.backend().capabilities().supportsAsync()) {
                out.backend().synchronizeIfNeeded();
            }
            results.add(out.backend().copy(out));
        }
        replayCount++;
        if (verbosity >= 2) {
            LOGGER.log(Level.INFO, "Replayed static schedule at depth {0} ({1} calls, replay #{2})",
                    new Object[]{depth, entries.size(), replayCount});
        }
        return results;
    }

    /**
     * Replays the schedule as a single graph operation over {@code inputs}, so
     * its outputs can be back-propagated.
     */
    public List<Variable> apply(List<Variable> inputs) {
        return GraphBuilder.apply(new ScheduleInvocation(this), inputs);
    }

    // ==================== Backward ====================

    /**
     * Backward of one invocation: builds the contained schedule on first use,
     * then replays it.
     */
    List<Variable> backward(List<Variable> invocationInputs, List<Variable> gradOutputs) {
        manager.endForward();
        if (backwardSchedule == null) {
            traceBackward(gradOutputs);
        }
        List<Variable> result = new ArrayList<>(Collections.nCopies(invocationInputs.size(), null));
        if (gradientSources.length == 0) {
            return result;
        }
        List<Variable> args = new ArrayList<>(gradOutputs.size() + invocationInputs.size());
        args.addAll(gradOutputs);
        args.addAll(invocationInputs);
        List<Variable> grads = backwardSchedule.apply(args);
        for (int k = 0; k < gradientSources.length; k++) {
            result.set(gradientSources[k], grads.get(k));
        }
        return result;
    }

    private void traceBackward(List<Variable> gradOutputs) {
        if (depth + 1 > MAX_DEPTH) {
            throw new GraphStateException("Static schedules support at most " + MAX_DEPTH + " backward passes");
        }
        StaticSchedule contained = new StaticSchedule(manager, depth + 1, table, enableDoubleBackprop, verbosity);
        List<Variable> gyLeaves = new ArrayList<>(gradOutputs.size());
        for (Variable gy : gradOutputs) {
            NdArray array = gy.array();
            gyLeaves.add(new Variable(array.backend().copy(array)));
        }
        List<Variable> containedInputs = new ArrayList<>(gyLeaves);
        containedInputs.addAll(traceInputs);

        List<Integer> sources = new ArrayList<>();
        contained.traceOnce(containedInputs, ignored -> {
            try (ConfigContext backprop = ConfigContext.forceBackprop()) {
                List<Variable> grads = BackwardPropagator.grad(
                        traceOutputs, traceInputs, gyLeaves, null, enableDoubleBackprop);
                List<Variable> present = new ArrayList<>();
                for (int i = 0; i < grads.size(); i++) {
                    if (grads.get(i) != null) {
                        sources.add(i);
                        present.add(grads.get(i));
                    }
                }
                return present;
            }
        });
        contained.build();
        this.gradientSources = sources.stream().mapToInt(Integer::intValue).toArray();
        this.backwardSchedule = contained;

        if (!enableDoubleBackprop) {
            for (Variable out : traceOutputs) {
                out.unchainBackward();
            }
        }
        if (verbosity >= 1) {
            LOGGER.log(Level.INFO, "Created backward schedule at depth {0}", depth + 1);
        }
    }

    // ==================== Accessors ====================

    public State state() {
        return state;
    }

    public boolean isEmpty() {
        return state == State.EMPTY;
    }

    public int depth() {
        return depth;
    }

    public List<ScheduleEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public UniqueArrayTable table() {
        return table;
    }

    /**
     * The contained schedule of the next pass depth, or null before the first
     * backward.
     */
    public StaticSchedule backwardSchedule() {
        return backwardSchedule;
    }

    public long replayCount() {
        return replayCount;
    }

    @Override
    public String toString() {
        return "StaticSchedule[depth=" + depth + ", state=" + state + ", calls=" + entries.size() + "]";
    }
}
