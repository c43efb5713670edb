package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiler for a static region: a closure whose graph structure does not
 * change between calls with inputs of the same shapes and dtypes.
 *
 * <p>{@link #call} traces the closure the first time a key is seen, builds
 * the schedule and replays it; later calls only replay. The individual steps
 * are also exposed: {@link #traceOnce} returns a traced schedule, on which
 * {@link StaticSchedule#build()} and {@link StaticSchedule#replay} can be
 * called directly.
 *
 * <pre>{@code
 * StaticGraph mlp = StaticGraph.builder(in -> List.of(Ops.tanh(Ops.linear(in.get(0), w, b))))
 *         .parameters(w, b)
 *         .build();
 * for (Variable batch : batches) {
 *     Variable loss = Ops.sum(mlp.call(batch).get(0));
 *     loss.backward();
 * }
 * }</pre>
 *
 * <p>Parameters are implicit extra inputs of every invocation. Their current
 * arrays are bound on each replay, and their gradients flow back through the
 * ordinary backward pass.
 */
public final class StaticGraph {

    private static final Logger LOGGER = Logger.getLogger(StaticGraph.class.getName());

    private final Function<List<Variable>, List<Variable>> body;
    private final List<Variable> parameters;
    private final ScheduleManager manager;
    private final boolean forceEvaluationDefineByRun;
    private final int verbosity;

    private StaticGraph(Builder builder) {
        this.body = builder.body;
        this.parameters = List.copyOf(builder.parameters);
        this.manager = new ScheduleManager(builder.minimizeCacheSize, builder.enableDoubleBackprop, builder.verbosity);
        this.forceEvaluationDefineByRun = builder.forceEvaluationDefineByRun;
        this.verbosity = builder.verbosity;
    }

    public static Builder builder(Function<List<Variable>, List<Variable>> body) {
        return new Builder(body);
    }

    public List<Variable> call(Variable... inputs) {
        return call(Arrays.asList(inputs));
    }

    /**
     * Runs the region on {@code inputs}.
     *
     * @throws GraphStateException if called while another static region is being traced
     */
    public List<Variable> call(List<Variable> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (ScheduleContext.isActive()) {
            throw new GraphStateException("Not allowed to nest static regions");
        }
        if (forceEvaluationDefineByRun && !ConfigContext.current().train()) {
            return body.apply(inputs);
        }
        StaticSchedule schedule = manager.acquire(inputs);
        if (schedule.isEmpty()) {
            if (verbosity >= 2) {
                LOGGER.log(Level.INFO, "First call for this key, running define-by-run code");
            }
            trace(schedule, inputs);
            schedule.build();
        }
        return schedule.apply(withParameters(inputs));
    }

    /**
     * Acquires a schedule for {@code inputs} and traces the region into it,
     * without building. The returned schedule expects the input arrays
     * followed by the parameter arrays.
     *
     * @throws GraphStateException if the acquired schedule was already traced
     */
    public StaticSchedule traceOnce(List<Variable> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        StaticSchedule schedule = manager.acquire(inputs);
        trace(schedule, inputs);
        return schedule;
    }

    private void trace(StaticSchedule schedule, List<Variable> inputs) {
        List<Variable> leaves = new ArrayList<>(inputs.size() + parameters.size());
        for (Variable input : inputs) {
            leaves.add(new Variable(input.array(), input.requiresGrad()));
        }
        leaves.addAll(parameters);
        int count = inputs.size();
        List<Variable> outputs = schedule.traceOnce(leaves, all -> body.apply(all.subList(0, count)));
        if (outputs.isEmpty()) {
            throw new GraphStateException("A static region must return at least one output");
        }
    }

    private List<Variable> withParameters(List<Variable> inputs) {
        List<Variable> all = new ArrayList<>(inputs.size() + parameters.size());
        all.addAll(inputs);
        all.addAll(parameters);
        return all;
    }

    public ScheduleManager manager() {
        return manager;
    }

    public List<Variable> parameters() {
        return parameters;
    }

    /**
     * Builder for {@link StaticGraph}.
     */
    public static final class Builder {
        private final Function<List<Variable>, List<Variable>> body;
        private final List<Variable> parameters = new ArrayList<>();
        private boolean enableDoubleBackprop;
        private boolean minimizeCacheSize = true;
        private boolean forceEvaluationDefineByRun;
        private int verbosity;

        private Builder(Function<List<Variable>, List<Variable>> body) {
            this.body = Objects.requireNonNull(body, "body cannot be null");
        }

        /**
         * Variables the region reads besides its inputs, typically weights.
         */
        public Builder parameters(Variable... params) {
            for (Variable p : params) {
                parameters.add(Objects.requireNonNull(p, "parameter cannot be null"));
            }
            return this;
        }

        public Builder parameters(List<Variable> params) {
            return parameters(params.toArray(new Variable[0]));
        }

        /**
         * Keep the backward graph so the gradients of a replay can be
         * differentiated again.
         */
        public Builder enableDoubleBackprop(boolean enable) {
            this.enableDoubleBackprop = enable;
            return this;
        }

        /**
         * Drop all cached schedules whenever the training flag changes.
         */
        public Builder minimizeCacheSize(boolean minimize) {
            this.minimizeCacheSize = minimize;
            return this;
        }

        /**
         * In evaluation mode, skip schedules and run the closure directly.
         */
        public Builder forceEvaluationDefineByRun(boolean force) {
            this.forceEvaluationDefineByRun = force;
            return this;
        }

        /**
         * 0 silent, 1 logs schedule creation, 2 also logs every replay.
         */
        public Builder verbosity(int level) {
            if (level < 0 || level > 2) {
                throw new IllegalArgumentException("verbosity must be 0, 1 or 2, got " + level);
            }
            this.verbosity = level;
            return this;
        }

        public StaticGraph build() {
            return new StaticGraph(this);
        }
    }
}
