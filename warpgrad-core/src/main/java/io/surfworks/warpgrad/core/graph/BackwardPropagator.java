package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.array.TensorSpec;
import io.surfworks.warpgrad.core.config.AutogradConfig;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.error.GradientContractException;
import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.error.NaNPolicy;
import io.surfworks.warpgrad.core.error.NumericalGuard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reverse-mode gradient computation over the graph of {@link Variable}s and
 * {@link OperationNode}s.
 *
 * <p>Nodes are processed from a priority queue ordered by descending rank,
 * first-in first-out among equal ranks. A node is enqueued only once every
 * consumer of its outputs that lies on a path to a target has contributed,
 * so each node's backward runs exactly once with fully accumulated output
 * gradients.
 *
 * <p>Two entry points:
 * <ul>
 *   <li>{@link #backward}: accumulates into {@code grad} of every leaf that
 *       requires a gradient</li>
 *   <li>{@link #grad}: returns gradients of chosen inputs without touching
 *       any {@code grad} field</li>
 * </ul>
 *
 * <p>With double backprop enabled, backward formulas run with graph
 * construction on, so returned gradients are differentiable. The propagator is
 * re-entrant: a backward formula may itself call it.
 */
public final class BackwardPropagator {

    private static final Logger LOGGER = Logger.getLogger(BackwardPropagator.class.getName());

    private BackwardPropagator() {
    }

    // ==================== Entry points ====================

    /**
     * Back-propagates from a single output. The seed is the output's current
     * gradient, or ones for a single-element output.
     *
     * @throws IllegalArgumentException if no seed is set and the output has more than one element
     */
    public static void backward(Variable output, boolean retainGrad, boolean enableDoubleBackprop) {
        Objects.requireNonNull(output, "output cannot be null");
        backward(List.of(output), null, retainGrad, enableDoubleBackprop);
    }

    /**
     * Back-propagates from several outputs at once.
     *
     * @param seedGrads one seed per output, or null to use each output's
     *                  current gradient (ones for single-element outputs)
     */
    public static void backward(List<Variable> outputs, List<Variable> seedGrads,
                                boolean retainGrad, boolean enableDoubleBackprop) {
        Objects.requireNonNull(outputs, "outputs cannot be null");
        List<Variable> seeds = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            Variable y = outputs.get(i);
            Variable seed = seedGrads != null ? seedGrads.get(i) : null;
            if (seed == null) {
                seed = y.grad() != null ? y.grad() : defaultSeed(y);
            }
            y.setGrad(seed);
            seeds.add(seed);
        }

        Propagation run = new Propagation(enableDoubleBackprop, retainGrad, null);
        run.execute(outputs, seeds);

        try (ConfigContext ignored = ConfigContext.using(c -> c.withEnableBackprop(enableDoubleBackprop))) {
            for (Map.Entry<Variable, Variable> e : run.leafGrads().entrySet()) {
                Variable leaf = e.getKey();
                leaf.setGrad(GradientAccumulator.add(leaf.grad(), e.getValue()));
            }
        }
    }

    /**
     * Gradients of {@code outputs} with respect to {@code inputs}.
     *
     * @param gradOutputs seeds, one per output; null entries default to ones for
     *                    single-element outputs
     * @param gradInputs  initial gradients added to the result, or null
     * @return one gradient per input, null where the input is not reached
     */
    public static List<Variable> grad(List<Variable> outputs, List<Variable> inputs,
                                      List<Variable> gradOutputs, List<Variable> gradInputs,
                                      boolean enableDoubleBackprop) {
        Objects.requireNonNull(outputs, "outputs cannot be null");
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (gradOutputs != null && gradOutputs.size() != outputs.size()) {
            throw new IllegalArgumentException("gradOutputs has " + gradOutputs.size()
                    + " entries for " + outputs.size() + " outputs");
        }
        if (gradInputs != null && gradInputs.size() != inputs.size()) {
            throw new IllegalArgumentException("gradInputs has " + gradInputs.size()
                    + " entries for " + inputs.size() + " inputs");
        }
        List<Variable> seeds = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            Variable seed = gradOutputs != null ? gradOutputs.get(i) : null;
            seeds.add(seed != null ? seed : defaultSeed(outputs.get(i)));
        }

        Set<Variable> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(inputs);
        Propagation run = new Propagation(enableDoubleBackprop, false, targets);
        run.execute(outputs, seeds);

        List<Variable> result = new ArrayList<>(inputs.size());
        try (ConfigContext ignored = ConfigContext.using(c -> c.withEnableBackprop(enableDoubleBackprop))) {
            for (int i = 0; i < inputs.size(); i++) {
                Variable g = run.gradOf(inputs.get(i));
                if (gradInputs != null) {
                    g = GradientAccumulator.add(gradInputs.get(i), g);
                }
                result.add(g);
            }
        }
        return result;
    }

    public static List<Variable> grad(List<Variable> outputs, List<Variable> inputs) {
        return grad(outputs, inputs, null, null, false);
    }

    private static Variable defaultSeed(Variable y) {
        NdArray array = y.array();
        if (array == null) {
            throw new GraphStateException("Cannot back-propagate from a variable without an array");
        }
        if (array.size() != 1) {
            throw new IllegalArgumentException("A seed gradient is required for a non-scalar output of shape "
                    + Arrays.toString(array.spec().shape()));
        }
        return new Variable(array.backend().onesLike(array));
    }

    // ==================== Propagation ====================

    private record QueueEntry(OperationNode node, long sequence) {
    }

    private static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt((QueueEntry e) -> -e.node().rank())
            .thenComparingLong(QueueEntry::sequence);

    /**
     * State of one backward pass.
     */
    private static final class Propagation {

        private final boolean enableDoubleBackprop;
        private final boolean retainGrad;
        private final Set<Variable> targets;
        private final AutogradConfig config = ConfigContext.current();

        private final Map<Variable, Variable> grads = new IdentityHashMap<>();
        private final Map<OperationNode, Boolean> relevant = new IdentityHashMap<>();
        private final Map<OperationNode, Integer> pending = new IdentityHashMap<>();
        private final Set<Variable> seeded = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<OperationNode> enqueued = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<Variable, Variable> leafGrads = new IdentityHashMap<>();
        private final PriorityQueue<QueueEntry> queue = new PriorityQueue<>(ORDER);
        private long sequence;

        Propagation(boolean enableDoubleBackprop, boolean retainGrad, Set<Variable> targets) {
            this.enableDoubleBackprop = enableDoubleBackprop;
            this.retainGrad = retainGrad;
            this.targets = targets;
        }

        void execute(List<Variable> outputs, List<Variable> seeds) {
            for (int i = 0; i < outputs.size(); i++) {
                Variable y = outputs.get(i);
                if (y.array() == null) {
                    throw new GraphStateException("Cannot back-propagate from a variable without an array");
                }
                seeded.add(y);
                accumulate(y, seeds.get(i), true);
            }

            List<OperationNode> nodes = discover(outputs);
            markRelevant(nodes);
            countPending(nodes);

            for (Variable y : outputs) {
                OperationNode creator = y.creator();
                if (creator != null && isRelevant(creator) && pending.getOrDefault(creator, 0) == 0) {
                    enqueue(creator);
                }
            }

            while (!queue.isEmpty()) {
                process(queue.poll().node());
            }
        }

        Variable gradOf(Variable input) {
            return grads.get(input);
        }

        Map<Variable, Variable> leafGrads() {
            return leafGrads;
        }

        // ---------- discovery ----------

        private List<OperationNode> discover(List<Variable> outputs) {
            Set<OperationNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            Deque<OperationNode> stack = new ArrayDeque<>();
            List<OperationNode> found = new ArrayList<>();
            for (Variable y : outputs) {
                OperationNode creator = y.creator();
                if (creator != null && seen.add(creator)) {
                    stack.push(creator);
                }
            }
            while (!stack.isEmpty()) {
                OperationNode node = stack.pop();
                if (node.isUnchained()) {
                    throw new GraphStateException(node.label() + " has been unchained and cannot be back-propagated");
                }
                found.add(node);
                for (Variable input : node.inputs()) {
                    OperationNode upstream = input.creator();
                    if (upstream == null) {
                        continue;
                    }
                    if (upstream.rank() >= node.rank()) {
                        throw new GraphStateException("Rank invariant violated: " + upstream.label()
                                + " (rank " + upstream.rank() + ") feeds " + node.label()
                                + " (rank " + node.rank() + ")");
                    }
                    if (seen.add(upstream)) {
                        stack.push(upstream);
                    }
                }
            }
            found.sort(Comparator.comparingInt(OperationNode::rank));
            return found;
        }

        private void markRelevant(List<OperationNode> ascending) {
            for (OperationNode node : ascending) {
                boolean any = false;
                for (Variable input : node.inputs()) {
                    if (flowsInto(input)) {
                        any = true;
                        break;
                    }
                }
                relevant.put(node, any);
            }
        }

        private void countPending(List<OperationNode> nodes) {
            for (OperationNode node : nodes) {
                if (!isRelevant(node)) {
                    continue;
                }
                for (Variable input : node.inputs()) {
                    OperationNode upstream = input.creator();
                    if (upstream != null && flowsInto(input) && isRelevant(upstream)) {
                        pending.merge(upstream, 1, Integer::sum);
                    }
                }
            }
        }

        private boolean flowsInto(Variable v) {
            if (!v.requiresGrad()) {
                return false;
            }
            return isTarget(v) || (v.creator() != null && isRelevant(v.creator()));
        }

        private boolean isTarget(Variable v) {
            if (targets != null) {
                return targets.contains(v);
            }
            return v.creator() == null && v.requiresGrad();
        }

        private boolean isRelevant(OperationNode node) {
            return relevant.getOrDefault(node, false);
        }

        private void enqueue(OperationNode node) {
            // each node runs once, after all of its output gradients are in
            if (enqueued.add(node)) {
                queue.add(new QueueEntry(node, sequence++));
            }
        }

        // ---------- per node ----------

        private void process(OperationNode node) {
            List<Variable> outs = node.outputs();
            List<Variable> gys = new ArrayList<>(outs.size());
            boolean anyGrad = false;
            for (int i = 0; i < outs.size(); i++) {
                Variable out = outs.get(i);
                Variable gy = out == null ? null : grads.get(out);
                anyGrad |= gy != null;
                gys.add(gy);
            }

            List<Integer> targetIndexes = new ArrayList<>();
            List<Variable> inputs = node.inputs();
            for (int i = 0; i < inputs.size(); i++) {
                if (flowsInto(inputs.get(i))) {
                    targetIndexes.add(i);
                }
            }

            if (anyGrad && !targetIndexes.isEmpty()) {
                runBackward(node, inputs, gys, targetIndexes);
            }

            for (int i : targetIndexes) {
                OperationNode upstream = inputs.get(i).creator();
                if (upstream != null && isRelevant(upstream)) {
                    int left = pending.merge(upstream, -1, Integer::sum);
                    if (left == 0) {
                        enqueue(upstream);
                    }
                }
            }

            for (Variable out : outs) {
                if (out == null || seeded.contains(out) || isTarget(out)) {
                    continue;
                }
                Variable g = grads.remove(out);
                if (retainGrad && targets == null && g != null) {
                    out.setGrad(g);
                }
            }
        }

        private void runBackward(OperationNode node, List<Variable> inputs, List<Variable> gys,
                                 List<Integer> targetIndexes) {
            List<TensorSpec> specs = node.outputSpecs();
            try (ConfigContext ignored = ConfigContext.using(c -> c.withEnableBackprop(enableDoubleBackprop))) {
                for (int i = 0; i < gys.size(); i++) {
                    if (gys.get(i) == null) {
                        NdArray like = inputs.get(targetIndexes.get(0)).array();
                        gys.set(i, new Variable(like.backend().zeros(specs.get(i))));
                    }
                }

                int[] indexes = targetIndexes.stream().mapToInt(Integer::intValue).toArray();
                List<Variable> gxs = node.backward(indexes, Collections.unmodifiableList(gys));
                if (gxs == null || gxs.size() != inputs.size()) {
                    throw new GradientContractException(node.label(), -1, "backward returned "
                            + (gxs == null ? "null" : gxs.size() + " gradients") + " for "
                            + inputs.size() + " inputs");
                }

                NaNPolicy policy = config.effectiveNanPolicy();
                for (int i : targetIndexes) {
                    Variable gx = gxs.get(i);
                    if (gx == null) {
                        continue;
                    }
                    if (config.debug()) {
                        validate(node, i, inputs.get(i), gx);
                    }
                    if (policy != NaNPolicy.IGNORE) {
                        NumericalGuard.check(gx.array(), node.label() + " (backward)", policy);
                    }
                    accumulate(inputs.get(i), gx, false);
                }
            }
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.log(Level.FINEST, "Back-propagated {0} at rank {1}", new Object[]{node.label(), node.rank()});
            }
        }

        /**
         * Adds {@code g} to the running gradient of {@code v}. Contributions
         * to leaves, seeds excluded, are also collected for {@code backward}.
         */
        private void accumulate(Variable v, Variable g, boolean seed) {
            try (ConfigContext ignored = ConfigContext.using(c -> c.withEnableBackprop(enableDoubleBackprop))) {
                grads.merge(v, g, GradientAccumulator::add);
                if (!seed && targets == null && isTarget(v)) {
                    leafGrads.merge(v, g, GradientAccumulator::add);
                }
            }
        }

        private static void validate(OperationNode node, int index, Variable input, Variable gx) {
            NdArray x = input.array();
            NdArray g = gx.array();
            if (g == null) {
                throw new GradientContractException(node.label(), index, "gradient has no array");
            }
            if (!g.spec().shapeEquals(x.spec())) {
                throw new GradientContractException(node.label(), index, "shape of gradient "
                        + Arrays.toString(g.spec().shape()) + " does not match input shape "
                        + Arrays.toString(x.spec().shape()));
            }
            if (g.dtype() != x.dtype()) {
                throw new GradientContractException(node.label(), index, "dtype of gradient "
                        + g.dtype() + " does not match input dtype " + x.dtype());
            }
        }
    }
}
