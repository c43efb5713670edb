package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.array.NdArray;
import io.surfworks.warpgrad.core.config.AutogradConfig;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.graph.Variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache of the schedules of one static region, keyed by input shapes and
 * dtypes and by the training mode.
 *
 * <p>In training mode (training with backprop enabled) every call within one
 * iteration gets its own schedule instance, so several forward passes can be
 * in flight before a single backward pass. The instances become available
 * again after {@link #endForward()}, which the first schedule backward of an
 * iteration calls automatically. In evaluation mode one instance per key is
 * reused freely.
 */
public final class ScheduleManager {

    private static final Logger LOGGER = Logger.getLogger(ScheduleManager.class.getName());

    private final boolean minimizeCacheSize;
    private final boolean enableDoubleBackprop;
    private final int verbosity;

    private final Map<String, List<StaticSchedule>> schedules = new LinkedHashMap<>();
    private final Map<String, Integer> inUse = new HashMap<>();
    private Boolean previousTrain;
    private boolean forwardOver;
    private int trainCount;
    private int maxInUseTrain;

    public ScheduleManager(boolean minimizeCacheSize, boolean enableDoubleBackprop, int verbosity) {
        this.minimizeCacheSize = minimizeCacheSize;
        this.enableDoubleBackprop = enableDoubleBackprop;
        this.verbosity = verbosity;
    }

    /**
     * Returns a schedule compatible with {@code inputs} under the current
     * configuration: an existing built one when available, otherwise a new
     * empty one.
     */
    public StaticSchedule acquire(List<Variable> inputs) {
        AutogradConfig config = ConfigContext.current();
        forwardOver = false;
        if (minimizeCacheSize && !Boolean.valueOf(config.train()).equals(previousTrain)) {
            previousTrain = config.train();
            if (!schedules.isEmpty() && verbosity >= 2) {
                LOGGER.log(Level.INFO, "Training mode changed, clearing {0} cached schedule keys", schedules.size());
            }
            schedules.clear();
            inUse.clear();
        }

        boolean training = config.train() && config.enableBackprop();
        String key = key(training, inputs);
        List<StaticSchedule> pool = schedules.computeIfAbsent(key, k -> new ArrayList<>());
        if (!training) {
            if (pool.isEmpty()) {
                pool.add(create(key));
            }
            return pool.get(0);
        }

        trainCount++;
        int available = inUse.getOrDefault(key, 0);
        if (available >= pool.size()) {
            pool.add(create(key));
        }
        inUse.put(key, available + 1);
        return pool.get(available);
    }

    /**
     * Marks the current iteration finished so in-use schedules can be handed
     * out again. Repeated calls before the next {@link #acquire} do nothing.
     */
    public void endForward() {
        if (forwardOver) {
            return;
        }
        inUse.replaceAll((k, v) -> 0);
        forwardOver = true;
        if (trainCount > maxInUseTrain) {
            maxInUseTrain = trainCount;
            if (verbosity >= 2) {
                LOGGER.log(Level.INFO, "Maximum in-use schedules per training iteration: {0}", maxInUseTrain);
            }
        }
        trainCount = 0;
    }

    /**
     * Cache key: mode prefix followed by the shape and dtype of every input.
     */
    static String key(boolean training, List<Variable> inputs) {
        StringBuilder sb = new StringBuilder(training ? "train:" : "test:");
        for (Variable v : inputs) {
            NdArray a = v.array();
            sb.append(Arrays.toString(a.spec().shape())).append(a.dtype());
        }
        return sb.toString();
    }

    private StaticSchedule create(String key) {
        if (verbosity >= 1) {
            LOGGER.log(Level.INFO, "Creating new static schedule for key {0}", key);
        }
        return new StaticSchedule(this, 0, new UniqueArrayTable(), enableDoubleBackprop, verbosity);
    }

    public void clear() {
        schedules.clear();
        inUse.clear();
        trainCount = 0;
    }

    /**
     * Number of schedule instances across all keys.
     */
    public int scheduleCount() {
        int count = 0;
        for (List<StaticSchedule> pool : schedules.values()) {
            count += pool.size();
        }
        return count;
    }

    public int keyCount() {
        return schedules.size();
    }

    public int maxInUseTrain() {
        return maxInUseTrain;
    }

    public boolean isMinimizeCacheSize() {
        return minimizeCacheSize;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ScheduleManager[");
        schedules.forEach((k, v) -> sb.append(k).append(" -> ").append(v.size()).append(' '));
        return sb.append(']').toString().replace(" ]", "]");
    }
}
