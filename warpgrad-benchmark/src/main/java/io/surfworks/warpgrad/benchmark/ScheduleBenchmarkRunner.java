package io.surfworks.warpgrad.benchmark;

import io.surfworks.warpgrad.core.config.AutogradConfig;
import io.surfworks.warpgrad.core.config.AutogradConfigLoader;
import io.surfworks.warpgrad.core.config.ConfigContext;
import io.surfworks.warpgrad.core.graph.Variable;
import io.surfworks.warpgrad.core.schedule.StaticGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Measures training steps of a small perceptron executed define-by-run and
 * through a static schedule.
 *
 * <p>Before timing, one step of each tier is run on the same batch and the
 * losses and parameter gradients are compared.
 *
 * <pre>{@code
 * ScheduleBenchmarkRunner runner = new ScheduleBenchmarkRunner().iterations(100).hidden(256);
 * BenchmarkReport report = runner.run();
 * report.print();
 * }</pre>
 *
 * <p>CLI usage:
 * <pre>{@code
 * java -jar warpgrad-benchmark.jar --iterations 100 --batch 64 --json report.json
 * }</pre>
 */
public class ScheduleBenchmarkRunner {

    private static final Logger LOGGER = Logger.getLogger(ScheduleBenchmarkRunner.class.getName());

    private static final long SEED = 42L;
    private static final String BENCHMARK_NAME = "MlpTrainingStep";

    private int warmupIterations = 10;
    private int measurementIterations = 50;
    private int batchSize = 32;
    private int inputSize = 64;
    private int hiddenSize = 128;
    private int outputSize = 10;
    private boolean verboseOutput = true;
    private boolean helpRequested;
    private Path jsonOutput;
    private EnumSet<ExecutionTier> tiers = EnumSet.allOf(ExecutionTier.class);

    /**
     * Main entry point for CLI execution.
     */
    public static void main(String[] args) {
        ScheduleBenchmarkRunner runner = new ScheduleBenchmarkRunner();
        try {
            runner.parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
        }
        if (runner.helpRequested) {
            printUsage();
            return;
        }

        AutogradConfig config = AutogradConfigLoader.load();
        BenchmarkReport report;
        try (ConfigContext ctx = ConfigContext.using(config)) {
            report = runner.run();
        }
        report.print();

        if (runner.jsonOutput != null) {
            try {
                Files.writeString(runner.jsonOutput, report.toJson());
                System.out.println("JSON report written to " + runner.jsonOutput);
            } catch (IOException e) {
                System.err.println("Failed to write JSON report: " + e.getMessage());
                System.exit(1);
            }
        }

        if (!report.resultsMatch()) {
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("WarpGrad Static Schedule Benchmark");
        System.out.println();
        System.out.println("Usage: warpgrad-benchmark [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --warmup <n>        Warmup iterations per tier (default: 10)");
        System.out.println("  --iterations <n>    Measured iterations per tier (default: 50)");
        System.out.println("  --batch <n>         Batch size (default: 32)");
        System.out.println("  --input <n>         Input features (default: 64)");
        System.out.println("  --hidden <n>        Hidden units (default: 128)");
        System.out.println("  --output <n>        Output features (default: 10)");
        System.out.println("  --tier <name>       Only measure one tier: dbr or static (default: both)");
        System.out.println("  --json <file>       Also write the report as JSON");
        System.out.println("  --quiet             Disable per-tier progress output");
        System.out.println("  --help              Print this message");
    }

    void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--warmup" -> warmupIterations = nonNegative(args, ++i);
                case "--iterations" -> measurementIterations = positive(args, ++i);
                case "--batch" -> batchSize = positive(args, ++i);
                case "--input" -> inputSize = positive(args, ++i);
                case "--hidden" -> hiddenSize = positive(args, ++i);
                case "--output" -> outputSize = positive(args, ++i);
                case "--tier" -> tiers = EnumSet.of(ExecutionTier.parse(value(args, ++i)));
                case "--json" -> jsonOutput = Path.of(value(args, ++i));
                case "--quiet" -> verboseOutput = false;
                case "--verbose" -> verboseOutput = true;
                case "--help", "-h" -> helpRequested = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    private static int positive(String[] args, int index) {
        int n = nonNegative(args, index);
        if (n == 0) {
            throw new IllegalArgumentException(args[index - 1] + " must be positive");
        }
        return n;
    }

    private static int nonNegative(String[] args, int index) {
        String raw = value(args, index);
        int n;
        try {
            n = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for " + args[index - 1] + ": " + raw, e);
        }
        if (n < 0) {
            throw new IllegalArgumentException(args[index - 1] + " must not be negative");
        }
        return n;
    }

    // ==================== Fluent configuration ====================

    public ScheduleBenchmarkRunner warmup(int iterations) {
        this.warmupIterations = iterations;
        return this;
    }

    public ScheduleBenchmarkRunner iterations(int iterations) {
        this.measurementIterations = iterations;
        return this;
    }

    public ScheduleBenchmarkRunner batch(int size) {
        this.batchSize = size;
        return this;
    }

    public ScheduleBenchmarkRunner hidden(int size) {
        this.hiddenSize = size;
        return this;
    }

    public ScheduleBenchmarkRunner layers(int input, int hidden, int output) {
        this.inputSize = input;
        this.hiddenSize = hidden;
        this.outputSize = output;
        return this;
    }

    public ScheduleBenchmarkRunner tiers(ExecutionTier first, ExecutionTier... rest) {
        this.tiers = EnumSet.of(first, rest);
        return this;
    }

    public ScheduleBenchmarkRunner verbose(boolean verbose) {
        this.verboseOutput = verbose;
        return this;
    }

    int warmupIterations() {
        return warmupIterations;
    }

    int measurementIterations() {
        return measurementIterations;
    }

    int batchSize() {
        return batchSize;
    }

    int hiddenSize() {
        return hiddenSize;
    }

    EnumSet<ExecutionTier> tiers() {
        return EnumSet.copyOf(tiers);
    }

    Path jsonOutput() {
        return jsonOutput;
    }

    boolean helpRequested() {
        return helpRequested;
    }

    // ==================== Execution ====================

    /**
     * Verifies both tiers agree, then times each of them.
     */
    public BenchmarkReport run() {
        MlpModel model = new MlpModel(inputSize, hiddenSize, outputSize, SEED);
        StaticGraph graph = StaticGraph.builder(in -> List.of(model.forward(in.get(0))))
            .parameters(model.parameters())
            .build();
        Variable x = model.input(batchSize, SEED + 1);
        String shape = batchSize + "x" + inputSize + " -> " + hiddenSize + " -> " + outputSize;

        double difference = verify(model, graph, x);
        if (difference == 0.0) {
            LOGGER.log(Level.FINE, "Static schedule matches define-by-run exactly");
        } else {
            LOGGER.log(Level.WARNING, "Static schedule differs from define-by-run by up to {0}", difference);
        }

        Map<ExecutionTier, BenchmarkResult> byTier = new EnumMap<>(ExecutionTier.class);
        for (ExecutionTier tier : tiers) {
            BenchmarkResult result = measure(tier, model, graph, x, shape);
            byTier.put(tier, result);
            if (verboseOutput) {
                System.out.println("  " + result.toSummaryString());
            }
        }

        List<BenchmarkResult.TierComparison> comparisons = new ArrayList<>();
        if (byTier.size() == ExecutionTier.values().length) {
            comparisons.add(byTier.get(ExecutionTier.STATIC_SCHEDULE).compareTo(byTier.get(ExecutionTier.DEFINE_BY_RUN)));
        }
        return new BenchmarkReport(new ArrayList<>(byTier.values()), comparisons, difference);
    }

    private BenchmarkResult measure(ExecutionTier tier, MlpModel model, StaticGraph graph, Variable x, String shape) {
        for (int i = 0; i < warmupIterations; i++) {
            step(tier, model, graph, x);
        }
        long[] timings = new long[measurementIterations];
        for (int i = 0; i < measurementIterations; i++) {
            long startNanos = System.nanoTime();
            step(tier, model, graph, x);
            timings[i] = (System.nanoTime() - startNanos) / 1000;
        }
        return new BenchmarkResult(BENCHMARK_NAME, shape, tier, warmupIterations, measurementIterations, timings);
    }

    /**
     * One forward and backward pass. Parameter gradients are left on the
     * model for inspection and cleared at the start of the next step.
     *
     * @return the loss value
     */
    static double step(ExecutionTier tier, MlpModel model, StaticGraph graph, Variable x) {
        model.clearGrads();
        Variable y = tier == ExecutionTier.STATIC_SCHEDULE ? graph.call(x).get(0) : model.forward(x);
        Variable loss = MlpModel.loss(y);
        loss.backward();
        return loss.array().getDouble(0);
    }

    /**
     * Largest absolute difference between the tiers' loss and parameter gradients.
     */
    static double verify(MlpModel model, StaticGraph graph, Variable x) {
        double lossDbr = step(ExecutionTier.DEFINE_BY_RUN, model, graph, x);
        List<double[]> gradsDbr = new ArrayList<>();
        for (Variable p : model.parameters()) {
            gradsDbr.add(p.gradArray().toDoubleArray());
        }

        double lossStatic = step(ExecutionTier.STATIC_SCHEDULE, model, graph, x);
        double max = Math.abs(lossDbr - lossStatic);
        List<Variable> params = model.parameters();
        for (int i = 0; i < params.size(); i++) {
            double[] expected = gradsDbr.get(i);
            double[] actual = params.get(i).gradArray().toDoubleArray();
            for (int k = 0; k < expected.length; k++) {
                max = Math.max(max, Math.abs(expected[k] - actual[k]));
            }
        }
        return max;
    }
}
