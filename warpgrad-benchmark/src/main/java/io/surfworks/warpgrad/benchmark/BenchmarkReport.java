package io.surfworks.warpgrad.benchmark;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.PrintStream;
import java.util.List;

/**
 * Report comparing static schedule replay against define-by-run execution.
 *
 * <p>Printed as a text table for humans and exported as JSON for tooling.
 */
public class BenchmarkReport {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final List<BenchmarkResult> results;
    private final List<BenchmarkResult.TierComparison> comparisons;
    private final double maxAbsDifference;

    /**
     * @param maxAbsDifference largest element-wise difference seen between the
     *                         tiers' losses and gradients while verifying
     */
    public BenchmarkReport(
        List<BenchmarkResult> results,
        List<BenchmarkResult.TierComparison> comparisons,
        double maxAbsDifference
    ) {
        this.results = List.copyOf(results);
        this.comparisons = List.copyOf(comparisons);
        this.maxAbsDifference = maxAbsDifference;
    }

    public List<BenchmarkResult> results() {
        return results;
    }

    public List<BenchmarkResult.TierComparison> comparisons() {
        return comparisons;
    }

    public double maxAbsDifference() {
        return maxAbsDifference;
    }

    /**
     * True when both tiers produced identical numbers.
     */
    public boolean resultsMatch() {
        return maxAbsDifference == 0.0;
    }

    public void print() {
        print(System.out);
    }

    public void print(PrintStream out) {
        out.println();
        out.println("╔════════════════════════════════════════════════════════════════════════════╗");
        out.println("║                    STATIC SCHEDULE BENCHMARK REPORT                        ║");
        out.println("╠════════════════════════════════════════════════════════════════════════════╣");
        out.printf("║  Total Benchmarks: %-56d ║%n", results.size());
        out.printf("║  Max |difference|: %-56s ║%n", String.format("%.3e", maxAbsDifference));
        out.printf("║  Status: %-66s ║%n", resultsMatch() ? "✓ RESULTS MATCH" : "✗ RESULTS DIFFER");
        out.println("╚════════════════════════════════════════════════════════════════════════════╝");
        out.println();

        for (BenchmarkResult result : results) {
            out.println("  " + result.toSummaryString());
        }
        if (!comparisons.isEmpty()) {
            out.println();
            for (BenchmarkResult.TierComparison comparison : comparisons) {
                out.println("  " + comparison.toSummaryString());
            }
        }
        out.println();
    }

    /**
     * Exports the report as pretty-printed JSON.
     */
    public String toJson() {
        JsonObject root = new JsonObject();

        JsonObject summary = new JsonObject();
        summary.addProperty("totalBenchmarks", results.size());
        summary.addProperty("totalComparisons", comparisons.size());
        summary.addProperty("maxAbsDifference", maxAbsDifference);
        summary.addProperty("resultsMatch", resultsMatch());
        root.add("summary", summary);

        JsonArray resultArray = new JsonArray();
        for (BenchmarkResult result : results) {
            JsonObject json = new JsonObject();
            json.addProperty("benchmark", result.benchmarkName());
            json.addProperty("shape", result.shape());
            json.addProperty("tier", result.tier().shortName());
            json.addProperty("warmupIterations", result.warmupIterations());
            json.addProperty("measurementIterations", result.measurementIterations());
            json.addProperty("meanMicros", result.meanMicros());
            json.addProperty("stdDevMicros", result.stdDevMicros());
            json.addProperty("p50Micros", result.p50Micros());
            json.addProperty("p99Micros", result.p99Micros());
            resultArray.add(json);
        }
        root.add("results", resultArray);

        JsonArray comparisonArray = new JsonArray();
        for (BenchmarkResult.TierComparison comparison : comparisons) {
            JsonObject json = new JsonObject();
            json.addProperty("benchmark", comparison.benchmarkName());
            json.addProperty("baselineTier", comparison.baselineTier().shortName());
            json.addProperty("comparisonTier", comparison.comparisonTier().shortName());
            json.addProperty("speedup", comparison.speedup());
            comparisonArray.add(json);
        }
        root.add("comparisons", comparisonArray);

        return GSON.toJson(root);
    }
}
