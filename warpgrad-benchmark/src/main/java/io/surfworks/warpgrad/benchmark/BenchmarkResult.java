package io.surfworks.warpgrad.benchmark;

import java.util.Arrays;

/**
 * Timings of one benchmark on one execution tier, with JMH-style statistics
 * (mean, standard deviation, percentiles).
 */
public record BenchmarkResult(
    String benchmarkName,
    String shape,
    ExecutionTier tier,
    int warmupIterations,
    int measurementIterations,
    long[] timingsMicros
) {

    public double meanMicros() {
        if (timingsMicros.length == 0) return 0.0;
        return Arrays.stream(timingsMicros).average().orElse(0.0);
    }

    /**
     * Sample standard deviation in microseconds.
     */
    public double stdDevMicros() {
        if (timingsMicros.length < 2) return 0.0;
        double mean = meanMicros();
        double sumSquaredDiff = Arrays.stream(timingsMicros)
            .mapToDouble(t -> t - mean)
            .map(d -> d * d)
            .sum();
        return Math.sqrt(sumSquaredDiff / (timingsMicros.length - 1));
    }

    public long minMicros() {
        return Arrays.stream(timingsMicros).min().orElse(0L);
    }

    public long maxMicros() {
        return Arrays.stream(timingsMicros).max().orElse(0L);
    }

    /**
     * Nearest-rank percentile in microseconds.
     */
    public long percentileMicros(double percentile) {
        if (timingsMicros.length == 0) return 0L;
        long[] sorted = timingsMicros.clone();
        Arrays.sort(sorted);
        int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    public long p50Micros() {
        return percentileMicros(50);
    }

    public long p99Micros() {
        return percentileMicros(99);
    }

    /**
     * Coefficient of variation as a percentage. Lower means more stable measurements.
     */
    public double coefficientOfVariationPercent() {
        double mean = meanMicros();
        if (mean <= 0) return 0.0;
        return (stdDevMicros() / mean) * 100.0;
    }

    /**
     * Compares this result against a baseline of the same benchmark.
     *
     * @throws IllegalArgumentException if the benchmarks differ
     */
    public TierComparison compareTo(BenchmarkResult baseline) {
        if (!baseline.benchmarkName.equals(this.benchmarkName)) {
            throw new IllegalArgumentException(
                "Cannot compare different benchmarks: " + baseline.benchmarkName + " vs " + this.benchmarkName);
        }
        return new TierComparison(
            benchmarkName,
            shape,
            baseline.tier,
            this.tier,
            baseline.meanMicros(),
            this.meanMicros()
        );
    }

    public String toSummaryString() {
        return String.format(
            "%s [%s] %s: %.2f ± %.2f μs (min=%d, p50=%d, p99=%d, max=%d) CV=%.1f%%",
            benchmarkName,
            tier.shortName(),
            shape,
            meanMicros(),
            stdDevMicros(),
            minMicros(),
            p50Micros(),
            p99Micros(),
            maxMicros(),
            coefficientOfVariationPercent()
        );
    }

    /**
     * Result of comparing one tier against a baseline tier.
     */
    public record TierComparison(
        String benchmarkName,
        String shape,
        ExecutionTier baselineTier,
        ExecutionTier comparisonTier,
        double baselineMeanMicros,
        double comparisonMeanMicros
    ) {
        /**
         * Baseline time divided by comparison time. Above 1 means the
         * comparison tier is faster.
         */
        public double speedup() {
            return comparisonMeanMicros > 0 ? baselineMeanMicros / comparisonMeanMicros : 0.0;
        }

        public String toSummaryString() {
            return String.format("%s %s vs %s: %.1f μs vs %.1f μs, speedup=%.2fx",
                benchmarkName,
                comparisonTier.shortName(),
                baselineTier.shortName(),
                comparisonMeanMicros,
                baselineMeanMicros,
                speedup());
        }
    }
}
