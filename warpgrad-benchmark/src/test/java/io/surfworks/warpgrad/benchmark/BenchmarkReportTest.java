package io.surfworks.warpgrad.benchmark;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkReportTest {

    private static BenchmarkReport report(double difference) {
        BenchmarkResult dbr = new BenchmarkResult("MlpTrainingStep", "2x3", ExecutionTier.DEFINE_BY_RUN, 1, 2,
            new long[]{200, 400});
        BenchmarkResult replay = new BenchmarkResult("MlpTrainingStep", "2x3", ExecutionTier.STATIC_SCHEDULE, 1, 2,
            new long[]{100, 100});
        return new BenchmarkReport(List.of(dbr, replay), List.of(replay.compareTo(dbr)), difference);
    }

    @Test
    void matchOnlyWhenIdentical() {
        assertTrue(report(0.0).resultsMatch());
        assertFalse(report(1e-12).resultsMatch());
    }

    @Test
    void jsonHasSummaryResultsAndComparisons() {
        JsonObject root = JsonParser.parseString(report(0.0).toJson()).getAsJsonObject();

        JsonObject summary = root.getAsJsonObject("summary");
        assertEquals(2, summary.get("totalBenchmarks").getAsInt());
        assertTrue(summary.get("resultsMatch").getAsBoolean());

        JsonObject first = root.getAsJsonArray("results").get(0).getAsJsonObject();
        assertEquals("dbr", first.get("tier").getAsString());
        assertEquals(300.0, first.get("meanMicros").getAsDouble(), 1e-9);

        JsonObject comparison = root.getAsJsonArray("comparisons").get(0).getAsJsonObject();
        assertEquals("static", comparison.get("comparisonTier").getAsString());
        assertEquals(3.0, comparison.get("speedup").getAsDouble(), 1e-9);
    }

    @Test
    void printShowsStatusAndSummaries() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        report(0.5).print(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String text = bytes.toString(StandardCharsets.UTF_8);

        assertTrue(text.contains("RESULTS DIFFER"));
        assertTrue(text.contains("MlpTrainingStep [dbr] 2x3"));
        assertTrue(text.contains("speedup=3.00x"));
    }

    @Test
    void listsAreImmutableCopies() {
        BenchmarkReport report = report(0.0);

        assertThrows(UnsupportedOperationException.class, () -> report.results().clear());
    }
}
