package io.surfworks.warpgrad.benchmark;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionTierTest {

    @ParameterizedTest
    @CsvSource({
        "dbr, DEFINE_BY_RUN",
        "DBR, DEFINE_BY_RUN",
        "define_by_run, DEFINE_BY_RUN",
        "static, STATIC_SCHEDULE",
        "STATIC_SCHEDULE, STATIC_SCHEDULE"
    })
    void parsesShortAndEnumNames(String input, ExecutionTier expected) {
        assertEquals(expected, ExecutionTier.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "jit", "static-schedule"})
    void rejectsUnknownNames(String input) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ExecutionTier.parse(input));
        assertTrue(e.getMessage().startsWith("Unknown execution tier"));
    }
}
