package io.surfworks.warpgrad.core.config;

import io.surfworks.warpgrad.core.error.NaNPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ConfigContextTest {

    @Nested
    @DisplayName("AutogradConfig")
    class ConfigRecordTests {

        @Test
        void defaults() {
            AutogradConfig c = AutogradConfig.defaults();

            assertTrue(c.enableBackprop());
            assertTrue(c.train());
            assertTrue(c.typeCheck());
            assertFalse(c.debug());
            assertEquals(NaNPolicy.IGNORE, c.nanPolicy());
        }

        @Test
        void withersReturnModifiedCopies() {
            AutogradConfig base = AutogradConfig.defaults();
            AutogradConfig eval = base.withTrain(false);

            assertTrue(base.train());
            assertFalse(eval.train());
            assertEquals(base.withTrain(false), eval);
        }

        @Test
        void debugForcesErrorPolicyOnlyWhenIgnoring() {
            assertEquals(NaNPolicy.ERROR, AutogradConfig.defaults().withDebug(true).effectiveNanPolicy());
            assertEquals(NaNPolicy.WARN,
                AutogradConfig.defaults().withDebug(true).withNanPolicy(NaNPolicy.WARN).effectiveNanPolicy());
            assertEquals(NaNPolicy.IGNORE, AutogradConfig.defaults().effectiveNanPolicy());
        }

        @Test
        void nanPolicyIsRequired() {
            assertThrows(NullPointerException.class, () -> new AutogradConfig(true, true, true, false, null));
        }
    }

    @Nested
    @DisplayName("Scoping")
    class ScopingTests {

        @Test
        void noBackpropRestoresPrevious() {
            assertTrue(ConfigContext.current().enableBackprop());
            try (ConfigContext ctx = ConfigContext.noBackprop()) {
                assertFalse(ConfigContext.current().enableBackprop());
            }
            assertTrue(ConfigContext.current().enableBackprop());
        }

        @Test
        void nestedContextsUnwindInOrder() {
            try (ConfigContext outer = ConfigContext.evaluation()) {
                try (ConfigContext inner = ConfigContext.debug()) {
                    assertFalse(ConfigContext.current().train());
                    assertTrue(ConfigContext.current().debug());
                }
                assertFalse(ConfigContext.current().train());
                assertFalse(ConfigContext.current().debug());
            }
            assertTrue(ConfigContext.current().train());
        }

        @Test
        void closeIsIdempotent() {
            ConfigContext outer = ConfigContext.evaluation();
            ConfigContext inner = ConfigContext.noBackprop();
            inner.close();
            inner.close();

            assertTrue(inner.isClosed());
            assertFalse(ConfigContext.current().train());
            assertTrue(ConfigContext.current().enableBackprop());
            outer.close();
            assertTrue(ConfigContext.current().train());
        }

        @Test
        void forceBackprop() {
            try (ConfigContext off = ConfigContext.noBackprop();
                 ConfigContext on = ConfigContext.forceBackprop()) {
                assertTrue(ConfigContext.current().enableBackprop());
            }
        }

        @Test
        void threadsSeeIndependentConfigurations() throws InterruptedException {
            AtomicReference<AutogradConfig> seen = new AtomicReference<>();
            try (ConfigContext ctx = ConfigContext.noBackprop()) {
                Thread t = new Thread(() -> seen.set(ConfigContext.current()));
                t.start();
                t.join();
            }
            assertTrue(seen.get().enableBackprop());
        }
    }
}
