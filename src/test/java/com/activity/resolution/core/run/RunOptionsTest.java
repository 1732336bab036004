package com.activity.resolution.core.run;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunOptions and OnlyFilter Tests")
class RunOptionsTest {

    @Nested
    @DisplayName("RunOptions builder")
    class Builder {

        @Test
        @DisplayName("Defaults are a live, unlimited, single-worker run selecting everything")
        void defaults() {
            RunOptions options = RunOptions.defaults();
            assertFalse(options.isDryRun());
            assertFalse(options.isForce());
            assertFalse(options.isAllowDowngrade());
            assertFalse(options.isLimited());
            assertEquals(1, options.getWorkers());
            assertTrue(options.getOnly().isEmpty());
        }

        @Test
        @DisplayName("Invalid limit and worker count are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().limit(-1));
            assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().workers(0));
            assertThrows(NullPointerException.class, () -> RunOptions.builder().only(null));
        }

        @Test
        @DisplayName("Zero limit means unlimited")
        void zeroLimit() {
            RunOptions options = RunOptions.builder().limit(0).build();
            assertFalse(options.isLimited());
            assertTrue(RunOptions.builder().limit(5).build().isLimited());
        }
    }

    @Nested
    @DisplayName("OnlyFilter")
    class Filter {

        @Test
        @DisplayName("Blank expression selects everything")
        void blank() {
            OnlyFilter filter = OnlyFilter.parse("  ");
            assertTrue(filter.isEmpty());
            assertTrue(filter.accepts(OnlyFilter.SPORT, "Run"));
            assertTrue(filter.accepts(OnlyFilter.SPORT, null));
        }

        @Test
        @DisplayName("Repeated keys select any of their values")
        void repeatedKey() {
            OnlyFilter filter = OnlyFilter.parse("sport=Run,sport=Ride");
            assertEquals(Set.of("Run", "Ride"), filter.values(OnlyFilter.SPORT));
            assertTrue(filter.accepts(OnlyFilter.SPORT, "ride"));
            assertFalse(filter.accepts(OnlyFilter.SPORT, "Swim"));
            assertFalse(filter.accepts(OnlyFilter.SPORT, null));
        }

        @Test
        @DisplayName("Different keys constrain independently")
        void differentKeys() {
            OnlyFilter filter = OnlyFilter.parse("ID=42, tz_source=assumed-home");
            assertTrue(filter.constrains(OnlyFilter.ID));
            assertTrue(filter.accepts(OnlyFilter.ID, 42L));
            assertFalse(filter.accepts(OnlyFilter.ID, 43L));
            assertTrue(filter.accepts(OnlyFilter.TZ_SOURCE, "assumed-home"));
            assertTrue(filter.accepts(OnlyFilter.TZ_NAME, "anything"));
        }

        @Test
        @DisplayName("Unknown keys and malformed pairs are rejected")
        void malformed() {
            assertThrows(IllegalArgumentException.class, () -> OnlyFilter.parse("colour=red"));
            assertThrows(IllegalArgumentException.class, () -> OnlyFilter.parse("sport"));
            assertThrows(IllegalArgumentException.class, () -> OnlyFilter.parse("sport="));
            assertThrows(IllegalArgumentException.class, () -> OnlyFilter.parse("=Run"));
        }
    }
}
