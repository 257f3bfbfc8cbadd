package com.gene.evidence.health;

import com.gene.evidence.TestSnapshots;
import com.gene.evidence.snapshot.ServedSnapshot;
import com.gene.evidence.snapshot.ServedSnapshotHolder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Status severity orders UP < DEGRADED < DOWN")
        void severity() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.degraded("y")));
            assertTrue(HealthStatus.degraded("y").isWorseThan(HealthStatus.up()));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.up()));
        }

        @Test
        @DisplayName("withDetail() returns a new status with the detail added")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("curated", "LOADED (95)");

            assertTrue(base.details().isEmpty());
            assertEquals("LOADED (95)", detailed.details().get("curated"));
            assertThrows(UnsupportedOperationException.class, () -> detailed.details().put("x", 1));
        }
    }

    @Nested
    @DisplayName("MemoryHealthCheck")
    class MemoryTests {

        @Test
        @DisplayName("Thresholds map heap usage to status")
        void thresholds() {
            assertTrue(MemoryHealthCheck.evaluate(100, 1000, 12).isUp());
            assertEquals(HealthStatus.Status.DEGRADED, MemoryHealthCheck.evaluate(850, 1000, 12).status());
            assertEquals(HealthStatus.Status.DOWN, MemoryHealthCheck.evaluate(960, 1000, 12).status());
        }

        @Test
        @DisplayName("High usage names the served entry count")
        void degradedMessage() {
            HealthStatus status = MemoryHealthCheck.evaluate(850, 1000, 12);

            assertEquals("Heap usage high: 85.0% with 12 served entries; a reload may not fit", status.message());
            assertEquals(12, status.details().get("servedEntries"));
        }

        @Test
        @DisplayName("Served entries sum every tier")
        void servedEntries() {
            // 4 curated + 3 expanded + 2 genome summary fields + 5 candidates
            assertEquals(14, MemoryHealthCheck.servedEntries(TestSnapshots.full()));
            assertEquals(0, MemoryHealthCheck.servedEntries(ServedSnapshot.empty()));
        }

        @Test
        @DisplayName("Live check reports heap details")
        void liveCheck() {
            MemoryHealthCheck check = new MemoryHealthCheck(new ServedSnapshotHolder(TestSnapshots.curatedOnly()));
            HealthStatus status = check.check();

            assertEquals("memory", check.getName());
            assertTrue(status.details().containsKey("heapUsedMB"));
            assertTrue(status.details().containsKey("heapMaxMB"));
            assertEquals(4, status.details().get("servedEntries"));
        }
    }

    @Nested
    @DisplayName("SnapshotHealthCheck")
    class SnapshotTests {

        @Test
        @DisplayName("UP when every tier is loaded")
        void upWhenComplete() {
            HealthStatus status = new SnapshotHealthCheck(new ServedSnapshotHolder(TestSnapshots.full())).check();

            assertTrue(status.isUp());
            assertEquals("LOADED (4)", status.details().get("curated"));
            assertEquals(TestSnapshots.LOADED_AT.toString(), status.details().get("loadedAt"));
        }

        @Test
        @DisplayName("DEGRADED when a non-curated tier is missing")
        void degraded() {
            HealthStatus status = new SnapshotHealthCheck(new ServedSnapshotHolder(TestSnapshots.curatedOnly())).check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertTrue(status.message().contains("expanded"));
        }

        @Test
        @DisplayName("DOWN when curated is missing")
        void down() {
            HealthStatus status = new SnapshotHealthCheck(new ServedSnapshotHolder(ServedSnapshot.empty())).check();
            assertEquals(HealthStatus.Status.DOWN, status.status());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Empty registry is UP")
        void emptyIsUp() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Worst status wins and names the check")
        void worstWins() {
            HealthStatus status = new HealthCheckRegistry()
                    .register(fixed("a", HealthStatus.up()))
                    .register(fixed("b", HealthStatus.degraded("slow")))
                    .checkAll();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("b: slow", status.message());
            assertEquals(2, status.details().size());
            assertEquals("UP", ((Map<?, ?>) status.details().get("a")).get("status"));
        }

        @Test
        @DisplayName("A throwing check counts as DOWN")
        void throwingIsDown() {
            HealthCheck failing = new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            };

            HealthStatus status = new HealthCheckRegistry().register(failing).checkAll();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertTrue(status.message().contains("boom"));
        }
    }
}
