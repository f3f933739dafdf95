package com.example.edgechasing.detection;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Threaded end-to-end runs with millisecond timings. */
public class SimulationTest {

    private static SimulationSettings fast(long runMillis, long usageMillis) {
        return new SimulationSettings(Duration.ofMillis(runMillis), Duration.ofMillis(50),
                Duration.ofMillis(usageMillis), Duration.ofMillis(10));
    }

    @Test
    @DisplayName("World is wired: ids 1..N and 1..M, every process bound to the same directory")
    void wiring() {
        var sim = Simulation.create(5, 3, SimulationSettings.defaults());
        assertEquals(5, sim.processes().size());
        assertEquals(3, sim.resources().size());
        for (int i = 0; i < 5; i++) assertEquals(i + 1, sim.processes().get(i).id());
        for (int i = 0; i < 3; i++) assertEquals(i + 1, sim.resources().get(i).id());
        assertThrows(IllegalStateException.class,
                () -> sim.processes().get(0).bind(new ProcessDirectory(java.util.Map.of())));
    }

    @ParameterizedTest
    @CsvSource({"0,3", "3,0", "-1,2"})
    @DisplayName("Non-positive counts are rejected")
    void rejectsBadCounts(int processes, int resources) {
        assertThrows(IllegalArgumentException.class,
                () -> Simulation.create(processes, resources, SimulationSettings.defaults()));
    }

    @Test
    @DisplayName("Seeded two-process cycle ends with exactly one harakiri")
    void seededCycleResolvesOnce() throws Exception {
        // frozen clock: both requests share one creation instant and go stale together
        var clock = new ManualClock();
        // usage time beyond the run budget: nothing is given back voluntarily before the run ends
        var settings = new SimulationSettings(Duration.ofSeconds(60), Duration.ofSeconds(5),
                Duration.ofSeconds(120), Duration.ofMillis(10));
        var sim = Simulation.create(2, 2, settings, clock,
                id -> id == 1 ? Fixtures.fixed(1, 2) : Fixtures.fixed(2, 1));
        assertTrue(sim.resources().get(0).acquireIfFree(sim.processes().get(0)));
        assertTrue(sim.resources().get(1).acquireIfFree(sim.processes().get(1)));

        ExecutorService exec = Executors.newSingleThreadExecutor();
        Simulation.Report report;
        try {
            Future<Simulation.Report> running = exec.submit(sim::run);
            Thread.sleep(200);
            clock.advance(Duration.ofSeconds(6));
            assertTrue(awaitCondition(() -> sim.coordinator().roundsConfirmed() == 1, 5000),
                    "cycle should be confirmed within 5s");
            assertTrue(awaitCondition(() -> sim.resources().stream()
                            .allMatch(r -> r.currentOwner().filter(o -> !o.performedHarakiri()).isPresent()), 5000),
                    "survivor should pick up the freed resource");
            clock.advance(Duration.ofSeconds(55));
            report = running.get(5, TimeUnit.SECONDS);
        } finally {
            exec.shutdownNow();
        }

        assertEquals(1, report.harakiriProcessIds().size(), "one side of the cycle gives up");
        assertEquals(1, report.roundsStarted());
        assertEquals(1, report.roundsConfirmed());
        assertTrue(report.probesSent() >= 2, "probe travelled there and back");
        assertTrue(report.failedProcessIds().isEmpty());

        int survivor = report.harakiriProcessIds().get(0) == 1 ? 1 : 0;
        var winner = sim.processes().get(survivor);
        assertEquals(2, winner.heldResources().size(), "survivor ends up with both resources");
    }

    private static boolean awaitCondition(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long end = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < end) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    @RepeatedTest(3)
    @DisplayName("Random run finishes in budget with consistent bookkeeping")
    void randomRunSmoke() {
        var sim = Simulation.create(5, 3, fast(600, 100), Clock.systemUTC(),
                id -> new RandomResourceSelector(new Random(31L * id)));
        var report = assertTimeoutPreemptively(Duration.ofSeconds(10), sim::run);

        assertEquals(5, report.processes());
        assertEquals(3, report.resources());
        assertTrue(report.failedProcessIds().isEmpty(), "no process may die abnormally");
        assertEquals(report.roundsConfirmed(), report.harakiriProcessIds().size());
        assertTrue(report.roundsConfirmed() <= report.roundsStarted());
        assertTrue(report.roundsStarted() - report.roundsConfirmed() <= 1, "at most one round left in flight");

        for (var p : sim.processes()) {
            if (p.performedHarakiri()) {
                assertTrue(p.heldResources().isEmpty(), "harakiri leaves nothing held");
            }
        }
        for (var r : sim.resources()) {
            r.currentOwner().ifPresent(owner -> {
                assertFalse(owner.performedHarakiri());
                assertTrue(owner.heldResources().contains(r), "owner still tracks the resource it holds");
            });
        }
    }
}
