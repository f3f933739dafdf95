package com.example.edgechasing.detection;

import java.time.Clock;
import java.util.List;

/** Small builders shared by the tests. */
final class Fixtures {
    private Fixtures() {}

    /** A process that never asks for anything on its own. */
    static ProcessNode idleProcess(int id) {
        return new ProcessNode(id, List.of(), pool -> List.of(), new DetectionCoordinator(),
                SimulationSettings.defaults(), Clock.systemUTC());
    }

    /** Selector that always asks for the given resource ids, in that order. */
    static ResourceSelector fixed(int... resourceIds) {
        return pool -> {
            var picked = new java.util.ArrayList<Resource>();
            for (int id : resourceIds) picked.add(pool.get(id - 1));
            return picked;
        };
    }
}
