package com.example.edgechasing.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks a contiguous, wrapping run of the pool: size uniform in [0, pool size],
 * start offset uniform in [0, pool size). An empty pick means the process idles that pass.
 */
public final class RandomResourceSelector implements ResourceSelector {
    private final Random random;

    public RandomResourceSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public List<Resource> select(List<Resource> pool) {
        if (pool.isEmpty()) return List.of();
        int count = random.nextInt(pool.size() + 1);
        int index = random.nextInt(pool.size());
        List<Resource> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            picked.add(pool.get(index));
            index = (index + 1) % pool.size();
        }
        return picked;
    }
}
