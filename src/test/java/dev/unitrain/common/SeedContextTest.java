package dev.unitrain.common;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class SeedContextTest {

    private static long[] draw(RandomGenerator random, int n) {
        long[] values = new long[n];
        for (int i = 0; i < n; i++)
            values[i] = random.nextLong();
        return values;
    }

    @Test
    void testSameSeedAndNameGiveSameStream() {
        SeedContext a = new SeedContext(42);
        SeedContext b = new SeedContext(42);
        assertArrayEquals(draw(a.generator("gru.init"), 16), draw(b.generator("gru.init"), 16));
        assertEquals(a.intSeed("trees.reptree"), b.intSeed("trees.reptree"));
    }

    @Test
    void testSubsystemsAreIndependent() {
        SeedContext seeds = new SeedContext(42);
        assertFalse(Arrays.equals(draw(seeds.generator("gru.init"), 8),
                                  draw(seeds.generator("data.train"), 8)));
        assertNotEquals(seeds.intSeed("a"), seeds.intSeed("b"));
    }

    @Test
    void testDifferentSeedsDiffer() {
        assertFalse(Arrays.equals(draw(new SeedContext(1).generator("gru.init"), 8),
                                  draw(new SeedContext(2).generator("gru.init"), 8)));
        assertEquals(5L, new SeedContext(5).seed());
    }
}
