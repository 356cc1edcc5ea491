package dev.unitrain.trees;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EarlyStoppingTest {

    @Test
    void testStopsAfterPatienceRoundsWithoutImprovement() {
        EarlyStopping stopping = new EarlyStopping(2);
        assertEquals(-1, stopping.getBestRound());

        assertFalse(stopping.update(0, 1.0f));
        assertFalse(stopping.update(1, 0.8f));
        assertFalse(stopping.update(2, 0.9f));
        assertEquals(1, stopping.getRoundsWithoutImprovement());
        assertTrue(stopping.update(3, 0.85f));

        assertEquals(1, stopping.getBestRound());
        assertEquals(0.8f, stopping.getBestLoss());
    }

    @Test
    void testEqualLossIsNotAnImprovement() {
        EarlyStopping stopping = new EarlyStopping(1);
        assertFalse(stopping.update(0, 0.5f));
        assertTrue(stopping.update(1, 0.5f));
        assertEquals(0, stopping.getBestRound());
    }

    @Test
    void testImprovementResetsCounter() {
        EarlyStopping stopping = new EarlyStopping(2);
        stopping.update(0, 1.0f);
        stopping.update(1, 1.1f);
        assertFalse(stopping.update(2, 0.9f));
        assertEquals(0, stopping.getRoundsWithoutImprovement());
        assertThrows(IllegalArgumentException.class, () -> new EarlyStopping(0));
    }
}
