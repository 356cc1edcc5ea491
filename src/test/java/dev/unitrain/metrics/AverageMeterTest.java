package dev.unitrain.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AverageMeterTest {

    @Test
    void testWeightedAverage() {
        AverageMeter meter = new AverageMeter();
        assertTrue(Double.isNaN(meter.average()));

        meter.update(1.0, 2);
        meter.update(4.0, 1);
        assertEquals(2.0, meter.average(), 1e-12);
        assertEquals(4.0, meter.getValue());
        assertEquals(3, meter.getCount());
        assertEquals(6.0, meter.getSum(), 1e-12);
    }

    @Test
    void testBestSurvivesReset() {
        AverageMeter meter = new AverageMeter();
        assertFalse(meter.updateBest(Direction.LOWER_IS_BETTER), "empty meter never improves");
        assertTrue(Double.isNaN(meter.getBest()));

        meter.update(0.5, 4);
        assertTrue(meter.updateBest(Direction.LOWER_IS_BETTER));
        meter.reset();
        assertEquals(0, meter.getCount());
        assertEquals(0.5, meter.getBest());

        meter.update(0.5, 4);
        assertFalse(meter.updateBest(Direction.LOWER_IS_BETTER), "ties are not improvements");
        meter.reset();
        meter.update(0.4, 1);
        assertTrue(meter.updateBest(Direction.LOWER_IS_BETTER));
        assertEquals(0.4, meter.getBest(), 1e-12);
    }

    @Test
    void testHigherIsBetter() {
        AverageMeter meter = new AverageMeter();
        meter.update(0.7, 1);
        meter.updateBest(Direction.HIGHER_IS_BETTER);
        meter.reset();
        meter.update(0.6, 1);
        assertFalse(meter.updateBest(Direction.HIGHER_IS_BETTER));
        assertEquals(0.7, meter.getBest(), 1e-12);
    }

    @Test
    void testNonPositiveCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AverageMeter().update(1.0, 0));
    }
}
