package dev.unitrain.training;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PredictionBufferTest {

    @Test
    void testShortLastBatchKeepsOrder() {
        PredictionBuffer buffer = new PredictionBuffer(3, 4, true);
        assertEquals(12, buffer.capacity());

        buffer.put(0, new float[] {0f, -1f, 2f, 0f}, new float[] {1f, 1f, 0f, 0f});
        buffer.put(1, new float[] {-3f, 5f, 0f, 7f}, new float[] {0f, 1f, 1f, 0f});
        buffer.put(2, new float[] {0f, -9f}, new float[] {1f, 0f});

        assertEquals(10, buffer.size());
        assertArrayEquals(new float[] {0f, -1f, 2f, 0f, -3f, 5f, 0f, 7f, 0f, -9f}, buffer.predictions());
        assertArrayEquals(new float[] {1f, 1f, 0f, 0f, 0f, 1f, 1f, 0f, 1f, 0f}, buffer.labels());
    }

    @Test
    void testBatchesMayArriveOutOfOrder() {
        PredictionBuffer buffer = new PredictionBuffer(2, 2, false);
        buffer.put(1, new float[] {3f, 4f}, null);
        buffer.put(0, new float[] {1f, 2f}, null);
        assertArrayEquals(new float[] {1f, 2f, 3f, 4f}, buffer.predictions());
        assertNull(buffer.labels());
    }

    @Test
    void testInvalidPuts() {
        PredictionBuffer buffer = new PredictionBuffer(2, 2, true);
        buffer.put(0, new float[] {1f}, new float[] {1f});
        assertThrows(IllegalStateException.class, () -> buffer.put(0, new float[] {1f}, new float[] {1f}));
        assertThrows(IllegalArgumentException.class, () -> buffer.put(2, new float[] {1f}, new float[] {1f}));
        assertThrows(IllegalArgumentException.class, () -> buffer.put(-1, new float[] {1f}, new float[] {1f}));
        assertThrows(IllegalArgumentException.class, () -> buffer.put(1, new float[3], new float[3]));
        assertThrows(IllegalArgumentException.class, () -> buffer.put(1, new float[1], null));
        assertThrows(IllegalArgumentException.class, () -> new PredictionBuffer(1, 0, false));
    }

    @Test
    void testEmptyBuffer() {
        PredictionBuffer buffer = new PredictionBuffer(0, 8, true);
        assertEquals(0, buffer.predictions().length);
        assertEquals(0, buffer.labels().length);
    }
}
