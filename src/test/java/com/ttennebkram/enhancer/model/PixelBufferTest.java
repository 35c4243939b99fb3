package com.ttennebkram.enhancer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PixelBufferTest {

    @Test
    void bytesRoundTrip() {
        byte[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
        PixelBuffer buffer = PixelBuffer.fromBytes(2, 2, 3, data);

        assertEquals(2, buffer.getWidth());
        assertEquals(2, buffer.getHeight());
        assertEquals(3, buffer.getChannels());
        assertEquals(8, buffer.getBitDepth());
        assertFalse(buffer.hasAlpha());
        assertArrayEquals(data, buffer.toBytes());
        assertThrows(IllegalStateException.class, buffer::toShorts);
    }

    @Test
    void shortsKeepSixteenBits() {
        short[] data = {(short) 65535, 0, 1000, 2000};
        PixelBuffer buffer = PixelBuffer.fromShorts(1, 1, 4, data);
        assertEquals(16, buffer.getBitDepth());
        assertTrue(buffer.hasAlpha());
        assertArrayEquals(data, buffer.toShorts());
    }

    @Test
    void lengthMustMatchDimensions() {
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.fromBytes(2, 2, 3, new byte[11]));
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.fromBytes(-1, 2, 3, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.wrap(null));
    }

    @Test
    void emptyAndCopies() {
        assertTrue(PixelBuffer.empty().isEmpty());
        assertTrue(PixelBuffer.fromBytes(0, 5, 3, new byte[0]).isEmpty());

        PixelBuffer original = PixelBuffer.fromBytes(1, 1, 3, new byte[]{9, 8, 7});
        PixelBuffer copy = original.copy();
        copy.getMat().put(0, 0, new byte[]{0, 0, 0});
        assertArrayEquals(new byte[]{9, 8, 7}, original.toBytes());
        assertTrue(copy.sameShape(original));
    }

    @Test
    void formatsParseByName() {
        assertEquals(OutputFormat.JPG, OutputFormat.fromString("jpeg"));
        assertEquals(OutputFormat.PNG, OutputFormat.fromString("PNG"));
        assertTrue(OutputFormat.PNG.keepsAlpha());
        assertFalse(OutputFormat.JPG.keepsHighBitDepth());
    }
}
