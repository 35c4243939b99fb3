package com.ttennebkram.enhancer.model;

import com.ttennebkram.enhancer.processing.OpenCVLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * A decoded image handed to or returned from the enhancer.
 *
 * Channels are in RGB (or RGBA) order, 8 or 16 bits per channel, stored in an
 * OpenCV Mat. A buffer is owned by one invocation at a time; call
 * {@link #release()} when the native memory is no longer needed.
 */
public final class PixelBuffer {

    static {
        OpenCVLoader.load();
    }

    private final Mat mat;

    private PixelBuffer(Mat mat) {
        this.mat = mat;
    }

    /**
     * Wrap an existing RGB/RGBA Mat. The buffer takes ownership of the Mat.
     */
    public static PixelBuffer wrap(Mat mat) {
        if (mat == null) {
            throw new IllegalArgumentException("mat must not be null");
        }
        return new PixelBuffer(mat);
    }

    /**
     * Create an 8-bit buffer from interleaved channel bytes, row by row.
     */
    public static PixelBuffer fromBytes(int width, int height, int channels, byte[] data) {
        checkLength(width, height, channels, data.length);
        Mat mat = new Mat(height, width, CvType.makeType(CvType.CV_8U, channels));
        if (data.length > 0) {
            mat.put(0, 0, data);
        }
        return new PixelBuffer(mat);
    }

    /**
     * Create a 16-bit buffer from interleaved channel samples, row by row.
     */
    public static PixelBuffer fromShorts(int width, int height, int channels, short[] data) {
        checkLength(width, height, channels, data.length);
        Mat mat = new Mat(height, width, CvType.makeType(CvType.CV_16U, channels));
        if (data.length > 0) {
            mat.put(0, 0, data);
        }
        return new PixelBuffer(mat);
    }

    /**
     * A zero-area buffer.
     */
    public static PixelBuffer empty() {
        return new PixelBuffer(new Mat());
    }

    private static void checkLength(int width, int height, int channels, int length) {
        if (width < 0 || height < 0 || channels < 1) {
            throw new IllegalArgumentException("Bad dimensions " + width + "x" + height + "x" + channels);
        }
        long expected = (long) width * height * channels;
        if (expected != length) {
            throw new IllegalArgumentException("Expected " + expected + " samples but got " + length);
        }
    }

    public int getWidth() {
        return mat.cols();
    }

    public int getHeight() {
        return mat.rows();
    }

    public int getChannels() {
        return mat.channels();
    }

    /**
     * Bits per channel: 8, 16, or 0 for any other OpenCV depth.
     */
    public int getBitDepth() {
        switch (CvType.depth(mat.type())) {
            case CvType.CV_8U:
                return 8;
            case CvType.CV_16U:
                return 16;
            default:
                return 0;
        }
    }

    public boolean isEmpty() {
        return mat.empty() || mat.rows() == 0 || mat.cols() == 0;
    }

    public boolean hasAlpha() {
        return mat.channels() == 4;
    }

    /**
     * The underlying Mat. The buffer still owns it: do not release it directly.
     */
    public Mat getMat() {
        return mat;
    }

    public boolean sameShape(PixelBuffer other) {
        return other != null
                && getWidth() == other.getWidth()
                && getHeight() == other.getHeight()
                && getChannels() == other.getChannels();
    }

    /**
     * Interleaved samples of an 8-bit buffer.
     */
    public byte[] toBytes() {
        if (getBitDepth() != 8) {
            throw new IllegalStateException("Not an 8-bit buffer: " + this);
        }
        byte[] data = new byte[sampleCount()];
        if (data.length > 0) {
            mat.get(0, 0, data);
        }
        return data;
    }

    /**
     * Interleaved samples of a 16-bit buffer.
     */
    public short[] toShorts() {
        if (getBitDepth() != 16) {
            throw new IllegalStateException("Not a 16-bit buffer: " + this);
        }
        short[] data = new short[sampleCount()];
        if (data.length > 0) {
            mat.get(0, 0, data);
        }
        return data;
    }

    private int sampleCount() {
        long count = mat.total() * mat.channels();
        if (count > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Too many samples for one array: " + count);
        }
        return (int) count;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(mat.clone());
    }

    public void release() {
        mat.release();
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + getWidth() + "x" + getHeight() + "x" + getChannels()
                + ", " + getBitDepth() + "-bit]";
    }
}
