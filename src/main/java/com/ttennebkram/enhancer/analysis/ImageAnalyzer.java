package com.ttennebkram.enhancer.analysis;

import com.ttennebkram.enhancer.model.PixelBuffer;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.OpenCVLoader;
import com.ttennebkram.enhancer.processing.SkinDetector;
import com.ttennebkram.enhancer.processing.WorkingImages;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Collections;

/**
 * Computes the {@link CharacteristicVector} of an image.
 *
 * Every statistic comes from a fixed number of linear passes (color
 * conversions, one Sobel, a bounded set of shifted differences and a handful
 * of means), so cost grows linearly with pixel count. The input is never
 * modified.
 *
 * Noise is estimated from differences between the luma image and copies of
 * itself shifted by up to {@value #MAX_NOISE_SHIFT} pixels in every direction.
 * Each shift yields the median absolute difference, a statistic that ignores
 * the minority of pixels sitting on edges. Grain is uncorrelated, so every
 * shift sees it. Fine texture and repeating patterns cancel out for some shift
 * (along a stripe, one period across a weave), so the smallest median over all
 * shifts tracks the grain and not the texture.
 */
public class ImageAnalyzer {

    /** Gradient magnitude (Sobel / 8 on [0, 1] luma) above which a pixel is an edge. */
    static final double EDGE_THRESHOLD = 0.12;

    /** Largest pixel offset, horizontal or vertical, compared by the noise estimate. */
    static final int MAX_NOISE_SHIFT = 4;

    /**
     * Median of |a - b| for two independent Gaussian samples of sigma s is
     * 0.6745 * sqrt(2) * s.
     */
    private static final double MEDIAN_DIFF_TO_SIGMA = 1.0 / (0.6745 * Math.sqrt(2.0));

    private static final double DARK_LEVEL = 50;
    private static final double BRIGHT_LEVEL = 200;

    /** Minimum HSV saturation (8-bit) for a pixel to count towards a hue family. */
    private static final int HUE_MIN_SATURATION = 41;

    static {
        OpenCVLoader.load();
    }

    /**
     * Analyze a caller buffer. Alpha is ignored and 16-bit data is analyzed
     * at 8 bits.
     */
    public CharacteristicVector analyze(PixelBuffer buffer) {
        if (buffer == null || buffer.isEmpty()) {
            return CharacteristicVector.EMPTY;
        }
        Mat rgb = WorkingImages.toWorkingRgb(buffer);
        try {
            return analyze(rgb);
        } finally {
            rgb.release();
        }
    }

    /**
     * Analyze an 8-bit RGB working image.
     */
    public CharacteristicVector analyze(Mat rgb8) {
        if (rgb8 == null || rgb8.empty() || rgb8.rows() == 0 || rgb8.cols() == 0) {
            return CharacteristicVector.EMPTY;
        }

        double total = (double) rgb8.rows() * rgb8.cols();
        CharacteristicVector.Builder builder = CharacteristicVector.builder();

        Mat gray = ColorSpaces.luma(rgb8);
        try {
            measureLuma(gray, total, builder);
            measureDetail(gray, total, builder);
            measureColor(rgb8, gray, total, builder);
        } finally {
            gray.release();
        }

        Mat skin = SkinDetector.detect(rgb8);
        builder.skinRatio(Core.countNonZero(skin) / total);
        skin.release();

        return builder.build();
    }

    private void measureLuma(Mat gray, double total, CharacteristicVector.Builder builder) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        Core.meanStdDev(gray, mean, std);
        builder.brightness(mean.get(0, 0)[0] / 255.0);
        builder.contrast(std.get(0, 0)[0] / 127.5);
        mean.release();
        std.release();

        Mat cmp = new Mat();
        Core.compare(gray, new Scalar(DARK_LEVEL), cmp, Core.CMP_LT);
        builder.darkRatio(Core.countNonZero(cmp) / total);
        Core.compare(gray, new Scalar(BRIGHT_LEVEL), cmp, Core.CMP_GT);
        builder.brightRatio(Core.countNonZero(cmp) / total);
        cmp.release();
    }

    private void measureDetail(Mat gray, double total, CharacteristicVector.Builder builder) {
        Mat grayF = new Mat();
        Mat gx = new Mat();
        Mat gy = new Mat();
        Mat magnitude = new Mat();
        Mat edges = new Mat();
        try {
            gray.convertTo(grayF, CvType.CV_32F, 1.0 / 255.0);
            Imgproc.Sobel(grayF, gx, CvType.CV_32F, 1, 0, 3, 1.0 / 8.0, 0);
            Imgproc.Sobel(grayF, gy, CvType.CV_32F, 0, 1, 3, 1.0 / 8.0, 0);
            Core.magnitude(gx, gy, magnitude);

            builder.sharpness(Core.mean(magnitude).val[0]);

            Core.compare(magnitude, new Scalar(EDGE_THRESHOLD), edges, Core.CMP_GT);
            builder.edgeDensity(Core.countNonZero(edges) / total);

            builder.noise(estimateNoise(gray));
        } finally {
            ColorSpaces.release(grayF, gx, gy, magnitude, edges);
        }
    }

    /**
     * Smallest median absolute difference over all shifts, converted to a
     * sigma in [0, 1] units.
     *
     * @param gray 8-bit single-channel luma
     */
    double estimateNoise(Mat gray) {
        int rows = gray.rows();
        int cols = gray.cols();
        if (rows < 3 || cols < 3) {
            return 0.0;
        }

        double best = Double.POSITIVE_INFINITY;
        Mat diff = new Mat();
        try {
            // Half of the neighborhood; the other half repeats the same pairs
            for (int dy = 0; dy <= MAX_NOISE_SHIFT; dy++) {
                for (int dx = -MAX_NOISE_SHIFT; dx <= MAX_NOISE_SHIFT; dx++) {
                    if (dy == 0 && dx <= 0) continue;
                    int width = cols - Math.abs(dx);
                    int height = rows - dy;
                    if (width < 1 || height < 1) continue;

                    Mat a = gray.submat(new Rect(Math.max(0, -dx), 0, width, height));
                    Mat b = gray.submat(new Rect(Math.max(0, dx), dy, width, height));
                    Core.absdiff(a, b, diff);
                    a.release();
                    b.release();

                    best = Math.min(best, medianOfDifferences(diff));
                    if (best == 0.0) {
                        return 0.0;
                    }
                }
            }
        } finally {
            diff.release();
        }
        if (Double.isInfinite(best)) {
            return 0.0;
        }
        return best * MEDIAN_DIFF_TO_SIGMA / 255.0;
    }

    /**
     * Median of 8-bit absolute differences, interpolated inside its histogram
     * bin so quantized data still gives a continuous value. Exactly zero only
     * when every difference is zero.
     */
    static double medianOfDifferences(Mat absDiff) {
        Mat hist = new Mat();
        Mat noMask = new Mat();
        MatOfInt channels = new MatOfInt(0);
        MatOfInt histSize = new MatOfInt(256);
        MatOfFloat ranges = new MatOfFloat(0f, 256f);
        try {
            Imgproc.calcHist(Collections.singletonList(absDiff), channels, noMask, hist, histSize, ranges);
            float[] counts = new float[256];
            hist.get(0, 0, counts);

            double total = 0;
            for (float c : counts) {
                total += c;
            }
            if (total == 0 || counts[0] == total) {
                return 0.0;
            }

            double half = total / 2.0;
            // Bin 0 holds differences in [0, 0.5), bin k in [k - 0.5, k + 0.5)
            if (counts[0] >= half) {
                return 0.5 * half / counts[0];
            }
            double below = counts[0];
            for (int k = 1; k < counts.length; k++) {
                if (below + counts[k] >= half) {
                    return k - 0.5 + (half - below) / counts[k];
                }
                below += counts[k];
            }
            return 255.0;
        } finally {
            ColorSpaces.release(hist, noMask, channels, histSize, ranges);
        }
    }

    private void measureColor(Mat rgb8, Mat gray, double total, CharacteristicVector.Builder builder) {
        Mat hsv = new Mat();
        Mat mask = new Mat();
        Mat mask2 = new Mat();
        try {
            Imgproc.cvtColor(rgb8, hsv, Imgproc.COLOR_RGB2HSV);
            Scalar hsvMean = Core.mean(hsv);
            builder.saturation(hsvMean.val[1] / 255.0);

            // 8-bit hue is degrees / 2
            Core.inRange(hsv, new Scalar(35, HUE_MIN_SATURATION, 0), new Scalar(85, 255, 255), mask);
            builder.greenRatio(Core.countNonZero(mask) / total);

            Core.inRange(hsv, new Scalar(90, HUE_MIN_SATURATION, 0), new Scalar(130, 255, 255), mask);
            builder.blueRatio(Core.countNonZero(mask) / total);

            Core.inRange(hsv, new Scalar(0, HUE_MIN_SATURATION, 0), new Scalar(30, 255, 255), mask);
            Core.inRange(hsv, new Scalar(160, HUE_MIN_SATURATION, 0), new Scalar(180, 255, 255), mask2);
            Core.bitwise_or(mask, mask2, mask);
            builder.warmRatio(Core.countNonZero(mask) / total);

            Scalar rgbMean = Core.mean(rgb8);
            double grayMean = Core.mean(gray).val[0];
            builder.redCast((rgbMean.val[0] - grayMean) / 255.0);
            builder.blueCast((rgbMean.val[2] - grayMean) / 255.0);
        } finally {
            ColorSpaces.release(hsv, mask, mask2);
        }
    }
}
