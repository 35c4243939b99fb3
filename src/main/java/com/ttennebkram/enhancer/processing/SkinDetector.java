package com.ttennebkram.enhancer.processing;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Skin tone detection: a pixel is skin when it falls inside both an HSV box
 * and a YCrCb box. A 3x3 opening removes isolated hits.
 */
public final class SkinDetector {

    private static final Scalar HSV_LOWER = new Scalar(0, 20, 70);
    private static final Scalar HSV_UPPER = new Scalar(25, 180, 255);
    private static final Scalar YCRCB_LOWER = new Scalar(0, 133, 77);
    private static final Scalar YCRCB_UPPER = new Scalar(255, 173, 127);

    private SkinDetector() {
    }

    /**
     * Binary skin mask (0 or 255) of an 8-bit RGB image.
     */
    public static Mat detect(Mat rgb8) {
        Mat hsv = new Mat();
        Mat ycrcb = new Mat();
        Mat maskHsv = new Mat();
        Mat maskYcrcb = new Mat();
        Mat kernel = null;
        try {
            Imgproc.cvtColor(rgb8, hsv, Imgproc.COLOR_RGB2HSV);
            Imgproc.cvtColor(rgb8, ycrcb, Imgproc.COLOR_RGB2YCrCb);
            Core.inRange(hsv, HSV_LOWER, HSV_UPPER, maskHsv);
            Core.inRange(ycrcb, YCRCB_LOWER, YCRCB_UPPER, maskYcrcb);

            Mat mask = new Mat();
            Core.bitwise_and(maskHsv, maskYcrcb, mask);
            kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
            Imgproc.morphologyEx(mask, mask, Imgproc.MORPH_OPEN, kernel);
            return mask;
        } finally {
            ColorSpaces.release(hsv, ycrcb, maskHsv, maskYcrcb, kernel);
        }
    }

    /**
     * Skin mask feathered with a Gaussian blur, as CV_32F weights in [0, 1].
     */
    public static Mat softMask(Mat rgb8, int featherSize) {
        Mat mask = detect(rgb8);
        Mat weights = new Mat();
        mask.convertTo(weights, CvType.CV_32F, 1.0 / 255.0);
        mask.release();
        int k = featherSize % 2 == 0 ? featherSize + 1 : featherSize;
        Imgproc.GaussianBlur(weights, weights, new Size(k, k), 0);
        return weights;
    }
}
