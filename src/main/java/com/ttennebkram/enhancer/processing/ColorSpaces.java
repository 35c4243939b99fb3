package com.ttennebkram.enhancer.processing;

import com.ttennebkram.enhancer.OperationFailureException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Color conversions shared by the operations.
 *
 * Lab planes are returned as CV_32F in the familiar 8-bit Lab units
 * (L in 0..255, a/b centered on 128) so parameters tuned against 8-bit Lab
 * keep their meaning, without the rounding of an 8-bit round trip.
 * HSV planes are CV_32F with hue in degrees [0, 360) and S, V in [0, 1].
 */
public final class ColorSpaces {

    /** Scale from OpenCV float L (0..100) to 8-bit L units (0..255). */
    public static final double L_SCALE = 255.0 / 100.0;

    /** Offset of the a and b planes in 8-bit Lab units. */
    public static final double AB_OFFSET = 128.0;

    private ColorSpaces() {
    }

    /**
     * 8-bit RGB to CV_32FC3 in [0, 1].
     */
    public static Mat toFloat(Mat rgb8) {
        Mat f = new Mat();
        rgb8.convertTo(f, CvType.CV_32FC3, 1.0 / 255.0);
        return f;
    }

    /**
     * CV_32FC3 in [0, 1] back to 8-bit RGB. Rounds and saturates, so the
     * result always lies in 0..255.
     */
    public static Mat toByte(Mat rgbFloat) {
        Mat b = new Mat();
        rgbFloat.convertTo(b, CvType.CV_8UC3, 255.0);
        return b;
    }

    /**
     * Split an 8-bit RGB image into float L, a, b planes in 8-bit Lab units.
     */
    public static List<Mat> splitLab(Mat rgb8) {
        Mat f = toFloat(rgb8);
        Mat lab = new Mat();
        Imgproc.cvtColor(f, lab, Imgproc.COLOR_RGB2Lab);
        f.release();

        List<Mat> planes = new ArrayList<>();
        Core.split(lab, planes);
        lab.release();

        planes.get(0).convertTo(planes.get(0), -1, L_SCALE);
        Core.add(planes.get(1), new Scalar(AB_OFFSET), planes.get(1));
        Core.add(planes.get(2), new Scalar(AB_OFFSET), planes.get(2));
        return planes;
    }

    /**
     * Merge L, a, b planes in 8-bit Lab units back to 8-bit RGB.
     * The planes are left untouched.
     */
    public static Mat mergeLab(List<Mat> planes) {
        List<Mat> raw = new ArrayList<>(3);
        Mat l = new Mat();
        planes.get(0).convertTo(l, -1, 1.0 / L_SCALE);
        Mat a = new Mat();
        Core.subtract(planes.get(1), new Scalar(AB_OFFSET), a);
        Mat b = new Mat();
        Core.subtract(planes.get(2), new Scalar(AB_OFFSET), b);
        raw.add(l);
        raw.add(a);
        raw.add(b);

        Mat lab = new Mat();
        Core.merge(raw, lab);
        release(raw);

        Mat rgbFloat = new Mat();
        Imgproc.cvtColor(lab, rgbFloat, Imgproc.COLOR_Lab2RGB);
        lab.release();

        Mat out = toByte(rgbFloat);
        rgbFloat.release();
        return out;
    }

    /**
     * Split an 8-bit RGB image into float H (degrees), S and V planes.
     */
    public static List<Mat> splitHsv(Mat rgb8) {
        Mat f = toFloat(rgb8);
        Mat hsv = new Mat();
        Imgproc.cvtColor(f, hsv, Imgproc.COLOR_RGB2HSV);
        f.release();

        List<Mat> planes = new ArrayList<>();
        Core.split(hsv, planes);
        hsv.release();
        return planes;
    }

    /**
     * Merge float H, S, V planes back to 8-bit RGB.
     */
    public static Mat mergeHsv(List<Mat> planes) {
        Mat hsv = new Mat();
        Core.merge(planes, hsv);

        Mat rgbFloat = new Mat();
        Imgproc.cvtColor(hsv, rgbFloat, Imgproc.COLOR_HSV2RGB);
        hsv.release();

        Mat out = toByte(rgbFloat);
        rgbFloat.release();
        return out;
    }

    /**
     * Rec.601 luma of an 8-bit RGB image as an 8-bit single channel Mat.
     */
    public static Mat luma(Mat rgb8) {
        Mat gray = new Mat();
        Imgproc.cvtColor(rgb8, gray, Imgproc.COLOR_RGB2GRAY);
        return gray;
    }

    /**
     * Throw if any element of a floating point Mat is NaN or infinite.
     */
    public static void requireFinite(Mat mat, String opType) throws OperationFailureException {
        if (!Core.checkRange(mat)) {
            throw new OperationFailureException(opType, "non-finite intermediate value");
        }
    }

    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }

    public static void release(List<Mat> mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }
}
