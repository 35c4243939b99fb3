package com.ttennebkram.enhancer.processing;

import com.ttennebkram.enhancer.model.OutputFormat;
import com.ttennebkram.enhancer.model.PixelBuffer;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion between caller buffers (RGB/RGBA, 8 or 16 bit) and the 8-bit
 * RGB working image every operation consumes.
 */
public final class WorkingImages {

    /** 16-bit to 8-bit scale: 65535 / 255. */
    private static final double SCALE_16 = 257.0;

    private WorkingImages() {
    }

    /**
     * New 8-bit, 3 channel RGB copy of the buffer. Alpha is dropped.
     */
    public static Mat toWorkingRgb(PixelBuffer buffer) {
        Mat src = buffer.getMat();
        Mat rgb = new Mat();
        if (src.channels() == 4) {
            Imgproc.cvtColor(src, rgb, Imgproc.COLOR_RGBA2RGB);
        } else {
            src.copyTo(rgb);
        }
        if (buffer.getBitDepth() == 16) {
            rgb.convertTo(rgb, CvType.CV_8UC3, 1.0 / SCALE_16);
        }
        return rgb;
    }

    /**
     * Build the output buffer from the processed working image, matching the
     * source buffer's channel count. Alpha and 16-bit depth are kept only when
     * the output format can carry them; otherwise alpha is opaque and depth 8.
     */
    public static PixelBuffer toOutput(Mat workingRgb, PixelBuffer source, OutputFormat format) {
        boolean sixteen = source.getBitDepth() == 16 && format.keepsHighBitDepth();
        int depth = sixteen ? CvType.CV_16U : CvType.CV_8U;
        double scale = sixteen ? SCALE_16 : 1.0;

        Mat rgb = new Mat();
        workingRgb.convertTo(rgb, CvType.makeType(depth, 3), scale);
        if (!source.hasAlpha()) {
            return PixelBuffer.wrap(rgb);
        }

        Mat alpha;
        if (format.keepsAlpha()) {
            alpha = new Mat();
            Core.extractChannel(source.getMat(), alpha, 3);
            if (CvType.depth(alpha.type()) != depth) {
                alpha.convertTo(alpha, depth, 1.0 / SCALE_16);
            }
        } else {
            double opaque = sixteen ? 65535 : 255;
            alpha = new Mat(rgb.rows(), rgb.cols(), CvType.makeType(depth, 1), new Scalar(opaque));
        }

        List<Mat> planes = new ArrayList<>(4);
        Core.split(rgb, planes);
        planes.add(alpha);
        Mat rgba = new Mat();
        Core.merge(planes, rgba);
        ColorSpaces.release(planes);
        rgb.release();
        return PixelBuffer.wrap(rgba);
    }
}
