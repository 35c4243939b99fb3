package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * CLAHE (Contrast Limited Adaptive Histogram Equalization) on Lab L.
 *
 * The CLAHE correction is added to the float L plane weighted by
 * min(1, std(L) / 8). Flat images (std below one level) come back unchanged,
 * so uniform areas are never stretched into banding.
 */
@OperationInfo(opType = "LocalContrast", category = "Tone",
        description = "CLAHE on Lab L\nImgproc.createCLAHE(clipLimit, tileGrid)")
public class LocalContrastOperation extends OperationBase {

    private static final double FLAT_STD = 1.0;
    private static final double FULL_EFFECT_STD = 8.0;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("clipLimit", 0, 4, 1),
                ParamSpec.of("tileGrid", 2, 16, 8));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double clipLimit = params.get("clipLimit");
        int tileGrid = (int) Math.round(params.get("tileGrid"));
        if (clipLimit == 0) {
            return copyOf(input);
        }

        List<Mat> lab = ColorSpaces.splitLab(input);
        Mat l8 = new Mat();
        Mat equalized = new Mat();
        Mat correction = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            Mat l = lab.get(0);
            Core.meanStdDev(l, mean, std);
            double spread = std.get(0, 0)[0];
            if (spread < FLAT_STD) {
                return copyOf(input);
            }
            double weight = Math.min(1.0, spread / FULL_EFFECT_STD);

            l.convertTo(l8, CvType.CV_8U);
            CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(tileGrid, tileGrid));
            clahe.apply(l8, equalized);

            // correction = equalized - round(L), in float
            equalized.convertTo(correction, CvType.CV_32F);
            l8.convertTo(l8, CvType.CV_32F);
            Core.subtract(correction, l8, correction);
            Core.scaleAdd(correction, weight, l, l);
            ColorSpaces.requireFinite(l, getOpType());

            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
            ColorSpaces.release(l8, equalized, correction, mean, std);
        }
    }
}
