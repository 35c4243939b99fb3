package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * Gray-world white balance followed by a pull of the mean a/b chroma
 * towards neutral.
 *
 * The gray-world gains are rescaled so the mean Rec.601 luma does not move.
 */
@OperationInfo(opType = "WhiteBalance", category = "Color",
        description = "Gray-world channel gains (luma preserving) and Lab chroma neutralization")
public class WhiteBalanceOperation extends OperationBase {

    private static final double EPS = 1e-6;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("grayWorld", 0, 1, 0),
                ParamSpec.of("neutralize", 0, 0.5, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double grayWorld = params.get("grayWorld");
        double neutralize = params.get("neutralize");
        if (grayWorld == 0 && neutralize == 0) {
            return copyOf(input);
        }

        Mat balanced = grayWorld > 0 ? grayWorld(input, grayWorld) : copyOf(input);
        if (neutralize == 0) {
            return balanced;
        }

        List<Mat> lab = ColorSpaces.splitLab(balanced);
        balanced.release();
        try {
            for (int i = 1; i <= 2; i++) {
                double mean = Core.mean(lab.get(i)).val[0];
                Core.subtract(lab.get(i), new Scalar(neutralize * (mean - ColorSpaces.AB_OFFSET)), lab.get(i));
            }
            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
        }
    }

    private Mat grayWorld(Mat input, double strength) throws OperationFailureException {
        Scalar means = Core.mean(input);
        double r = means.val[0];
        double g = means.val[1];
        double b = means.val[2];
        double gray = (r + g + b) / 3.0;

        double gr = gain(gray, r, strength);
        double gg = gain(gray, g, strength);
        double gb = gain(gray, b, strength);

        // Keep the mean luma where it was
        double lumaBefore = 0.299 * r + 0.587 * g + 0.114 * b;
        double lumaAfter = 0.299 * gr * r + 0.587 * gg * g + 0.114 * gb * b;
        if (lumaAfter > EPS) {
            double k = lumaBefore / lumaAfter;
            gr *= k;
            gg *= k;
            gb *= k;
        }

        Mat f = ColorSpaces.toFloat(input);
        try {
            Core.multiply(f, new Scalar(gr, gg, gb), f);
            ColorSpaces.requireFinite(f, getOpType());
            return ColorSpaces.toByte(f);
        } finally {
            f.release();
        }
    }

    private static double gain(double gray, double channelMean, double strength) {
        if (channelMean < EPS) {
            return 1.0;
        }
        return 1.0 + strength * (gray / channelMean - 1.0);
    }
}
