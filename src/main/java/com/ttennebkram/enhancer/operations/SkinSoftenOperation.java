package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import com.ttennebkram.enhancer.processing.SkinDetector;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Portrait skin smoothing: a bilateral-filtered copy blended in through a
 * feathered skin mask, so only skin areas are softened.
 */
@OperationInfo(opType = "SkinSoften", category = "Detail",
        description = "Bilateral smoothing restricted to detected skin")
public class SkinSoftenOperation extends OperationBase {

    private static final int FILTER_DIAMETER = 9;
    private static final int FEATHER = 31;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("strength", 0, 1, 0),
                ParamSpec.of("sigma", 10, 100, 55));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double strength = params.get("strength");
        double sigma = params.get("sigma");
        if (strength == 0) {
            return copyOf(input);
        }

        Mat smooth8 = new Mat();
        Mat mask = SkinDetector.softMask(input, FEATHER);
        Mat weights = new Mat();
        Mat original = null;
        Mat smooth = null;
        Mat delta = new Mat();
        try {
            Imgproc.bilateralFilter(input, smooth8, FILTER_DIAMETER, sigma, sigma);

            Core.multiply(mask, new Scalar(strength), mask);
            List<Mat> planes = new ArrayList<>(Collections.nCopies(3, mask));
            Core.merge(planes, weights);

            original = ColorSpaces.toFloat(input);
            smooth = ColorSpaces.toFloat(smooth8);
            Core.subtract(smooth, original, delta);
            Core.multiply(delta, weights, delta);
            Core.add(original, delta, original);
            ColorSpaces.requireFinite(original, getOpType());

            return ColorSpaces.toByte(original);
        } finally {
            ColorSpaces.release(smooth8, mask, weights, original, smooth, delta);
        }
    }
}
