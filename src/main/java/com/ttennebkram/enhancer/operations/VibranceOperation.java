package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * Saturation change weighted towards muted pixels:
 * s' = s * (1 + strength * (1 - s)). Fully saturated pixels stay put.
 */
@OperationInfo(opType = "Vibrance", category = "Color",
        description = "s' = s * (1 + strength * (1 - s))")
public class VibranceOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(ParamSpec.of("strength", -0.5, 1, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double strength = params.get("strength");
        if (strength == 0) {
            return copyOf(input);
        }

        List<Mat> hsv = ColorSpaces.splitHsv(input);
        Mat factor = new Mat();
        try {
            Mat s = hsv.get(1);
            // factor = 1 + strength * (1 - s) = (1 + strength) - strength * s
            s.convertTo(factor, -1, -strength, 1.0 + strength);
            Core.multiply(s, factor, s);
            Core.max(s, new Scalar(0), s);
            Core.min(s, new Scalar(1), s);
            ColorSpaces.requireFinite(s, getOpType());
            return ColorSpaces.mergeHsv(hsv);
        } finally {
            ColorSpaces.release(hsv);
            factor.release();
        }
    }
}
