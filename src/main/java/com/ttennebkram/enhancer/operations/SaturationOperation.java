package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * HSV saturation scaling with optional shadow desaturation and a
 * saturation ceiling on warm (skin) hues.
 */
@OperationInfo(opType = "Saturation", category = "Color",
        description = "Scale HSV saturation; desaturate shadows; cap warm hues")
public class SaturationOperation extends OperationBase {

    /** Value (0..1) below which shadow desaturation starts, 80 in 8-bit. */
    private static final double SHADOW_PIVOT = 80.0 / 255.0;

    /** Warm hue band in degrees: [0, 50] and [340, 360). */
    private static final double WARM_END = 50;
    private static final double WARM_START = 340;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("scale", 0, 2, 1),
                ParamSpec.of("shadowDesaturate", 0, 0.6, 0),
                ParamSpec.of("warmCeiling", 0.4, 1, 1));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double scale = params.get("scale");
        double shadowDesaturate = params.get("shadowDesaturate");
        double warmCeiling = params.get("warmCeiling");
        if (scale == 1 && shadowDesaturate == 0 && warmCeiling == 1) {
            return copyOf(input);
        }

        List<Mat> hsv = ColorSpaces.splitHsv(input);
        Mat factor = new Mat();
        Mat warm = new Mat();
        Mat warmHigh = new Mat();
        Mat capped = new Mat();
        try {
            Mat h = hsv.get(0);
            Mat s = hsv.get(1);
            Mat v = hsv.get(2);

            Core.multiply(s, new Scalar(scale), s);

            if (shadowDesaturate > 0) {
                // factor = 1 - shadowDesaturate * clamp((pivot - V) / pivot, 0, 1)
                v.convertTo(factor, -1, -1.0 / SHADOW_PIVOT, 1.0);
                Core.max(factor, new Scalar(0), factor);
                Core.min(factor, new Scalar(1), factor);
                factor.convertTo(factor, -1, -shadowDesaturate, 1.0);
                Core.multiply(s, factor, s);
            }

            if (warmCeiling < 1) {
                Core.inRange(h, new Scalar(0), new Scalar(WARM_END), warm);
                Core.inRange(h, new Scalar(WARM_START), new Scalar(360), warmHigh);
                Core.bitwise_or(warm, warmHigh, warm);
                Core.min(s, new Scalar(warmCeiling), capped);
                capped.copyTo(s, warm);
            }

            Core.min(s, new Scalar(1), s);
            ColorSpaces.requireFinite(s, getOpType());
            return ColorSpaces.mergeHsv(hsv);
        } finally {
            ColorSpaces.release(hsv);
            ColorSpaces.release(factor, warm, warmHigh, capped);
        }
    }
}
