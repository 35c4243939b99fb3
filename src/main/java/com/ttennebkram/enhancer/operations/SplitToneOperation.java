package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * Separate temperature/tint offsets for shadows and highlights.
 *
 * The shadow weight falls linearly from 1 at black to 0 at the pivot; the
 * highlight weight rises from 0 at the pivot to 1 at white.
 */
@OperationInfo(opType = "SplitTone", category = "Color",
        description = "Lab a/b offsets weighted by shadow and highlight masks")
public class SplitToneOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("shadowTemperature", -15, 15, 0),
                ParamSpec.of("shadowTint", -15, 15, 0),
                ParamSpec.of("highlightTemperature", -15, 15, 0),
                ParamSpec.of("highlightTint", -15, 15, 0),
                ParamSpec.of("pivot", 0.2, 0.8, 0.5));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double shadowTemperature = params.get("shadowTemperature");
        double shadowTint = params.get("shadowTint");
        double highlightTemperature = params.get("highlightTemperature");
        double highlightTint = params.get("highlightTint");
        double pivot = params.get("pivot");
        if (shadowTemperature == 0 && shadowTint == 0 && highlightTemperature == 0 && highlightTint == 0) {
            return copyOf(input);
        }

        List<Mat> lab = ColorSpaces.splitLab(input);
        Mat shadows = new Mat();
        Mat highlights = new Mat();
        try {
            Mat l = lab.get(0);
            Mat a = lab.get(1);
            Mat b = lab.get(2);

            // shadows = 1 - (L / 255) / pivot
            l.convertTo(shadows, -1, -1.0 / (255.0 * pivot), 1.0);
            clampUnit(shadows);
            // highlights = (L / 255 - pivot) / (1 - pivot)
            l.convertTo(highlights, -1, 1.0 / (255.0 * (1.0 - pivot)), -pivot / (1.0 - pivot));
            clampUnit(highlights);

            Core.scaleAdd(shadows, shadowTint, a, a);
            Core.scaleAdd(highlights, highlightTint, a, a);
            Core.scaleAdd(shadows, shadowTemperature, b, b);
            Core.scaleAdd(highlights, highlightTemperature, b, b);
            ColorSpaces.requireFinite(a, getOpType());
            ColorSpaces.requireFinite(b, getOpType());

            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
            ColorSpaces.release(shadows, highlights);
        }
    }

    private static void clampUnit(Mat m) {
        Core.max(m, new Scalar(0), m);
        Core.min(m, new Scalar(1), m);
    }
}
