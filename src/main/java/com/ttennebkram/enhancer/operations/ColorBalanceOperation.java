package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * Global temperature (Lab b) and tint (Lab a) offsets.
 * Positive temperature warms, positive tint moves towards magenta.
 */
@OperationInfo(opType = "ColorBalance", category = "Color",
        description = "Global Lab b (temperature) and a (tint) offsets")
public class ColorBalanceOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("temperature", -20, 20, 0),
                ParamSpec.of("tint", -20, 20, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double temperature = params.get("temperature");
        double tint = params.get("tint");
        if (temperature == 0 && tint == 0) {
            return copyOf(input);
        }

        List<Mat> lab = ColorSpaces.splitLab(input);
        try {
            Core.add(lab.get(1), new Scalar(tint), lab.get(1));
            Core.add(lab.get(2), new Scalar(temperature), lab.get(2));
            ColorSpaces.requireFinite(lab.get(1), getOpType());
            ColorSpaces.requireFinite(lab.get(2), getOpType());
            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
        }
    }
}
