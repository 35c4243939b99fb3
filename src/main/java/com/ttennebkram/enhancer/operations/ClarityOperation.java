package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Midtone structure: a large-radius high-pass of Lab L added back to L.
 */
@OperationInfo(opType = "Clarity", category = "Detail",
        description = "Large-radius high-pass added to Lab L")
public class ClarityOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("radius", 1, 12, 4),
                ParamSpec.of("amount", 0, 0.6, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double radius = params.get("radius");
        double amount = params.get("amount");
        if (amount == 0) {
            return copyOf(input);
        }

        List<Mat> lab = ColorSpaces.splitLab(input);
        Mat blurred = new Mat();
        Mat detail = new Mat();
        try {
            Mat l = lab.get(0);
            Imgproc.GaussianBlur(l, blurred, new Size(0, 0), radius);
            Core.subtract(l, blurred, detail);
            Core.scaleAdd(detail, amount, l, l);
            ColorSpaces.requireFinite(l, getOpType());
            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
            ColorSpaces.release(blurred, detail);
        }
    }
}
