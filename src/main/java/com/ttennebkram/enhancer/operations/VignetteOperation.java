package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Radial darkening towards the corners.
 *
 * The gain is 1 - strength * min(1, d / radius)^2 where d is the distance
 * from the image center divided by the half-diagonal.
 */
@OperationInfo(opType = "Vignette", category = "Effect",
        description = "Radial quadratic darkening")
public class VignetteOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("strength", 0, 0.5, 0),
                ParamSpec.of("radius", 0.8, 1.6, 1.1));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double strength = params.get("strength");
        double radius = params.get("radius");
        if (strength == 0) {
            return copyOf(input);
        }

        int rows = input.rows();
        int cols = input.cols();
        double cx = (cols - 1) / 2.0;
        double cy = (rows - 1) / 2.0;
        double halfDiagonal = Math.max(1e-6, Math.sqrt(cx * cx + cy * cy));

        float[] gain = new float[arrayLength(getOpType(), rows, cols, 1)];
        ctx.forEachRow(rows, row -> {
            double dy = row - cy;
            int start = row * cols;
            for (int x = 0; x < cols; x++) {
                double dx = x - cx;
                double d = Math.min(1.0, Math.sqrt(dx * dx + dy * dy) / halfDiagonal / radius);
                gain[start + x] = (float) (1.0 - strength * d * d);
            }
        });

        Mat gainMap = new Mat(rows, cols, CvType.CV_32F);
        Mat gain3 = new Mat();
        Mat f = ColorSpaces.toFloat(input);
        try {
            gainMap.put(0, 0, gain);
            List<Mat> planes = new ArrayList<>(Collections.nCopies(3, gainMap));
            Core.merge(planes, gain3);
            Core.multiply(f, gain3, f);
            ColorSpaces.requireFinite(f, getOpType());
            return ColorSpaces.toByte(f);
        } finally {
            ColorSpaces.release(gainMap, gain3, f);
        }
    }
}
