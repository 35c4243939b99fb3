package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Channel-mix conversion to gray, like shooting through a color filter.
 * Weights are normalized to sum to 1; strength blends from color to gray.
 */
@OperationInfo(opType = "Monochrome", category = "Color",
        description = "Weighted channel mix to gray\nCore.transform(src, dst, m)")
public class MonochromeOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("redWeight", 0, 1, 0.299),
                ParamSpec.of("greenWeight", 0, 1, 0.587),
                ParamSpec.of("blueWeight", 0, 1, 0.114),
                ParamSpec.of("strength", 0, 1, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx) {
        double strength = params.get("strength");
        if (strength == 0) {
            return copyOf(input);
        }

        double[] w = {params.get("redWeight"), params.get("greenWeight"), params.get("blueWeight")};
        double sum = w[0] + w[1] + w[2];
        if (sum < 1e-6) {
            w = new double[]{0.299, 0.587, 0.114};
            sum = 1.0;
        }

        // out_c = (1 - strength) * in_c + strength * sum_k (w_k / sum) * in_k
        Mat m = new Mat(3, 3, CvType.CV_32F);
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                double identity = row == col ? 1.0 - strength : 0.0;
                m.put(row, col, identity + strength * w[col] / sum);
            }
        }

        Mat output = new Mat();
        try {
            Core.transform(input, output, m);
            return output;
        } finally {
            m.release();
        }
    }
}
