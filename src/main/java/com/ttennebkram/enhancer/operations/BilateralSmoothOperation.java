package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Bilateral filter - smooths while preserving edges.
 */
@OperationInfo(opType = "BilateralSmooth", category = "Detail",
        description = "Bilateral filter\nImgproc.bilateralFilter(src, dst, d, sigmaColor, sigmaSpace)")
public class BilateralSmoothOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("diameter", 1, 15, 5),
                ParamSpec.of("sigmaColor", 0, 150, 0),
                ParamSpec.of("sigmaSpace", 1, 150, 25));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx) {
        int diameter = (int) Math.round(params.get("diameter"));
        double sigmaColor = params.get("sigmaColor");
        double sigmaSpace = params.get("sigmaSpace");
        if (sigmaColor == 0) {
            return copyOf(input);
        }

        Mat output = new Mat();
        Imgproc.bilateralFilter(input, output, diameter, sigmaColor, sigmaSpace);
        return output;
    }
}
