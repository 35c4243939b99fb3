package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import com.ttennebkram.enhancer.processing.SkinDetector;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unsharp mask.
 *
 * Detail below {@code threshold} (8-bit levels) is left alone so flat areas
 * and fine noise are not amplified. With {@code protectSkin} the amount is
 * reduced on detected skin.
 */
@OperationInfo(opType = "Sharpen", category = "Detail",
        description = "Unsharp mask with threshold and skin protection")
public class SharpenOperation extends OperationBase {

    private static final int SKIN_FEATHER = 21;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("amount", 0, 1.5, 0),
                ParamSpec.of("radius", 0.5, 3, 1),
                ParamSpec.of("threshold", 0, 10, 0),
                ParamSpec.of("protectSkin", 0, 1, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double amount = params.get("amount");
        double radius = params.get("radius");
        double threshold = params.get("threshold");
        double protectSkin = params.get("protectSkin");
        if (amount == 0) {
            return copyOf(input);
        }

        Mat f = new Mat();
        Mat blurred = new Mat();
        Mat detail = new Mat();
        Mat magnitude = new Mat();
        Mat keep = new Mat();
        Mat skin = null;
        Mat weights = new Mat();
        try {
            input.convertTo(f, CvType.CV_32FC3);
            Imgproc.GaussianBlur(f, blurred, new Size(0, 0), radius);
            Core.subtract(f, blurred, detail);

            if (threshold > 0) {
                Core.absdiff(detail, new Scalar(0, 0, 0), magnitude);
                // compare against a scalar wants one channel
                Core.compare(magnitude.reshape(1), new Scalar(threshold), keep, Core.CMP_GE);
                keep.reshape(3).convertTo(keep, CvType.CV_32FC3, 1.0 / 255.0);
                Core.multiply(detail, keep, detail);
            }

            if (protectSkin > 0) {
                // weight = amount * (1 - protectSkin * skin)
                skin = SkinDetector.softMask(input, SKIN_FEATHER);
                skin.convertTo(skin, -1, -amount * protectSkin, amount);
                List<Mat> planes = new ArrayList<>(Collections.nCopies(3, skin));
                Core.merge(planes, weights);
                Core.multiply(detail, weights, detail);
                Core.add(f, detail, f);
            } else {
                Core.scaleAdd(detail, amount, f, f);
            }
            ColorSpaces.requireFinite(f, getOpType());

            Mat output = new Mat();
            f.convertTo(output, CvType.CV_8UC3);
            return output;
        } finally {
            ColorSpaces.release(f, blurred, detail, magnitude, keep, skin, weights);
        }
    }
}
