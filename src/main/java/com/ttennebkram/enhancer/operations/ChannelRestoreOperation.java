package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Restores the red channel that water absorbs and trims the excess blue:
 * R' = R * redGain + redOffset, B' = B * blueGain.
 */
@OperationInfo(opType = "ChannelRestore", category = "Color",
        description = "Affine red/blue channel restoration for underwater scenes")
public class ChannelRestoreOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("redOffset", 0, 60, 0),
                ParamSpec.of("redGain", 1, 1.6, 1),
                ParamSpec.of("blueGain", 0.7, 1.1, 1));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx) {
        double redOffset = params.get("redOffset");
        double redGain = params.get("redGain");
        double blueGain = params.get("blueGain");
        if (redOffset == 0 && redGain == 1 && blueGain == 1) {
            return copyOf(input);
        }

        // 3x4 affine matrix, last column is the offset
        Mat m = new Mat(3, 4, CvType.CV_32F);
        m.put(0, 0,
                redGain, 0, 0, redOffset,
                0, 1, 0, 0,
                0, 0, blueGain, 0);

        Mat output = new Mat();
        try {
            Core.transform(input, output, m);
            return output;
        } finally {
            m.release();
        }
    }
}
