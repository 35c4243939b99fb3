package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;
import java.util.Random;

/**
 * Film grain: Gaussian luminance noise added equally to R, G and B.
 *
 * Every row draws from its own generator seeded from (seed, row), so the
 * output depends only on the seed, never on thread scheduling.
 */
@OperationInfo(opType = "Grain", category = "Effect",
        description = "Seeded Gaussian luminance grain")
public class GrainOperation extends OperationBase {

    private static final long ROW_MIX = 0x9E3779B97F4A7C15L;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("amount", 0, 15, 0),
                ParamSpec.of("seed", 0, Integer.MAX_VALUE, 1337));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double amount = params.get("amount");
        long seed = (long) params.get("seed");
        if (amount == 0) {
            return copyOf(input);
        }

        int rows = input.rows();
        int cols = input.cols();
        byte[] pixels = new byte[arrayLength(getOpType(), rows, cols, 3)];
        int rowLength = cols * 3;
        Mat source = input.isContinuous() ? input : input.clone();
        source.get(0, 0, pixels);
        if (source != input) {
            source.release();
        }

        ctx.forEachRow(rows, row -> {
            Random random = new Random(seed + row * ROW_MIX);
            int start = row * rowLength;
            for (int i = start; i < start + rowLength; i += 3) {
                int noise = (int) Math.round(random.nextGaussian() * amount);
                for (int c = 0; c < 3; c++) {
                    int v = (pixels[i + c] & 0xFF) + noise;
                    pixels[i + c] = (byte) Math.max(0, Math.min(255, v));
                }
            }
        });

        Mat output = new Mat(rows, cols, CvType.CV_8UC3);
        output.put(0, 0, pixels);
        return output;
    }
}
