package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Rotates and boosts one band of hues.
 *
 * Pixels are weighted by a raised-cosine window of half-width {@code width}
 * degrees around {@code center}; hues outside the window are left as they are.
 */
@OperationInfo(opType = "HueShift", category = "Color",
        description = "Raised-cosine hue window: rotate hue and boost saturation inside it")
public class HueShiftOperation extends OperationBase {

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("center", 0, 360, 90),
                ParamSpec.of("width", 5, 90, 30),
                ParamSpec.of("shift", -30, 30, 0),
                ParamSpec.of("saturationBoost", 0, 0.3, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        double center = params.get("center");
        double width = params.get("width");
        double shift = params.get("shift");
        double boost = params.get("saturationBoost");
        if (shift == 0 && boost == 0) {
            return copyOf(input);
        }

        List<Mat> hsv = ColorSpaces.splitHsv(input);
        try {
            Mat h = hsv.get(0);
            Mat s = hsv.get(1);
            int cols = h.cols();
            int length = arrayLength(getOpType(), h.rows(), cols, 1);
            float[] hue = new float[length];
            float[] sat = new float[length];
            h.get(0, 0, hue);
            s.get(0, 0, sat);

            ctx.forEachRow(h.rows(), row -> {
                int start = row * cols;
                for (int i = start; i < start + cols; i++) {
                    double w = window(hue[i], center, width);
                    if (w == 0) continue;
                    double shifted = (hue[i] + shift * w) % 360.0;
                    if (shifted < 0) shifted += 360.0;
                    hue[i] = (float) shifted;
                    sat[i] = (float) Math.min(1.0, sat[i] * (1.0 + boost * w));
                }
            });

            h.put(0, 0, hue);
            s.put(0, 0, sat);
            ColorSpaces.requireFinite(h, getOpType());
            ColorSpaces.requireFinite(s, getOpType());
            return ColorSpaces.mergeHsv(hsv);
        } finally {
            ColorSpaces.release(hsv);
        }
    }

    /**
     * Raised-cosine weight in [0, 1] of a hue relative to the window.
     */
    static double window(double hue, double center, double width) {
        double d = Math.abs(hue - center) % 360.0;
        if (d > 180.0) d = 360.0 - d;
        if (d >= width) return 0.0;
        return 0.5 * (1.0 + Math.cos(Math.PI * d / width));
    }
}
