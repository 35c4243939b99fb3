package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ColorSpaces;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Composite tone curve on Lab L.
 *
 * All shaping terms are folded into one 256-entry table (L in 8-bit units)
 * that is sampled with linear interpolation. The table is clamped to 0..255
 * and forced non-decreasing, so the curve never inverts tones.
 */
@OperationInfo(opType = "ToneCurve", category = "Tone",
        description = "Shadow lift, highlight recovery, contrast, S-curve, flatten, fade and black crush on L")
public class ToneCurveOperation extends OperationBase {

    private static final double SHADOW_PIVOT = 90;
    private static final double HIGHLIGHT_START = 180;
    private static final double HIGHLIGHT_SPAN = 75;
    private static final double CRUSH_PIVOT = 30;
    private static final double MID = 128;
    private static final double FADE_LEVEL = 166;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("shadowLift", 0, 40, 0),
                ParamSpec.of("highlightRecover", -15, 30, 0),
                ParamSpec.of("contrast", 0.7, 1.4, 1),
                ParamSpec.of("sCurve", 0, 4, 0),
                ParamSpec.of("flatten", 0, 0.3, 0),
                ParamSpec.of("fade", 0, 0.2, 0),
                ParamSpec.of("crush", 0, 0.6, 0));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        if (isIdentity(params)) {
            return copyOf(input);
        }
        float[] curve = buildCurve(params);

        List<Mat> lab = ColorSpaces.splitLab(input);
        try {
            Mat l = lab.get(0);
            int cols = l.cols();
            float[] data = new float[arrayLength(getOpType(), l.rows(), cols, 1)];
            l.get(0, 0, data);
            ctx.forEachRow(l.rows(), row -> {
                int start = row * cols;
                for (int i = start; i < start + cols; i++) {
                    data[i] = sample(curve, data[i]);
                }
            });
            l.put(0, 0, data);
            ColorSpaces.requireFinite(l, getOpType());
            return ColorSpaces.mergeLab(lab);
        } finally {
            ColorSpaces.release(lab);
        }
    }

    private static boolean isIdentity(ParameterValues p) {
        return p.get("shadowLift") == 0 && p.get("highlightRecover") == 0 && p.get("contrast") == 1
                && p.get("sCurve") == 0 && p.get("flatten") == 0 && p.get("fade") == 0 && p.get("crush") == 0;
    }

    /**
     * The 256-entry curve for the given (resolved) parameters.
     */
    static float[] buildCurve(ParameterValues p) {
        double shadowLift = p.get("shadowLift");
        double highlightRecover = p.get("highlightRecover");
        double contrast = p.get("contrast");
        double sCurve = p.get("sCurve");
        double flatten = p.get("flatten");
        double fade = p.get("fade");
        double crush = p.get("crush");

        float[] curve = new float[256];
        double running = 0;
        for (int i = 0; i < 256; i++) {
            double y = i;

            if (y < SHADOW_PIVOT) {
                double t = 1.0 - y / SHADOW_PIVOT;
                y += shadowLift * t * t;
            }
            if (i > HIGHLIGHT_START) {
                double t = (i - HIGHLIGHT_START) / HIGHLIGHT_SPAN;
                y -= highlightRecover * t * t;
            }
            if (y < CRUSH_PIVOT && y > 0) {
                y = y * (1.0 - crush * (1.0 - y / CRUSH_PIVOT));
            }

            y = MID + contrast * (y - MID);

            if (sCurve > 0) {
                double t = clamp(y) / 255.0;
                t = 0.5 + Math.tanh(sCurve * (t - 0.5)) / (2.0 * Math.tanh(sCurve / 2.0));
                y = 255.0 * t;
            }

            y += flatten * (MID - y);
            y = y * (1.0 - fade) + fade * FADE_LEVEL;

            running = Math.max(running, clamp(y));
            curve[i] = (float) running;
        }
        return curve;
    }

    private static float sample(float[] curve, float x) {
        if (!(x > 0)) return curve[0];
        if (x >= 255) return curve[255];
        int i = (int) x;
        float frac = x - i;
        return curve[i] + frac * (curve[i + 1] - curve[i]);
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(255, v));
    }
}
