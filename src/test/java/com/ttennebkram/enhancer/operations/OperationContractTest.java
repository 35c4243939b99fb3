package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.TestImages;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behavior every operation shares, checked with settings that make each one
 * do real work.
 */
class OperationContractTest {

    static final Map<String, ParameterValues> ACTIVE = new LinkedHashMap<>();

    static {
        ACTIVE.put("WhiteBalance", ParameterValues.of("grayWorld", 1.0, "neutralize", 0.3));
        ACTIVE.put("ColorBalance", ParameterValues.of("temperature", 8.0, "tint", -4.0));
        ACTIVE.put("SplitTone", ParameterValues.of("shadowTemperature", 8.0, "highlightTint", -5.0));
        ACTIVE.put("Exposure", ParameterValues.of("target", 0.6, "strength", 1.0));
        ACTIVE.put("ToneCurve", ParameterValues.of("shadowLift", 20.0, "sCurve", 2.0, "fade", 0.1));
        ACTIVE.put("LocalContrast", ParameterValues.of("clipLimit", 2.0));
        ACTIVE.put("Clarity", ParameterValues.of("amount", 0.4));
        ACTIVE.put("Denoise", ParameterValues.of("strength", 6.0));
        ACTIVE.put("BilateralSmooth", ParameterValues.of("sigmaColor", 40.0));
        ACTIVE.put("SkinSoften", ParameterValues.of("strength", 0.8));
        ACTIVE.put("Saturation", ParameterValues.of("scale", 1.3, "shadowDesaturate", 0.3, "warmCeiling", 0.6));
        ACTIVE.put("Vibrance", ParameterValues.of("strength", 0.5));
        ACTIVE.put("HueShift", ParameterValues.of("center", 120.0, "width", 60.0, "shift", 20.0, "saturationBoost", 0.2));
        ACTIVE.put("Monochrome", ParameterValues.of("strength", 1.0));
        ACTIVE.put("ChannelRestore", ParameterValues.of("redOffset", 20.0, "redGain", 1.3, "blueGain", 0.8));
        ACTIVE.put("Sharpen", ParameterValues.of("amount", 1.0, "threshold", 2.0, "protectSkin", 0.5));
        ACTIVE.put("Vignette", ParameterValues.of("strength", 0.3));
        ACTIVE.put("Grain", ParameterValues.of("amount", 8.0));
    }

    @Test
    void everyOperationHasActiveSettings() {
        assertEquals(OperationRegistryTest.ALL_TYPES, ACTIVE.keySet());
    }

    @Test
    void outputHasInputShapeAndInputIsUntouched() throws OperationFailureException {
        Mat input = TestImages.colorful(48, 40);
        byte[] before = TestImages.bytes(input);
        for (Map.Entry<String, ParameterValues> e : ACTIVE.entrySet()) {
            Operation op = OperationRegistry.requireOperation(e.getKey());
            Mat output = op.process(input, e.getValue(), ProcessingContext.SERIAL);

            assertNotSame(input, output);
            assertEquals(input.rows(), output.rows(), e.getKey());
            assertEquals(input.cols(), output.cols(), e.getKey());
            assertEquals(CvType.CV_8UC3, output.type(), e.getKey());
            assertArrayEquals(before, TestImages.bytes(input), e.getKey() + " modified its input");
            output.release();
        }
    }

    @Test
    void activeSettingsChangeThePicture() throws OperationFailureException {
        Mat input = TestImages.colorful(48, 40);
        for (Map.Entry<String, ParameterValues> e : ACTIVE.entrySet()) {
            Mat output = OperationRegistry.requireOperation(e.getKey())
                    .process(input, e.getValue(), ProcessingContext.SERIAL);
            assertTrue(TestImages.maxAbsDiff(input, output) > 0, e.getKey());
            output.release();
        }
    }

    @Test
    void defaultsLeaveThePictureAlone() throws OperationFailureException {
        Mat input = TestImages.colorful(48, 40);
        for (String type : ACTIVE.keySet()) {
            Mat output = OperationRegistry.requireOperation(type)
                    .process(input, ParameterValues.EMPTY, ProcessingContext.SERIAL);
            // LocalContrast is the one operation active at its defaults
            if (!type.equals("LocalContrast")) {
                assertEquals(0.0, TestImages.maxAbsDiff(input, output), type);
            }
            output.release();
        }
    }

    @Test
    void serialAndParallelRunsAgree() throws OperationFailureException {
        Mat input = TestImages.darkNoisy(64, 56, 7);
        for (Map.Entry<String, ParameterValues> e : ACTIVE.entrySet()) {
            Operation op = OperationRegistry.requireOperation(e.getKey());
            Mat serial = op.process(input, e.getValue(), ProcessingContext.SERIAL);
            Mat parallel = op.process(input, e.getValue(), ProcessingContext.PARALLEL);
            assertEquals(0.0, TestImages.maxAbsDiff(serial, parallel), e.getKey());
            serial.release();
            parallel.release();
        }
    }

    @Test
    void tinyImagesAreHandled() throws OperationFailureException {
        Mat[] inputs = {TestImages.uniform(1, 1, 200, 100, 50), TestImages.colorful(2, 3), TestImages.colorful(7, 1)};
        for (Mat input : inputs) {
            for (Map.Entry<String, ParameterValues> e : ACTIVE.entrySet()) {
                Mat output = OperationRegistry.requireOperation(e.getKey())
                        .process(input, e.getValue(), ProcessingContext.SERIAL);
                assertEquals(input.size(), output.size(), e.getKey());
                output.release();
            }
        }
    }

    @Test
    void outOfRangeValuesAreClamped() throws OperationFailureException {
        Mat input = TestImages.colorful(32, 32);
        Operation op = OperationRegistry.requireOperation("Vibrance");
        Mat clamped = op.process(input, ParameterValues.of("strength", 50.0), ProcessingContext.SERIAL);
        Mat max = op.process(input, ParameterValues.of("strength", 1.0), ProcessingContext.SERIAL);
        assertEquals(0.0, TestImages.maxAbsDiff(clamped, max));
    }

    @Test
    void nonFiniteParametersFail() {
        Mat input = TestImages.colorful(16, 16);
        for (String type : ACTIVE.keySet()) {
            Operation op = OperationRegistry.requireOperation(type);
            String param = op.getParameters().get(0).getName();
            OperationFailureException e = assertThrows(OperationFailureException.class,
                    () -> op.process(input, ParameterValues.of(param, Double.NaN), ProcessingContext.SERIAL));
            assertEquals(type, e.getOpType());
            assertThrows(OperationFailureException.class,
                    () -> op.process(input, ParameterValues.of(param, Double.POSITIVE_INFINITY), ProcessingContext.SERIAL));
        }
    }

    @Test
    void invalidInputFails() {
        Mat gray = new Mat(8, 8, CvType.CV_8UC1);
        Mat floats = new Mat(8, 8, CvType.CV_32FC3);
        for (String type : ACTIVE.keySet()) {
            Operation op = OperationRegistry.requireOperation(type);
            assertThrows(OperationFailureException.class, () -> op.process(null, ParameterValues.EMPTY, ProcessingContext.SERIAL));
            assertThrows(OperationFailureException.class, () -> op.process(new Mat(), ParameterValues.EMPTY, ProcessingContext.SERIAL));
            assertThrows(OperationFailureException.class, () -> op.process(gray, ParameterValues.EMPTY, ProcessingContext.SERIAL));
            assertThrows(OperationFailureException.class, () -> op.process(floats, ParameterValues.EMPTY, ProcessingContext.SERIAL));
        }
    }

    @Test
    void undeclaredParameterIsRejected() {
        Operation op = OperationRegistry.requireOperation("Grain");
        assertThrows(IllegalArgumentException.class,
                () -> op.process(TestImages.midGray(8, 8), ParameterValues.of("sigma", 3.0), ProcessingContext.SERIAL));
    }

    @Test
    void boundProcessorMatchesDirectCall() throws OperationFailureException {
        Mat input = TestImages.colorful(24, 24);
        Operation op = OperationRegistry.requireOperation("ToneCurve");
        ParameterValues params = ACTIVE.get("ToneCurve");
        Mat direct = op.process(input, params, ProcessingContext.SERIAL);
        Mat bound = op.bind(params, ProcessingContext.SERIAL).process(input);
        assertEquals(0.0, TestImages.maxAbsDiff(direct, bound));
    }
}
