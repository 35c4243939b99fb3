package com.ttennebkram.enhancer.analysis;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.TestImages;
import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.model.PixelBuffer;
import com.ttennebkram.enhancer.operations.OperationRegistry;
import com.ttennebkram.enhancer.operations.ParameterValues;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageAnalyzerTest {

    private final ImageAnalyzer analyzer = new ImageAnalyzer();

    @Test
    void midGrayHasBoundaryValues() {
        CharacteristicVector v = analyzer.analyze(TestImages.midGray(64, 48));

        assertEquals(128 / 255.0, v.getBrightness(), 1e-3);
        assertEquals(0.0, v.getContrast(), 1e-9);
        assertEquals(0.0, v.getNoise(), 1e-9);
        assertEquals(0.0, v.getSharpness(), 1e-9);
        assertEquals(0.0, v.getSaturation(), 1e-9);
        assertEquals(0.0, v.getEdgeDensity(), 1e-9);
        assertEquals(0.0, v.getSkinRatio(), 1e-9);
        assertEquals(0.0, v.getRedCast(), 1e-3);
    }

    @Test
    void emptyBufferGivesEmptyVector() {
        assertSame(CharacteristicVector.EMPTY, analyzer.analyze(PixelBuffer.empty()));
        assertSame(CharacteristicVector.EMPTY, analyzer.analyze((PixelBuffer) null));
        assertSame(CharacteristicVector.EMPTY, analyzer.analyze(new Mat()));
    }

    @Test
    void flatNoiseIsMeasuredAsNoise() {
        double sigma = 8;
        CharacteristicVector v = analyzer.analyze(TestImages.flatNoise(128, 128, 128, sigma, 42));
        double expected = sigma / 255.0;
        assertTrue(v.getNoise() > 0.7 * expected && v.getNoise() < 1.3 * expected,
                "noise " + v.getNoise() + " should be close to " + expected);
    }

    @Test
    void sharpEdgesAreNotMistakenForNoise() {
        double grainy = analyzer.analyze(TestImages.flatNoise(128, 128, 128, 8, 7)).getNoise();
        double checker = analyzer.analyze(TestImages.checkerboard(128, 128, 8)).getNoise();
        double stripes = analyzer.analyze(TestImages.stripes(128, 128, 4)).getNoise();

        assertTrue(checker < 0.005, "checkerboard noise " + checker);
        assertTrue(stripes < 0.005, "stripe noise " + stripes);
        assertTrue(grainy > 5 * Math.max(checker, stripes), "grainy " + grainy);
    }

    @Test
    void fineTextureIsNotMistakenForNoise() {
        double threshold = EnhancerConfig.defaults().getNoiseHighThreshold();
        double grainy = analyzer.analyze(TestImages.flatNoise(128, 128, 128, 8, 7)).getNoise();

        Map<String, Mat> textures = new LinkedHashMap<>();
        textures.put("checkerboard 1", TestImages.checkerboard(128, 128, 1));
        textures.put("checkerboard 2", TestImages.checkerboard(128, 128, 2));
        textures.put("checkerboard 3", TestImages.checkerboard(128, 128, 3));
        textures.put("weave 3/20", TestImages.weave(128, 128, 3, 20));
        textures.put("weave 3/40", TestImages.weave(128, 128, 3, 40));
        textures.put("weave 4/40", TestImages.weave(128, 128, 4, 40));

        for (Map.Entry<String, Mat> e : textures.entrySet()) {
            double noise = analyzer.analyze(e.getValue()).getNoise();
            assertTrue(noise < threshold, e.getKey() + " noise " + noise);
            assertTrue(noise < grainy / 4, e.getKey() + " noise " + noise + " vs grain " + grainy);
        }
    }

    @Test
    void grainOnFineTextureIsStillMeasured() {
        double expected = 8 / 255.0;
        double noise = analyzer.analyze(TestImages.weave(128, 128, 4, 40, 8, 11)).getNoise();
        assertTrue(noise > 0.7 * expected && noise < 1.3 * expected,
                "noise " + noise + " should be close to " + expected);
    }

    @Test
    void heavyGrainCrossesTheHighNoiseThreshold() {
        double threshold = EnhancerConfig.defaults().getNoiseHighThreshold();
        double noise = analyzer.analyze(TestImages.flatNoise(128, 128, 128, 14, 5)).getNoise();
        assertTrue(noise > threshold, "noise " + noise);
    }

    @Test
    void edgesRaiseSharpnessAndEdgeDensity() {
        CharacteristicVector checker = analyzer.analyze(TestImages.checkerboard(64, 64, 8));
        assertTrue(checker.getSharpness() > 0.05);
        assertTrue(checker.getEdgeDensity() > 0.1);
        assertTrue(checker.getContrast() > 0.9);
    }

    @Test
    void darkAndBrightRatios() {
        CharacteristicVector v = analyzer.analyze(TestImages.checkerboard(64, 64, 8));
        assertEquals(0.5, v.getDarkRatio(), 1e-9);
        assertEquals(0.5, v.getBrightRatio(), 1e-9);
    }

    @Test
    void hueFamilies() {
        assertEquals(1.0, analyzer.analyze(TestImages.uniform(16, 16, 30, 200, 30)).getGreenRatio(), 1e-9);
        assertEquals(1.0, analyzer.analyze(TestImages.uniform(16, 16, 30, 30, 200)).getBlueRatio(), 1e-9);
        assertEquals(1.0, analyzer.analyze(TestImages.uniform(16, 16, 200, 60, 30)).getWarmRatio(), 1e-9);
        // Gray has no hue
        assertEquals(0.0, analyzer.analyze(TestImages.midGray(16, 16)).getWarmRatio(), 1e-9);
    }

    @Test
    void skinToneIsDetected() {
        CharacteristicVector v = analyzer.analyze(TestImages.uniform(32, 32, 224, 172, 140));
        assertTrue(v.getSkinRatio() > 0.9, "skin " + v.getSkinRatio());
        assertTrue(v.getWarmRatio() > 0.9);
    }

    @Test
    void colorCasts() {
        CharacteristicVector reddish = analyzer.analyze(TestImages.uniform(16, 16, 180, 120, 110));
        assertTrue(reddish.getRedCast() > 0.1);
        assertTrue(reddish.getBlueCast() < 0);

        CharacteristicVector underwater = analyzer.analyze(TestImages.uniform(16, 16, 20, 120, 150));
        assertTrue(underwater.getRedCast() < -0.2);
    }

    @Test
    void analysisIsDeterministicAndDoesNotMutate() {
        Mat image = TestImages.colorful(80, 60);
        Mat before = image.clone();

        CharacteristicVector a = analyzer.analyze(image);
        CharacteristicVector b = analyzer.analyze(image);

        assertEquals(a, b);
        assertEquals(0.0, TestImages.maxAbsDiff(before, image));
    }

    @Test
    void analysisIsIdempotentAcrossNoOpOperations() throws OperationFailureException {
        Mat image = TestImages.colorful(80, 60);
        CharacteristicVector original = analyzer.analyze(image);

        Mat current = image.clone();
        for (String opType : List.of("Exposure", "ToneCurve", "Vibrance", "Denoise", "Grain", "Vignette")) {
            Mat next = OperationRegistry.requireOperation(opType)
                    .process(current, ParameterValues.EMPTY, ProcessingContext.SERIAL);
            current.release();
            current = next;
        }

        assertEquals(original, analyzer.analyze(current));
    }

    @Test
    void alphaAndSixteenBitAnalyzeLikeTheirEightBitRgb() {
        Mat rgb = TestImages.colorful(40, 30);
        CharacteristicVector expected = analyzer.analyze(rgb);

        Mat rgba = new Mat();
        Imgproc.cvtColor(rgb, rgba, Imgproc.COLOR_RGB2RGBA);
        assertEquals(expected, analyzer.analyze(PixelBuffer.wrap(rgba)));

        Mat rgb16 = new Mat();
        rgb.convertTo(rgb16, CvType.CV_16UC3, 257.0);
        assertEquals(expected, analyzer.analyze(PixelBuffer.wrap(rgb16)));
    }

    @Test
    void valuesStayInRange() {
        List<Mat> fixtures = new ArrayList<>();
        fixtures.add(TestImages.uniform(8, 8, 0, 0, 0));
        fixtures.add(TestImages.uniform(8, 8, 255, 255, 255));
        fixtures.add(TestImages.uniform(1, 1, 255, 0, 0));
        fixtures.add(TestImages.uniform(2, 1, 0, 0, 255));
        fixtures.add(TestImages.checkerboard(9, 7, 1));
        for (Mat m : fixtures) {
            CharacteristicVector v = analyzer.analyze(m);
            for (VectorField f : VectorField.values()) {
                double x = v.get(f);
                assertTrue(Double.isFinite(x));
                double lower = (f == VectorField.RED_CAST || f == VectorField.BLUE_CAST) ? -1 : 0;
                assertTrue(x >= lower && x <= 1, f + " = " + x);
            }
        }
    }

    @Test
    void blackImageIsAllDark() {
        CharacteristicVector v = analyzer.analyze(TestImages.uniform(8, 8, 0, 0, 0));
        assertEquals(1.0, v.getDarkRatio(), 1e-9);
        assertEquals(0.0, v.getBrightness(), 1e-9);
        assertEquals(0.0, v.getBrightRatio(), 1e-9);
    }
}
