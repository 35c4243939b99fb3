package com.ttennebkram.enhancer.adaptation;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.analysis.CharacteristicVector;
import com.ttennebkram.enhancer.analysis.VectorField;
import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.operations.ExposureOperation;
import com.ttennebkram.enhancer.operations.Operation;
import com.ttennebkram.enhancer.operations.OperationRegistry;
import com.ttennebkram.enhancer.operations.ParamSpec;
import com.ttennebkram.enhancer.operations.ParameterValues;
import com.ttennebkram.enhancer.preset.AdaptationRule;
import com.ttennebkram.enhancer.preset.OperationStep;
import com.ttennebkram.enhancer.preset.PresetDefinition;
import com.ttennebkram.enhancer.preset.PresetLibrary;
import com.ttennebkram.enhancer.preset.PresetType;
import com.ttennebkram.enhancer.preset.RuleMode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdaptationEngineTest {

    private static final Map<String, String> SATURATION_PARAMS = Map.of(
            "Saturation", "scale",
            "Vibrance", "strength",
            "HueShift", "saturationBoost");

    private final AdaptationEngine engine = new AdaptationEngine();

    private static CharacteristicVector typical() {
        return CharacteristicVector.builder()
                .brightness(0.5).contrast(0.4).noise(0.01).saturation(0.3)
                .sharpness(0.03).edgeDensity(0.1)
                .build();
    }

    private static CharacteristicVector allOnes() {
        CharacteristicVector.Builder b = CharacteristicVector.builder()
                .brightness(1).contrast(1).noise(1).saturation(1).sharpness(1).edgeDensity(1)
                .darkRatio(1).brightRatio(1).greenRatio(1).blueRatio(1).warmRatio(1).skinRatio(1);
        return b.redCast(1).blueCast(1).build();
    }

    private static CharacteristicVector negativeCasts() {
        return CharacteristicVector.builder().redCast(-1).blueCast(-1).build();
    }

    @Test
    void everyPresetAdaptsWithinDeclaredRanges() throws OperationFailureException {
        List<CharacteristicVector> vectors = Arrays.asList(
                CharacteristicVector.EMPTY, typical(), allOnes(), negativeCasts());
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            for (CharacteristicVector v : vectors) {
                EffectiveParameterSet set = engine.adapt(preset, v);
                assertEquals(preset.getSteps().size(), set.size(), type.getId());
                for (EffectiveParameterSet.Entry entry : set.getEntries()) {
                    Operation op = OperationRegistry.requireOperation(entry.getOpType());
                    assertEquals(op.getParameters().size(), entry.getValues().size());
                    for (ParamSpec spec : op.getParameters()) {
                        double value = entry.getValues().get(spec.getName());
                        assertTrue(spec.contains(value),
                                type.getId() + " " + entry.getOpType() + "." + spec.getName() + " = " + value);
                    }
                }
            }
        }
    }

    @Test
    void nullVectorIsTreatedAsEmpty() throws OperationFailureException {
        PresetDefinition preset = PresetLibrary.get(PresetType.STANDARD);
        assertEquals(engine.adapt(preset, CharacteristicVector.EMPTY).getEntries().toString(),
                engine.adapt(preset, null).getEntries().toString());
    }

    @Test
    void highNoiseNeverLowersDenoiseOrRaisesSharpen() throws OperationFailureException {
        CharacteristicVector noisy = CharacteristicVector.builder()
                .brightness(0.5).noise(0.2).sharpness(0.001).build();
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            EffectiveParameterSet set = engine.adapt(preset, noisy);
            for (int i = 0; i < preset.getSteps().size(); i++) {
                OperationStep step = preset.getSteps().get(i);
                ParameterValues values = set.getEntries().get(i).getValues();
                Operation op = OperationRegistry.requireOperation(step.getOpType());
                if (step.getOpType().equals("Denoise")) {
                    double base = clampedBase(op, step, "strength");
                    assertTrue(values.get("strength") >= base, type.getId());
                }
                if (step.getOpType().equals("Sharpen")) {
                    double base = clampedBase(op, step, "amount");
                    assertTrue(values.get("amount") <= base, type.getId());
                }
            }
        }
    }

    @Test
    void noisyImagesGetStrongerDenoise() throws OperationFailureException {
        CharacteristicVector clean = typical();
        CharacteristicVector noisy = CharacteristicVector.builder()
                .brightness(0.5).contrast(0.4).noise(0.08).saturation(0.3).sharpness(0.03).build();
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            double cleanStrength = engine.adapt(preset, clean).valuesFor("Denoise").get("strength");
            double noisyStrength = engine.adapt(preset, noisy).valuesFor("Denoise").get("strength");
            assertTrue(noisyStrength > cleanStrength, type.getId());
        }
    }

    @Test
    void darkImagesGetMoreLiftAndDenoise() throws OperationFailureException {
        CharacteristicVector normal = CharacteristicVector.builder().brightness(0.5).noise(0.01).build();
        CharacteristicVector dark = CharacteristicVector.builder().brightness(0.1).noise(0.01).build();
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            EffectiveParameterSet normalSet = engine.adapt(preset, normal);
            EffectiveParameterSet darkSet = engine.adapt(preset, dark);

            double normalExponent = exponent(normalSet, normal);
            double darkExponent = exponent(darkSet, dark);
            assertTrue(darkExponent < normalExponent,
                    type.getId() + ": " + darkExponent + " vs " + normalExponent);
            assertTrue(darkExponent < 1.0, type.getId());

            assertTrue(darkSet.valuesFor("Denoise").get("strength")
                    > normalSet.valuesFor("Denoise").get("strength"), type.getId());
        }
    }

    private static double exponent(EffectiveParameterSet set, CharacteristicVector v) {
        ParameterValues exposure = set.valuesFor("Exposure");
        assertNotNull(exposure);
        return ExposureOperation.exponent(v.getBrightness(), exposure.get("target"), exposure.get("strength"));
    }

    @Test
    void saturatedImagesAreNotPushedFurther() throws OperationFailureException {
        CharacteristicVector muted = CharacteristicVector.builder().brightness(0.5).saturation(0.3).build();
        CharacteristicVector vivid = CharacteristicVector.builder().brightness(0.5).saturation(0.9).build();
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            EffectiveParameterSet mutedSet = engine.adapt(preset, muted);
            EffectiveParameterSet vividSet = engine.adapt(preset, vivid);
            for (String op : new String[]{"Saturation", "Vibrance", "HueShift"}) {
                String param = SATURATION_PARAMS.get(op);
                List<ParameterValues> m = mutedSet.allValuesFor(op);
                List<ParameterValues> s = vividSet.allValuesFor(op);
                for (int i = 0; i < m.size(); i++) {
                    assertTrue(s.get(i).get(param) <= m.get(i).get(param), type.getId() + " " + op);
                }
            }
            ParameterValues vividSaturation = vividSet.valuesFor("Saturation");
            if (vividSaturation != null) {
                assertTrue(vividSaturation.get("scale") <= 1.0 + 1e-9, type.getId());
            }
        }
    }

    @Test
    void saturatedImagesGetSmallerHueWindowBoost() throws OperationFailureException {
        CharacteristicVector muted = CharacteristicVector.builder().brightness(0.5).saturation(0.3).build();
        CharacteristicVector vivid = CharacteristicVector.builder().brightness(0.5).saturation(0.9).build();
        for (PresetType type : new PresetType[]{PresetType.JUNGLE, PresetType.OCEAN}) {
            PresetDefinition preset = PresetLibrary.get(type);
            double mutedBoost = maxBoost(engine.adapt(preset, muted));
            double vividBoost = maxBoost(engine.adapt(preset, vivid));
            assertTrue(mutedBoost > 0, type.getId());
            assertTrue(vividBoost < mutedBoost, type.getId() + " " + vividBoost + " vs " + mutedBoost);
        }
    }

    private static double maxBoost(EffectiveParameterSet set) {
        double max = 0;
        for (ParameterValues values : set.allValuesFor("HueShift")) {
            max = Math.max(max, values.get("saturationBoost"));
        }
        return max;
    }

    @Test
    void softImagesGetMoreSharpening() throws OperationFailureException {
        CharacteristicVector crisp = CharacteristicVector.builder().brightness(0.5).sharpness(0.05).build();
        CharacteristicVector soft = CharacteristicVector.builder().brightness(0.5).sharpness(0.005).build();
        int checked = 0;
        for (PresetType type : PresetType.values()) {
            PresetDefinition preset = PresetLibrary.get(type);
            ParameterValues crispSharpen = engine.adapt(preset, crisp).valuesFor("Sharpen");
            if (crispSharpen == null) continue;
            ParameterValues softSharpen = engine.adapt(preset, soft).valuesFor("Sharpen");
            assertTrue(softSharpen.get("amount") > crispSharpen.get("amount"), type.getId());
            checked++;
        }
        assertTrue(checked >= 5);
    }

    @Test
    void denoiseAtMaximumHoldsSharpenToHalf() throws OperationFailureException {
        PresetDefinition preset = new PresetDefinition("custom", "", Arrays.asList(
                new OperationStep("Denoise", ParameterValues.of("strength", 15.0), Collections.emptyList()),
                new OperationStep("Sharpen", ParameterValues.of("amount", 1.2), Collections.emptyList())));

        EffectiveParameterSet set = engine.adapt(preset, CharacteristicVector.EMPTY);

        assertEquals(15.0, set.valuesFor("Denoise").get("strength"), 1e-12);
        assertEquals(0.75, set.valuesFor("Sharpen").get("amount"), 1e-12);
    }

    @Test
    void rulesAreAppliedInOrderThenClamped() throws OperationFailureException {
        PresetDefinition preset = new PresetDefinition("custom", "", Collections.singletonList(
                new OperationStep("Saturation", ParameterValues.of("scale", 1.5), Arrays.asList(
                        AdaptationRule.ramp("scale", VectorField.BRIGHTNESS, RuleMode.ADD, 0, 1, 1.0),
                        AdaptationRule.ramp("scale", VectorField.BRIGHTNESS, RuleMode.SCALE, 0, 1, -0.5)))));

        CharacteristicVector v = CharacteristicVector.builder().brightness(0.5).build();
        // (1.5 + 0.5) * (1 - 0.25)
        assertEquals(1.5, engine.adapt(preset, v).valuesFor("Saturation").get("scale"), 1e-12);

        CharacteristicVector bright = CharacteristicVector.builder().brightness(1.0).build();
        // (1.5 + 1) * 0.5 = 1.25, unclamped
        assertEquals(1.25, engine.adapt(preset, bright).valuesFor("Saturation").get("scale"), 1e-12);

        PresetDefinition high = new PresetDefinition("custom", "", Collections.singletonList(
                new OperationStep("Saturation", ParameterValues.of("scale", 1.8), Collections.singletonList(
                        AdaptationRule.track("scale", VectorField.BRIGHTNESS, 1.0)))));
        assertEquals(2.0, engine.adapt(high, bright).valuesFor("Saturation").get("scale"), 1e-12);
    }

    @Test
    void nonFiniteResultIsAnOperationFailure() {
        PresetDefinition preset = new PresetDefinition("custom", "", Collections.singletonList(
                new OperationStep("Saturation", ParameterValues.of("scale", 10.0), Collections.singletonList(
                        AdaptationRule.ramp("scale", VectorField.BRIGHTNESS, RuleMode.SCALE, 0, 1, 1e308)))));
        CharacteristicVector bright = CharacteristicVector.builder().brightness(1.0).build();

        OperationFailureException e = assertThrows(OperationFailureException.class,
                () -> engine.adapt(preset, bright));
        assertEquals("Saturation", e.getOpType());
    }

    @Test
    void adaptationIsDeterministic() throws OperationFailureException {
        PresetDefinition preset = PresetLibrary.get(PresetType.PORTRAIT);
        CharacteristicVector v = CharacteristicVector.builder()
                .brightness(0.23).noise(0.031).skinRatio(0.03).saturation(0.6).sharpness(0.012).build();
        assertEquals(engine.adapt(preset, v).toJson(), engine.adapt(preset, v).toJson());
    }

    @Test
    void thresholdComesFromConfig() {
        EnhancerConfig config = EnhancerConfig.builder().noiseHighThreshold(0.02).build();
        assertEquals(0.02, new AdaptationEngine(config).getNoiseHighThreshold());
    }

    private static double clampedBase(Operation op, OperationStep step, String name) {
        for (ParamSpec spec : op.getParameters()) {
            if (spec.getName().equals(name)) {
                return spec.clamp(step.getBase().get(name, spec.getDefault()));
            }
        }
        throw new IllegalArgumentException(name);
    }
}
