package com.ttennebkram.enhancer.preset;

import com.ttennebkram.enhancer.analysis.VectorField;
import com.ttennebkram.enhancer.operations.ParameterValues;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresetValidatorTest {

    private static OperationStep step(String op) {
        return new OperationStep(op, ParameterValues.EMPTY, Collections.emptyList());
    }

    private static OperationStep step(String op, ParameterValues base, AdaptationRule... rules) {
        return new OperationStep(op, base, Arrays.asList(rules));
    }

    private static PresetDefinition preset(OperationStep... steps) {
        return new PresetDefinition("test", "", Arrays.asList(steps));
    }

    private static void assertRejected(PresetDefinition preset, String fragment) {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> PresetValidator.validate(preset));
        assertTrue(e.getMessage().startsWith("Preset test: "), e.getMessage());
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    @Test
    void builtInPresetsAreValid() {
        for (PresetType type : PresetType.values()) {
            assertDoesNotThrow(() -> PresetValidator.validate(PresetLibrary.get(type)), type.getId());
        }
    }

    @Test
    void emptyPresetIsRejected() {
        assertRejected(new PresetDefinition("test", "", List.of()), "no steps");
    }

    @Test
    void unknownOperationsAndParametersAreRejected() {
        assertRejected(preset(step("Denoise"), step("Posterize")), "unknown operation Posterize");
        assertRejected(preset(step("Denoise", ParameterValues.of("radius", 3.0))), "no parameter radius");
        assertRejected(preset(step("Denoise", ParameterValues.EMPTY,
                AdaptationRule.track("radius", VectorField.NOISE, 1.0))), "unknown parameter radius");
    }

    @Test
    void baseValuesMustBeFiniteAndInRangeUnlessAdapted() {
        assertRejected(preset(step("Denoise", ParameterValues.of("strength", Double.NaN))), "NaN");
        assertRejected(preset(step("Saturation", ParameterValues.of("scale", 3.0))), "outside");

        // A tracked target is an offset and may sit outside the range
        assertDoesNotThrow(() -> PresetValidator.validate(preset(step("Exposure", ParameterValues.of("target", 0.05),
                AdaptationRule.track("target", VectorField.BRIGHTNESS, 1.0)))));
    }

    @Test
    void denoiseMustPrecedeSharpening() {
        assertRejected(preset(step("Sharpen"), step("Denoise")), "precedes Denoise");
        assertRejected(preset(step("Denoise"), step("Clarity"), step("Denoise")), "Clarity at step 1");
        assertDoesNotThrow(() -> PresetValidator.validate(preset(step("Sharpen"))));
    }

    @Test
    void whiteBalanceMustPrecedeSaturation() {
        assertRejected(preset(step("Vibrance"), step("WhiteBalance")), "Vibrance at step 0");
        assertDoesNotThrow(() -> PresetValidator.validate(preset(step("WhiteBalance"), step("Saturation"))));
    }

    @Test
    void finishingEffectsFormTheTail() {
        assertRejected(preset(step("Vignette"), step("Saturation")), "follows the finishing effects");
        assertRejected(preset(step("Grain"), step("Vignette")), "Grain must be the last step");
        assertDoesNotThrow(() -> PresetValidator.validate(preset(step("Exposure"), step("Vignette"), step("Grain"))));
    }
}
