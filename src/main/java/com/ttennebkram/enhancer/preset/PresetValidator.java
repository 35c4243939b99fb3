package com.ttennebkram.enhancer.preset;

import com.ttennebkram.enhancer.operations.Operation;
import com.ttennebkram.enhancer.operations.OperationRegistry;
import com.ttennebkram.enhancer.operations.ParamSpec;

import java.util.List;
import java.util.Map;

/**
 * Structural checks run on every preset when it is loaded.
 *
 * <ul>
 *   <li>every op type is registered and every parameter is declared by it</li>
 *   <li>base values are finite; those of parameters no rule adapts lie inside
 *       the declared range (adapted values are clamped after the rules, so their
 *       base may be an offset, e.g. a target relative to the measured brightness)</li>
 *   <li>Denoise comes before any Sharpen or Clarity</li>
 *   <li>WhiteBalance comes before any Saturation or Vibrance</li>
 *   <li>Vignette and Grain only form the tail, Grain last</li>
 * </ul>
 */
public final class PresetValidator {

    private PresetValidator() {
    }

    /**
     * @throws IllegalStateException describing the first problem found
     */
    public static void validate(PresetDefinition preset) {
        List<OperationStep> steps = preset.getSteps();
        if (steps.isEmpty()) {
            fail(preset, "has no steps");
        }

        for (OperationStep step : steps) {
            Operation op = OperationRegistry.getOperation(step.getOpType());
            if (op == null) {
                fail(preset, "unknown operation " + step.getOpType());
            }
            for (Map.Entry<String, Double> e : step.getBase().asMap().entrySet()) {
                ParamSpec spec = find(op, e.getKey());
                if (spec == null) {
                    fail(preset, step.getOpType() + " has no parameter " + e.getKey());
                } else if (!Double.isFinite(e.getValue())) {
                    fail(preset, step.getOpType() + "." + e.getKey() + " is " + e.getValue());
                } else if (step.rulesFor(e.getKey()).isEmpty() && !spec.contains(e.getValue())) {
                    fail(preset, step.getOpType() + "." + e.getKey() + " = " + e.getValue() + " outside " + spec);
                }
            }
            for (AdaptationRule rule : step.getRules()) {
                if (find(op, rule.getParam()) == null) {
                    fail(preset, step.getOpType() + " rule targets unknown parameter " + rule.getParam());
                }
            }
        }

        requireBefore(preset, "Denoise", "Sharpen");
        requireBefore(preset, "Denoise", "Clarity");
        requireBefore(preset, "WhiteBalance", "Saturation");
        requireBefore(preset, "WhiteBalance", "Vibrance");

        boolean inTail = false;
        for (int i = 0; i < steps.size(); i++) {
            String opType = steps.get(i).getOpType();
            boolean tailOp = opType.equals("Vignette") || opType.equals("Grain");
            if (inTail && !tailOp) {
                fail(preset, opType + " follows the finishing effects");
            }
            if (opType.equals("Grain") && i != steps.size() - 1) {
                fail(preset, "Grain must be the last step");
            }
            inTail |= tailOp;
        }
    }

    private static void requireBefore(PresetDefinition preset, String first, String then) {
        List<OperationStep> steps = preset.getSteps();
        int firstIndex = -1;
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getOpType().equals(first)) firstIndex = i;
        }
        for (int i = 0; i < firstIndex; i++) {
            if (steps.get(i).getOpType().equals(then)) {
                fail(preset, then + " at step " + i + " precedes " + first + " at step " + firstIndex);
            }
        }
    }

    private static ParamSpec find(Operation op, String name) {
        for (ParamSpec spec : op.getParameters()) {
            if (spec.getName().equals(name)) return spec;
        }
        return null;
    }

    private static void fail(PresetDefinition preset, String problem) {
        throw new IllegalStateException("Preset " + preset.getId() + ": " + problem);
    }
}
