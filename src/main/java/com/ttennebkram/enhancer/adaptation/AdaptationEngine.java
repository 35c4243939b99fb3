package com.ttennebkram.enhancer.adaptation;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.analysis.CharacteristicVector;
import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.operations.Operation;
import com.ttennebkram.enhancer.operations.OperationRegistry;
import com.ttennebkram.enhancer.operations.ParamSpec;
import com.ttennebkram.enhancer.operations.ParameterValues;
import com.ttennebkram.enhancer.preset.AdaptationRule;
import com.ttennebkram.enhancer.preset.OperationStep;
import com.ttennebkram.enhancer.preset.PresetDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a preset and a characteristic vector into an
 * {@link EffectiveParameterSet}. Pure: the same inputs always give the same
 * output, and nothing is shared between calls.
 *
 * For every step and every declared parameter:
 * <ol>
 *   <li>start from the preset base value, or the operation default</li>
 *   <li>apply the step's rules for that parameter in order</li>
 *   <li>apply the denoise/sharpen coupling below</li>
 *   <li>clamp to the declared range</li>
 * </ol>
 *
 * Coupling, whatever the preset says: at or above the high-noise threshold,
 * Denoise.strength never drops below its base and Sharpen.amount never rises
 * above its base. Once any Denoise step is at maximum strength every
 * Sharpen.amount is held to half its maximum.
 */
public class AdaptationEngine {

    static final String DENOISE = "Denoise";
    static final String DENOISE_STRENGTH = "strength";
    static final String SHARPEN = "Sharpen";
    static final String SHARPEN_AMOUNT = "amount";

    private final double noiseHighThreshold;

    public AdaptationEngine() {
        this(EnhancerConfig.DEFAULT_NOISE_HIGH_THRESHOLD);
    }

    public AdaptationEngine(EnhancerConfig config) {
        this(config.getNoiseHighThreshold());
    }

    public AdaptationEngine(double noiseHighThreshold) {
        this.noiseHighThreshold = noiseHighThreshold;
    }

    public double getNoiseHighThreshold() {
        return noiseHighThreshold;
    }

    /**
     * @throws OperationFailureException if a rule produces NaN or infinity
     */
    public EffectiveParameterSet adapt(PresetDefinition preset, CharacteristicVector vector)
            throws OperationFailureException {
        CharacteristicVector v = vector != null ? vector : CharacteristicVector.EMPTY;
        boolean noisy = v.getNoise() >= noiseHighThreshold;

        List<Operation> ops = new ArrayList<>();
        List<Map<String, Double>> values = new ArrayList<>();

        for (OperationStep step : preset.getSteps()) {
            Operation op = OperationRegistry.requireOperation(step.getOpType());
            Map<String, Double> stepValues = new LinkedHashMap<>();

            for (ParamSpec spec : op.getParameters()) {
                double base = step.getBase().get(spec.getName(), spec.getDefault());
                double value = base;
                for (AdaptationRule rule : step.rulesFor(spec.getName())) {
                    value = rule.apply(value, v);
                }

                if (noisy && isDenoiseStrength(op, spec)) {
                    value = Math.max(value, base);
                } else if (noisy && isSharpenAmount(op, spec)) {
                    value = Math.min(value, base);
                }

                if (!Double.isFinite(value)) {
                    throw new OperationFailureException(op.getOpType(),
                            "adapted " + spec.getName() + " is " + value + " for preset " + preset.getId());
                }
                stepValues.put(spec.getName(), spec.clamp(value));
            }
            ops.add(op);
            values.add(stepValues);
        }

        if (anyDenoiseAtMax(ops, values)) {
            for (int i = 0; i < ops.size(); i++) {
                Operation op = ops.get(i);
                if (!op.getOpType().equals(SHARPEN)) continue;
                ParamSpec amount = spec(op, SHARPEN_AMOUNT);
                values.get(i).merge(SHARPEN_AMOUNT, amount.getMax() / 2.0, Math::min);
            }
        }

        List<EffectiveParameterSet.Entry> entries = new ArrayList<>();
        for (int i = 0; i < ops.size(); i++) {
            entries.add(new EffectiveParameterSet.Entry(ops.get(i).getOpType(), ParameterValues.of(values.get(i))));
        }
        return new EffectiveParameterSet(preset.getId(), entries);
    }

    private static boolean anyDenoiseAtMax(List<Operation> ops, List<Map<String, Double>> values) {
        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);
            if (!op.getOpType().equals(DENOISE)) continue;
            ParamSpec strength = spec(op, DENOISE_STRENGTH);
            if (values.get(i).get(DENOISE_STRENGTH) >= strength.getMax()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDenoiseStrength(Operation op, ParamSpec spec) {
        return op.getOpType().equals(DENOISE) && spec.getName().equals(DENOISE_STRENGTH);
    }

    private static boolean isSharpenAmount(Operation op, ParamSpec spec) {
        return op.getOpType().equals(SHARPEN) && spec.getName().equals(SHARPEN_AMOUNT);
    }

    private static ParamSpec spec(Operation op, String name) {
        for (ParamSpec s : op.getParameters()) {
            if (s.getName().equals(name)) return s;
        }
        throw new IllegalStateException(op.getOpType() + " does not declare " + name);
    }
}
