package com.ttennebkram.enhancer.preset;

import com.ttennebkram.enhancer.operations.ParameterValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of a preset: an operation type, its base parameter values and
 * the rules that adapt them to the image.
 */
public final class OperationStep {

    private final String opType;
    private final ParameterValues base;
    private final List<AdaptationRule> rules;

    public OperationStep(String opType, ParameterValues base, List<AdaptationRule> rules) {
        this.opType = opType;
        this.base = base != null ? base : ParameterValues.EMPTY;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules != null ? rules : List.of()));
    }

    public String getOpType() {
        return opType;
    }

    /**
     * Base values as written in the preset; parameters not listed use the
     * operation's defaults.
     */
    public ParameterValues getBase() {
        return base;
    }

    public List<AdaptationRule> getRules() {
        return rules;
    }

    /**
     * Rules for one parameter, in declaration order.
     */
    public List<AdaptationRule> rulesFor(String param) {
        List<AdaptationRule> result = new ArrayList<>();
        for (AdaptationRule rule : rules) {
            if (rule.getParam().equals(param)) result.add(rule);
        }
        return result;
    }

    @Override
    public String toString() {
        return opType + base;
    }
}
