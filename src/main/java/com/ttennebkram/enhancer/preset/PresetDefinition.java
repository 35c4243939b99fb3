package com.ttennebkram.enhancer.preset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of one preset: an ordered list of operation steps.
 */
public final class PresetDefinition {

    private final String id;
    private final String description;
    private final List<OperationStep> steps;

    public PresetDefinition(String id, String description, List<OperationStep> steps) {
        this.id = id;
        this.description = description != null ? description : "";
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public List<OperationStep> getSteps() {
        return steps;
    }

    /**
     * Index of the first step with this op type, or -1.
     */
    public int indexOf(String opType) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getOpType().equals(opType)) return i;
        }
        return -1;
    }

    public boolean uses(String opType) {
        return indexOf(opType) >= 0;
    }

    @Override
    public String toString() {
        return "Preset[" + id + ", " + steps.size() + " steps]";
    }
}
