package com.ttennebkram.enhancer.operations;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperationRegistryTest {

    static final Set<String> ALL_TYPES = new HashSet<>(Arrays.asList(
            "WhiteBalance", "ColorBalance", "SplitTone", "Exposure", "ToneCurve", "LocalContrast",
            "Clarity", "Denoise", "BilateralSmooth", "SkinSoften", "Saturation", "Vibrance",
            "HueShift", "Monochrome", "ChannelRestore", "Sharpen", "Vignette", "Grain"));

    @Test
    void discoversEveryOperation() {
        assertEquals(ALL_TYPES, OperationRegistry.getRegisteredTypes());
        assertEquals(18, OperationRegistry.getRegisteredCount());
    }

    @Test
    void instancesAreSharedAndDescribed() {
        for (String type : ALL_TYPES) {
            Operation op = OperationRegistry.getOperation(type);
            assertSame(op, OperationRegistry.requireOperation(type));
            assertEquals(type, op.getOpType());
            assertFalse(op.getCategory().isEmpty(), type);
            assertFalse(op.getParameters().isEmpty(), type);
            for (ParamSpec spec : op.getParameters()) {
                assertTrue(spec.contains(spec.getDefault()), type + "." + spec.getName());
            }
        }
    }

    @Test
    void unknownTypes() {
        assertFalse(OperationRegistry.hasOperation("Posterize"));
        assertNull(OperationRegistry.getOperation("Posterize"));
        assertThrows(IllegalArgumentException.class, () -> OperationRegistry.requireOperation("Posterize"));
    }

    @Test
    void scannerFindsOnlyConcreteAnnotatedOperations() {
        List<Class<? extends OperationBase>> found = OperationScanner.findOperationClasses();
        assertEquals(18, found.size());

        String previous = "";
        for (Class<? extends OperationBase> type : found) {
            assertTrue(type.isAnnotationPresent(OperationInfo.class), type.getName());
            assertFalse(Modifier.isAbstract(type.getModifiers()), type.getName());
            assertEquals(OperationScanner.OPERATIONS_PACKAGE, type.getPackage().getName());
            assertTrue(type.getName().compareTo(previous) > 0, "sorted at " + type.getName());
            previous = type.getName();
        }
    }
}
