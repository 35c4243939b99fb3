package com.ttennebkram.enhancer.operations;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry for Operation implementations.
 * Auto-discovers operations at runtime via classpath scanning.
 * Operations must be annotated with @OperationInfo to be discovered.
 *
 * Usage:
 *   Operation op = OperationRegistry.getOperation("Denoise");
 *   Mat output = op.process(input, params, ProcessingContext.SERIAL);
 */
public class OperationRegistry {

    private static final Logger LOG = Logger.getLogger(OperationRegistry.class.getName());

    // Map from op type to the shared stateless instance
    private static final Map<String, Operation> operations = new TreeMap<>();

    // Initialization flag
    private static boolean initialized = false;

    /**
     * Initialize the registry by scanning for operation classes.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        for (Class<? extends Operation> opClass : OperationScanner.findOperationClasses()) {
            OperationInfo info = opClass.getAnnotation(OperationInfo.class);
            if (info == null) continue;

            Operation existing = operations.get(info.opType());
            if (existing != null) {
                throw new IllegalStateException("Duplicate operation type " + info.opType() + ": "
                        + existing.getClass().getName() + " and " + opClass.getName());
            }
            try {
                operations.put(info.opType(), opClass.getDeclaredConstructor().newInstance());
            } catch (ReflectiveOperationException e) {
                LOG.log(Level.WARNING, "Failed to create operation " + info.opType(), e);
            }
        }

        LOG.fine("Registered " + operations.size() + " operations: " + operations.keySet());
        initialized = true;
    }

    /**
     * Check if an operation exists for the given type.
     */
    public static boolean hasOperation(String opType) {
        initialize();
        return operations.containsKey(opType);
    }

    /**
     * Get the shared instance for the given type, or null if none is registered.
     */
    public static Operation getOperation(String opType) {
        initialize();
        return operations.get(opType);
    }

    /**
     * Like {@link #getOperation} but fails for unknown types.
     *
     * @throws IllegalArgumentException if no operation is registered for this type
     */
    public static Operation requireOperation(String opType) {
        Operation op = getOperation(opType);
        if (op == null) {
            throw new IllegalArgumentException("Unknown operation type: " + opType);
        }
        return op;
    }

    /**
     * Get all registered op types, sorted.
     */
    public static Set<String> getRegisteredTypes() {
        initialize();
        return Collections.unmodifiableSet(operations.keySet());
    }

    /**
     * Get the count of registered operations.
     */
    public static int getRegisteredCount() {
        initialize();
        return operations.size();
    }
}
