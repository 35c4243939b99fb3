package com.ttennebkram.enhancer.operations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for Operation classes to declare their metadata.
 * Used for auto-registration at runtime - no compile-time registration needed.
 * {@link OperationRegistry} uses this annotation to discover operations.
 *
 * Example usage:
 * <pre>
 * {@literal @}OperationInfo(
 *     opType = "Vibrance",
 *     category = "Color",
 *     description = "Saturation boost weighted towards muted pixels"
 * )
 * public class VibranceOperation extends OperationBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface OperationInfo {

    /**
     * The operation type name (e.g., "Denoise", "ToneCurve").
     * Must match the "op" field used in preset files.
     */
    String opType();

    /**
     * Category for grouping (e.g., "Tone", "Color", "Detail").
     */
    String category();

    /**
     * Short description of what the operation does.
     */
    String description() default "";
}
