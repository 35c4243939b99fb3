package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ImageProcessor;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Mat;

import java.util.List;

/**
 * A stateless numeric transform on an 8-bit RGB working image.
 *
 * Implementations are discovered by {@link OperationScanner} and must be
 * annotated with {@link OperationInfo}. A single instance may be used by any
 * number of threads at once.
 */
public interface Operation {

    String getOpType();

    String getCategory();

    String getDescription();

    /**
     * Parameter schema in declaration order.
     */
    List<ParamSpec> getParameters();

    /**
     * Apply the transform.
     *
     * @param input  8-bit RGB image (caller owns it, it is not modified)
     * @param params parameter values, missing ones take their defaults
     * @param ctx    execution settings
     * @return a new 8-bit RGB image of the same size (caller must release)
     */
    Mat process(Mat input, ParameterValues params, ProcessingContext ctx) throws OperationFailureException;

    /**
     * Bind parameters and context, giving a single-argument processor.
     */
    default ImageProcessor bind(ParameterValues params, ProcessingContext ctx) {
        return input -> process(input, params, ctx);
    }
}
