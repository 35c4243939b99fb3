package com.ttennebkram.enhancer.processing;

import com.ttennebkram.enhancer.OperationFailureException;
import org.opencv.core.Mat;

/**
 * A single step of an enhancement run with its parameters already bound.
 * Takes an 8-bit RGB Mat and returns a new one of the same shape.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (caller owns this Mat, it is not modified)
     * @return The processed output image (caller must release when done)
     */
    Mat process(Mat input) throws OperationFailureException;
}
