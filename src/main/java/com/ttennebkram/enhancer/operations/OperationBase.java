package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.OperationFailureException;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for operations.
 * Resolves parameters against the schema, checks the input and output
 * shape, and turns OpenCV errors into {@link OperationFailureException}.
 * Subclasses implement {@link #apply}.
 */
public abstract class OperationBase implements Operation {

    private final OperationInfo info = getClass().getAnnotation(OperationInfo.class);

    private final List<ParamSpec> parameters = Collections.unmodifiableList(declareParameters());

    /**
     * Parameter schema of this operation, called once at construction.
     */
    protected abstract List<ParamSpec> declareParameters();

    /**
     * Do the work. Parameters are finite, clamped and complete.
     */
    protected abstract Mat apply(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException;

    @Override
    public String getOpType() {
        return info != null ? info.opType() : getClass().getSimpleName();
    }

    @Override
    public String getCategory() {
        return info != null ? info.category() : "";
    }

    @Override
    public String getDescription() {
        return info != null ? info.description() : "";
    }

    @Override
    public List<ParamSpec> getParameters() {
        return parameters;
    }

    public ParamSpec getParameter(String name) {
        for (ParamSpec spec : parameters) {
            if (spec.getName().equals(name)) return spec;
        }
        return null;
    }

    /**
     * All parameters at their defaults.
     */
    public ParameterValues defaults() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (ParamSpec spec : parameters) {
            map.put(spec.getName(), spec.getDefault());
        }
        return ParameterValues.of(map);
    }

    /** Largest array the JVM reliably allocates. */
    static final long MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    /**
     * Length of a Java array holding {@code valuesPerPixel} values for every
     * pixel of a rows x cols image.
     *
     * @throws OperationFailureException if the image is too large for one array
     */
    static int arrayLength(String opType, int rows, int cols, int valuesPerPixel)
            throws OperationFailureException {
        long length = (long) rows * cols * valuesPerPixel;
        if (length > MAX_ARRAY_LENGTH) {
            throw new OperationFailureException(opType, cols + "x" + rows + " image needs " + length
                    + " array elements, more than " + MAX_ARRAY_LENGTH);
        }
        return (int) length;
    }

    @Override
    public final Mat process(Mat input, ParameterValues params, ProcessingContext ctx)
            throws OperationFailureException {
        if (isInvalidInput(input)) {
            throw new OperationFailureException(getOpType(), "expected a non-empty 8-bit RGB image");
        }
        ParameterValues resolved = resolve(params);
        Mat output;
        try {
            output = apply(input, resolved, ctx != null ? ctx : ProcessingContext.SERIAL);
        } catch (CvException e) {
            throw new OperationFailureException(getOpType(), "OpenCV error: " + e.getMessage(), e);
        }
        if (output.rows() != input.rows() || output.cols() != input.cols() || output.type() != input.type()) {
            output.release();
            throw new OperationFailureException(getOpType(), "output shape differs from input");
        }
        return output;
    }

    /**
     * Fill in defaults and clamp to the declared ranges.
     *
     * @throws OperationFailureException on NaN or infinite values
     * @throws IllegalArgumentException on a parameter name the schema does not declare
     */
    ParameterValues resolve(ParameterValues params) throws OperationFailureException {
        ParameterValues given = params != null ? params : ParameterValues.EMPTY;
        for (String name : given.asMap().keySet()) {
            if (getParameter(name) == null) {
                throw new IllegalArgumentException(getOpType() + " has no parameter " + name);
            }
        }
        Map<String, Double> map = new LinkedHashMap<>();
        for (ParamSpec spec : parameters) {
            double v = given.get(spec.getName(), spec.getDefault());
            if (!Double.isFinite(v)) {
                throw new OperationFailureException(getOpType(), "parameter " + spec.getName() + " is " + v);
            }
            map.put(spec.getName(), spec.clamp(v));
        }
        return ParameterValues.of(map);
    }

    /**
     * Standard null/empty/type check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty() || input.type() != CvType.CV_8UC3;
    }

    /**
     * Unchanged copy, for parameter values that make the operation a no-op.
     */
    protected Mat copyOf(Mat input) {
        Mat copy = new Mat();
        input.copyTo(copy);
        return copy;
    }

    @Override
    public String toString() {
        return getOpType() + parameters;
    }
}
