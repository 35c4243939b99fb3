package com.ttennebkram.enhancer;

/**
 * An operation violated a numeric precondition (NaN or infinite values,
 * a changed buffer shape) or OpenCV reported an error while running it.
 */
public class OperationFailureException extends EnhancementException {

    private final String opType;

    public OperationFailureException(String opType, String message) {
        super("[" + opType + "] " + message);
        this.opType = opType;
    }

    public OperationFailureException(String opType, String message, Throwable cause) {
        super("[" + opType + "] " + message, cause);
        this.opType = opType;
    }

    /**
     * The operation type that failed, or the pipeline stage name for
     * failures outside a specific operation.
     */
    public String getOpType() {
        return opType;
    }
}
