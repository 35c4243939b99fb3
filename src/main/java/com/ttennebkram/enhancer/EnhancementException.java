package com.ttennebkram.enhancer;

/**
 * Base class for failures that end an enhancement invocation.
 * None of these are retried inside the core.
 */
public abstract class EnhancementException extends Exception {

    protected EnhancementException(String message) {
        super(message);
    }

    protected EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
