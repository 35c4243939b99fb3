package com.ttennebkram.enhancer;

/**
 * The input buffer cannot be processed: null, zero area, unsupported channel
 * count or bit depth, or larger than the configured pixel limit.
 */
public class InvalidImageException extends EnhancementException {

    public InvalidImageException(String message) {
        super(message);
    }
}
