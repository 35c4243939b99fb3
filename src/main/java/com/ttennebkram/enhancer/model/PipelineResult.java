package com.ttennebkram.enhancer.model;

import com.ttennebkram.enhancer.EnhancementException;
import com.ttennebkram.enhancer.adaptation.EffectiveParameterSet;
import com.ttennebkram.enhancer.analysis.CharacteristicVector;

/**
 * Outcome of one enhancement invocation: either the enhanced buffer with
 * the data that produced it, or the failure that ended the run.
 */
public final class PipelineResult {

    private final String presetId;
    private final PixelBuffer output;
    private final CharacteristicVector characteristics;
    private final EffectiveParameterSet parameters;
    private final EncodingAdvice encodingAdvice;
    private final EnhancementException error;
    private final long elapsedMillis;

    private PipelineResult(String presetId, PixelBuffer output, CharacteristicVector characteristics,
                           EffectiveParameterSet parameters, EncodingAdvice encodingAdvice,
                           EnhancementException error, long elapsedMillis) {
        this.presetId = presetId;
        this.output = output;
        this.characteristics = characteristics;
        this.parameters = parameters;
        this.encodingAdvice = encodingAdvice;
        this.error = error;
        this.elapsedMillis = elapsedMillis;
    }

    public static PipelineResult success(String presetId, PixelBuffer output, CharacteristicVector characteristics,
                                         EffectiveParameterSet parameters, EncodingAdvice encodingAdvice,
                                         long elapsedMillis) {
        return new PipelineResult(presetId, output, characteristics, parameters, encodingAdvice, null, elapsedMillis);
    }

    public static PipelineResult failure(String presetId, EnhancementException error, long elapsedMillis) {
        return new PipelineResult(presetId, null, null, null, null, error, elapsedMillis);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getPresetId() {
        return presetId;
    }

    /** Enhanced buffer, or null on failure. */
    public PixelBuffer getOutput() {
        return output;
    }

    /** Characteristics of the input image, or null on failure. */
    public CharacteristicVector getCharacteristics() {
        return characteristics;
    }

    /** Parameters actually applied, or null on failure. */
    public EffectiveParameterSet getParameters() {
        return parameters;
    }

    /** Encoder settings for the output, or null on failure. */
    public EncodingAdvice getEncodingAdvice() {
        return encodingAdvice;
    }

    /** The failure, or null on success. */
    public EnhancementException getError() {
        return error;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * The output buffer, or the failure rethrown.
     */
    public PixelBuffer getOrThrow() throws EnhancementException {
        if (error != null) {
            throw error;
        }
        return output;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "PipelineResult[" + presetId + ", failed: " + error.getMessage() + "]";
        }
        return "PipelineResult[" + presetId + ", " + output + ", " + elapsedMillis + " ms]";
    }
}
