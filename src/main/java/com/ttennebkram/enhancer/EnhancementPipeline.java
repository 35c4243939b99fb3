package com.ttennebkram.enhancer;

import com.ttennebkram.enhancer.adaptation.AdaptationEngine;
import com.ttennebkram.enhancer.adaptation.EffectiveParameterSet;
import com.ttennebkram.enhancer.analysis.CharacteristicVector;
import com.ttennebkram.enhancer.analysis.ImageAnalyzer;
import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.model.EncodingAdvice;
import com.ttennebkram.enhancer.model.OutputFormat;
import com.ttennebkram.enhancer.model.PipelineResult;
import com.ttennebkram.enhancer.model.PixelBuffer;
import com.ttennebkram.enhancer.operations.OperationRegistry;
import com.ttennebkram.enhancer.preset.PresetDefinition;
import com.ttennebkram.enhancer.preset.PresetLibrary;
import com.ttennebkram.enhancer.preset.PresetType;
import com.ttennebkram.enhancer.processing.ImageProcessor;
import com.ttennebkram.enhancer.processing.ProcessingContext;
import com.ttennebkram.enhancer.processing.WorkingImages;
import org.opencv.core.CvException;
import org.opencv.core.Mat;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one preset over one image.
 *
 * Order of work: resolve the preset, validate the buffer, analyze once,
 * adapt once, then apply every step of the preset strictly in order. The
 * caller's buffer is never modified. Instances are immutable and may be
 * shared by any number of threads.
 *
 * Usage:
 *   EnhancementPipeline pipeline = new EnhancementPipeline();
 *   PipelineResult result = pipeline.enhance(buffer, "night", OutputFormat.JPG);
 *   PixelBuffer enhanced = result.getOrThrow();
 */
public class EnhancementPipeline {

    private static final Logger LOG = Logger.getLogger(EnhancementPipeline.class.getName());

    static final String PIPELINE_STAGE = "Pipeline";

    private final EnhancerConfig config;
    private final ImageAnalyzer analyzer;
    private final AdaptationEngine adaptationEngine;
    private final EncodingAdvisor encodingAdvisor;
    private final ProcessingContext context;

    public EnhancementPipeline() {
        this(EnhancerConfig.load());
    }

    public EnhancementPipeline(EnhancerConfig config) {
        this.config = config;
        this.analyzer = new ImageAnalyzer();
        this.adaptationEngine = new AdaptationEngine(config);
        this.encodingAdvisor = new EncodingAdvisor();
        this.context = ProcessingContext.of(config.isParallel());
    }

    public EnhancerConfig getConfig() {
        return config;
    }

    public PipelineResult enhance(PixelBuffer buffer, PresetType preset, OutputFormat format) {
        return enhance(buffer, preset.getId(), format, ProgressListener.NONE);
    }

    public PipelineResult enhance(PixelBuffer buffer, String presetId, OutputFormat format) {
        return enhance(buffer, presetId, format, ProgressListener.NONE);
    }

    /**
     * Enhance a buffer. Never throws for bad input: failures are returned
     * inside the result.
     */
    public PipelineResult enhance(PixelBuffer buffer, String presetId, OutputFormat format,
                                  ProgressListener listener) {
        long start = System.nanoTime();
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        OutputFormat outputFormat = format != null ? format : OutputFormat.JPG;
        try {
            PipelineResult result = run(buffer, presetId, outputFormat, progress, start);
            LOG.info(String.format("Enhanced %s with preset %s in %d ms (%s)",
                    buffer, presetId, result.getElapsedMillis(), result.getEncodingAdvice()));
            return result;
        } catch (EnhancementException e) {
            LOG.log(Level.WARNING, "Enhancement with preset " + presetId + " failed: " + e.getMessage(), e);
            return PipelineResult.failure(presetId, e, elapsedMillis(start));
        }
    }

    private PipelineResult run(PixelBuffer buffer, String presetId, OutputFormat format,
                               ProgressListener progress, long start) throws EnhancementException {
        // Unknown presets fail before any pixel work
        PresetDefinition preset = PresetLibrary.get(presetId);
        validate(buffer);

        Mat current = null;
        try {
            current = WorkingImages.toWorkingRgb(buffer);

            progress.onProgress(ProgressListener.Stage.ANALYZING, presetId, 5);
            CharacteristicVector characteristics = analyzer.analyze(current);
            LOG.fine("Characteristics: " + characteristics);

            progress.onProgress(ProgressListener.Stage.ADAPTING, presetId, 15);
            EffectiveParameterSet parameters = adaptationEngine.adapt(preset, characteristics);
            logParameters(parameters);

            List<EffectiveParameterSet.Entry> entries = parameters.getEntries();
            for (int i = 0; i < entries.size(); i++) {
                EffectiveParameterSet.Entry entry = entries.get(i);
                progress.onProgress(ProgressListener.Stage.OPERATION, entry.getOpType(),
                        20 + (70 * i) / entries.size());

                ImageProcessor processor = OperationRegistry.requireOperation(entry.getOpType())
                        .bind(entry.getValues(), context);
                long opStart = System.nanoTime();
                Mat next = processor.process(current);
                current.release();
                current = next;
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine(String.format("%s done in %.1f ms", entry.getOpType(), (System.nanoTime() - opStart) / 1e6));
                }
            }

            PixelBuffer output = WorkingImages.toOutput(current, buffer, format);
            if (!output.sameShape(buffer)) {
                output.release();
                throw new OperationFailureException(PIPELINE_STAGE, "output shape " + output + " differs from input " + buffer);
            }
            EncodingAdvice advice = encodingAdvisor.advise(analyzer.analyze(current), format);

            progress.onProgress(ProgressListener.Stage.COMPLETE, presetId, 100);
            return PipelineResult.success(presetId, output, characteristics, parameters, advice, elapsedMillis(start));
        } catch (CvException e) {
            throw new OperationFailureException(PIPELINE_STAGE, "OpenCV error: " + e.getMessage(), e);
        } finally {
            if (current != null) {
                current.release();
            }
        }
    }

    /**
     * @throws InvalidImageException if the buffer cannot be enhanced
     */
    void validate(PixelBuffer buffer) throws InvalidImageException {
        if (buffer == null) {
            throw new InvalidImageException("No image");
        }
        if (buffer.isEmpty()) {
            throw new InvalidImageException("Image has zero area: " + buffer);
        }
        if (buffer.getChannels() != 3 && buffer.getChannels() != 4) {
            throw new InvalidImageException("Unsupported channel count " + buffer.getChannels() + ", expected RGB or RGBA");
        }
        if (buffer.getBitDepth() == 0) {
            throw new InvalidImageException("Unsupported sample type, expected 8 or 16 bits per channel");
        }
        long pixels = (long) buffer.getWidth() * buffer.getHeight();
        if (pixels > config.getMaxPixels()) {
            throw new InvalidImageException("Image has " + pixels + " pixels, limit is " + config.getMaxPixels());
        }
    }

    private void logParameters(EffectiveParameterSet parameters) {
        Level level = config.isLogParameters() ? Level.INFO : Level.FINE;
        if (LOG.isLoggable(level)) {
            LOG.log(level, "Effective parameters:\n" + parameters.toJson());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
