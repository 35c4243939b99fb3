package com.ttennebkram.enhancer.operations;

import com.ttennebkram.enhancer.processing.ProcessingContext;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.photo.Photo;

import java.util.List;

/**
 * Edge-aware non-local means denoising.
 * Strength is the luminance filter strength h; chroma uses h * colorRatio.
 */
@OperationInfo(opType = "Denoise", category = "Detail",
        description = "Non-local means\nPhoto.fastNlMeansDenoisingColored(src, dst, h, hColor, 7, 21)")
public class DenoiseOperation extends OperationBase {

    private static final int TEMPLATE_WINDOW = 7;
    private static final int SEARCH_WINDOW = 21;

    @Override
    protected List<ParamSpec> declareParameters() {
        return List.of(
                ParamSpec.of("strength", 0, 15, 0),
                ParamSpec.of("colorRatio", 0, 1.5, 1));
    }

    @Override
    protected Mat apply(Mat input, ParameterValues params, ProcessingContext ctx) {
        double strength = params.get("strength");
        double colorRatio = params.get("colorRatio");
        if (strength == 0) {
            return copyOf(input);
        }

        // The colored variant converts from BGR internally
        Mat bgr = new Mat();
        Mat denoised = new Mat();
        try {
            Imgproc.cvtColor(input, bgr, Imgproc.COLOR_RGB2BGR);
            Photo.fastNlMeansDenoisingColored(bgr, denoised, (float) strength, (float) (strength * colorRatio),
                    TEMPLATE_WINDOW, SEARCH_WINDOW);
            Mat output = new Mat();
            Imgproc.cvtColor(denoised, output, Imgproc.COLOR_BGR2RGB);
            return output;
        } finally {
            bgr.release();
            denoised.release();
        }
    }
}
