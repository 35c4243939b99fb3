package com.ttennebkram.enhancer;

/**
 * Receives stage callbacks from {@link EnhancementPipeline}.
 * Called on the invoking thread; implementations should return quickly.
 */
@FunctionalInterface
public interface ProgressListener {

    enum Stage {
        ANALYZING,
        ADAPTING,
        OPERATION,
        COMPLETE
    }

    /**
     * @param stage   current stage
     * @param detail  op type for {@link Stage#OPERATION}, preset id otherwise
     * @param percent overall progress, 0..100
     */
    void onProgress(Stage stage, String detail, int percent);

    ProgressListener NONE = (stage, detail, percent) -> { };
}
