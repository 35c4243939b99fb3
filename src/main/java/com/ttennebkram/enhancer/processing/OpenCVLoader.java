package com.ttennebkram.enhancer.processing;

import java.util.logging.Logger;

/**
 * Loads the bundled OpenCV native library once per class loader.
 */
public final class OpenCVLoader {

    private static final Logger LOG = Logger.getLogger(OpenCVLoader.class.getName());

    private static boolean loaded = false;

    private OpenCVLoader() {
    }

    public static synchronized void load() {
        if (loaded) return;
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        LOG.fine("OpenCV native library loaded: " + org.opencv.core.Core.VERSION);
    }
}
