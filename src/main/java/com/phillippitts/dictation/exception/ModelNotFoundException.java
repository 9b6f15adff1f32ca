package com.phillippitts.dictation.exception;

/**
 * Thrown when a model id is not in the catalog, or its artifacts are not on disk
 * when a server is asked to load it.
 */
public class ModelNotFoundException extends DictationBackendException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Model not found: " + modelPath, ErrorCode.CONFIGURATION);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Model not found: " + modelPath, ErrorCode.CONFIGURATION, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
