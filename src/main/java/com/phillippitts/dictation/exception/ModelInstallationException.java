package com.phillippitts.dictation.exception;

/**
 * Thrown when a downloaded artifact fails validation or archive extraction.
 * The partially installed model directory is removed before this is thrown.
 */
public class ModelInstallationException extends DictationBackendException {

    private final String modelId;

    public ModelInstallationException(String modelId, String message) {
        super(message + " (model: " + modelId + ")", ErrorCode.CORRUPTION);
        this.modelId = modelId;
    }

    public ModelInstallationException(String modelId, String message, Throwable cause) {
        super(message + " (model: " + modelId + ")", ErrorCode.CORRUPTION, cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
