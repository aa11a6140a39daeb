package uk.gegc.pixelperfect.features.model.domain.exception;

/**
 * The model exists but cannot serve this request (tier, scale or disabled).
 */
public class ModelNotAvailableException extends RuntimeException {

    private final String modelId;

    public ModelNotAvailableException(String modelId, String message) {
        super(message);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
