package uk.gegc.pixelperfect.features.model.domain.exception;

public class ModelNotFoundException extends RuntimeException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Unknown model: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
